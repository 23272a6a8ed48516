package org.smileyface.riskcrawler.classifier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Pipeline health signal for the model scorer. The pipeline is degraded while the most recent
 * scorer call was unavailable; transitions are logged once each.
 */
public class ScorerHealth {

    private static final Logger log = LogManager.getLogger();

    private final Clock clock;
    private final boolean scorerEnabled;

    private boolean degraded;
    private long consecutiveUnavailable;
    private Instant degradedSince;
    private String lastReason;
    private long totalCalls;
    private long totalUnavailable;

    public ScorerHealth(Clock clock, boolean scorerEnabled) {
        this.clock = clock;
        this.scorerEnabled = scorerEnabled;
    }

    public synchronized void record(ModelScore score) {
        totalCalls++;
        if (score.isAvailable()) {
            if (degraded) {
                log.info("Model scorer recovered after {} unavailable calls (degraded since {})",
                        consecutiveUnavailable, degradedSince);
            }
            degraded = false;
            consecutiveUnavailable = 0;
            degradedSince = null;
            lastReason = null;
            return;
        }
        totalUnavailable++;
        consecutiveUnavailable++;
        lastReason = score.unavailableReason();
        if (!degraded) {
            degraded = true;
            degradedSince = clock.instant();
            if (scorerEnabled) {
                log.warn("Model scorer unavailable ({}); classifying rule-only until it recovers", lastReason);
            } else {
                log.info("Model scorer disabled; classifying rule-only");
            }
        }
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(scorerEnabled, degraded, consecutiveUnavailable, degradedSince, lastReason,
                totalCalls, totalUnavailable);
    }

    public synchronized boolean isDegraded() {
        return degraded;
    }

    public record Snapshot(boolean scorerEnabled,
                           boolean degraded,
                           long consecutiveUnavailable,
                           Instant degradedSince,
                           String lastReason,
                           long totalCalls,
                           long totalUnavailable) {
    }
}
