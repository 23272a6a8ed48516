package org.smileyface.riskcrawler.crawler;

import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Scheduling arithmetic shared by the frontier implementations and by resume: revisit intervals per
 * risk band, exponential backoff after transient failures, and post-visit priority.
 */
public class RevisitPolicy {

    private final CrawlerProperties.FrontierConfig config;

    public RevisitPolicy(CrawlerProperties properties) {
        this.config = Objects.requireNonNull(properties, "properties").getFrontier();
    }

    /**
     * Revisit interval for a target whose current verdict is {@code verdict}. Targets without a verdict
     * are treated as low risk.
     */
    public Duration revisitInterval(Verdict verdict) {
        RiskBand band = verdict == null ? RiskBand.LOW : verdict.band();
        return Duration.ofMillis(config.revisitIntervalMs(band));
    }

    /**
     * Delay before retry number {@code failures}: min(backoffMax, backoffBase * 2^(failures-1)).
     */
    public Duration backoff(int failures) {
        int exp = Math.max(0, failures - 1);
        long base = config.getBackoffBaseMs();
        long max = config.getBackoffMaxMs();
        long delay = base;
        for (int i = 0; i < exp && delay < max; i++) {
            delay *= 2;
        }
        return Duration.ofMillis(Math.min(max, delay));
    }

    public boolean retriesExhausted(int failures) {
        return failures >= config.getMaxRetries();
    }

    public double defaultPriority() {
        return config.getDefaultPriority();
    }

    /**
     * Priority after a successful visit: higher prior risk raises revisit priority.
     */
    public double priorityAfterVisit(Verdict verdict) {
        double risk = verdict == null ? 0.0 : verdict.riskScore();
        return config.getDefaultPriority() + risk * config.getRiskPriorityBoost();
    }

    /**
     * Earliest next visit of a completed target, or null when the target was never visited.
     */
    public Instant nextVisit(Target target, Verdict current) {
        if (target.lastVisitedAt() == null) return null;
        return target.lastVisitedAt().plus(revisitInterval(current));
    }

    /**
     * Applies a release outcome to a claimed entry. {@code next} is null when the target must never be
     * scheduled again.
     */
    public Rescheduling reschedule(FrontierEntry claimed, FetchOutcome outcome, Verdict verdict, Instant now) {
        Objects.requireNonNull(outcome, "outcome");
        switch (outcome) {
            case SUCCESS -> {
                Instant notBefore = now.plus(revisitInterval(verdict));
                FrontierEntry next = new FrontierEntry(claimed.identifier(), claimed.kind(),
                        priorityAfterVisit(verdict), claimed.discoveredAt(), notBefore, 0);
                return new Rescheduling(next, new FrontierRelease(TargetStatus.DONE, notBefore, 0));
            }
            case TRANSIENT_FAILURE -> {
                int failures = claimed.failures() + 1;
                if (retriesExhausted(failures)) {
                    return new Rescheduling(null, new FrontierRelease(TargetStatus.PERMANENTLY_FAILED, null, failures));
                }
                Instant notBefore = now.plus(backoff(failures));
                FrontierEntry next = new FrontierEntry(claimed.identifier(), claimed.kind(),
                        claimed.priority(), claimed.discoveredAt(), notBefore, failures);
                return new Rescheduling(next, new FrontierRelease(TargetStatus.PENDING, notBefore, failures));
            }
            default -> {
                return new Rescheduling(null,
                        new FrontierRelease(TargetStatus.PERMANENTLY_FAILED, null, claimed.failures()));
            }
        }
    }

    public record Rescheduling(FrontierEntry next, FrontierRelease release) {
    }
}
