package org.smileyface.riskcrawler.service;

import org.smileyface.riskcrawler.classifier.ScorerHealth;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.crawler.TargetCanonicalizer;
import org.smileyface.riskcrawler.model.PipelineHealth;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetDetails;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetPage;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.processor.ProcessorManager;
import org.smileyface.riskcrawler.store.StateStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Read side of the pipeline: listings, lookups, aggregates and health. Holds no state of its own.
 */
@Service
public class PipelineQueryService {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    private final StateStore store;
    private final Frontier frontier;
    private final ProcessorManager processorManager;
    private final ScorerHealth scorerHealth;
    private final Clock clock;

    public PipelineQueryService(StateStore store,
                                Frontier frontier,
                                ProcessorManager processorManager,
                                ScorerHealth scorerHealth,
                                Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.processorManager = Objects.requireNonNull(processorManager, "processorManager");
        this.scorerHealth = Objects.requireNonNull(scorerHealth, "scorerHealth");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalArgumentException for a negative offset or a limit outside 1..500
     */
    public TargetPage listTargets(RiskBand band, TargetKind kind, int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return store.listByRiskBand(band, kind, offset, limit);
    }

    /**
     * Looks a target up by any accepted spelling of its identifier.
     *
     * @throws NoSuchElementException when the target is unknown
     */
    public TargetDetails lookup(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("id must not be null/blank");
        }
        String id = TargetCanonicalizer.tryCanonicalize(identifier, null).orElse(identifier.trim());
        Target target = store.getTarget(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown target " + id));
        Verdict current = store.currentVerdict(id).orElse(null);
        return new TargetDetails(target, current, current == null ? null : current.band(), store.verdictHistory(id));
    }

    public PipelineStats stats() {
        return store.stats(clock.instant());
    }

    public PipelineHealth health() {
        ScorerHealth.Snapshot scorer = scorerHealth.snapshot();
        return new PipelineHealth(processorManager.isRunning(), processorManager.getStatuses().size(),
                frontier.size(), frontier.inProgressCount(), scorer.scorerEnabled(), scorer.degraded(),
                scorer.consecutiveUnavailable(), scorer.degradedSince(), scorer.lastReason());
    }
}
