package org.smileyface.riskcrawler.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.classifier.RiskEnsemble;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.crawler.FrontierRelease;
import org.smileyface.riskcrawler.crawler.RevisitPolicy;
import org.smileyface.riskcrawler.crawler.TargetCanonicalizer;
import org.smileyface.riskcrawler.extractor.ContentExtractor;
import org.smileyface.riskcrawler.extractor.ExtractedContent;
import org.smileyface.riskcrawler.feedback.FeedbackQueue;
import org.smileyface.riskcrawler.fetch.FetchClient;
import org.smileyface.riskcrawler.model.FeedbackReason;
import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FetchResult;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.store.StateStore;
import org.smileyface.riskcrawler.store.StoreWriteException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * One target's processing cycle: fetch, extract, classify, persist, release. Strictly sequential
 * within a target; every failure is folded back into Frontier and State Store transitions so a
 * single target can never take a worker down.
 */
@Component
public class TargetPipeline {

    private static final Logger log = LoggerFactory.getLogger(TargetPipeline.class);

    private final Frontier frontier;
    private final FetchClient fetchClient;
    private final ContentExtractor extractor;
    private final RiskEnsemble ensemble;
    private final StateStore store;
    private final FeedbackQueue feedbackQueue;
    private final RevisitPolicy policy;
    private final Clock clock;

    public TargetPipeline(Frontier frontier,
                          FetchClient fetchClient,
                          ContentExtractor extractor,
                          RiskEnsemble ensemble,
                          StateStore store,
                          FeedbackQueue feedbackQueue,
                          RevisitPolicy policy,
                          Clock clock) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.fetchClient = Objects.requireNonNull(fetchClient, "fetchClient");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble");
        this.store = Objects.requireNonNull(store, "store");
        this.feedbackQueue = Objects.requireNonNull(feedbackQueue, "feedbackQueue");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Processes a claimed entry and releases (or requeues) it.
     */
    public CycleResult process(FrontierEntry entry) {
        String id = entry.identifier();
        Target target = null;
        try {
            target = store.getTarget(id).orElseGet(() -> Target.discovered(id, entry.kind(),
                    TargetCanonicalizer.domainOf(id), entry.discoveredAt()));
            store.putTarget(target.withStatus(TargetStatus.IN_PROGRESS));

            FetchResult result = fetchClient.fetch(id, entry.kind());
            if (result.outcome() == FetchOutcome.SUCCESS) {
                return onSuccess(target, entry.kind(), result);
            }
            return onFailure(target, result.outcome(), result.failureReason());
        } catch (StoreWriteException e) {
            log.error("Store write failed for {}; returning it to pending", id, e);
            rollBack(id, target);
            return CycleResult.ROLLED_BACK;
        } catch (RuntimeException e) {
            log.warn("Unexpected error processing {}; treating as transient failure", id, e);
            return onUnexpected(target, entry, e);
        }
    }

    private CycleResult onSuccess(Target target, TargetKind kind, FetchResult result) {
        String id = target.identifier();
        Instant now = clock.instant();
        ExtractedContent content = extractor.extract(result, kind);
        FetchResult withLinks = result.withDiscoveredTargets(content.discoveredTargets());
        int added = registerDiscovered(withLinks.discoveredTargets(), now);

        Verdict previous = store.currentVerdict(id).orElse(null);
        Verdict verdict = ensemble.classify(content.text(), id, previous);
        store.recordVerdict(target.visited(now), verdict);
        if (ensemble.isUncertain(verdict)) {
            feedbackQueue.enqueue(verdict, FeedbackReason.LOW_CONFIDENCE);
        }
        FrontierRelease release = frontier.release(id, FetchOutcome.SUCCESS, verdict);
        log.info("Classified {} as {} (p={}, risk={}, band={}, discovered={}, new={}, next={})",
                id, verdict.label().wireName(), verdict.probability(), verdict.riskScore(), verdict.band(),
                withLinks.discoveredTargets().size(), added, release.notBefore());
        return CycleResult.CLASSIFIED;
    }

    private CycleResult onFailure(Target target, FetchOutcome outcome, String reason) {
        String id = target.identifier();
        FrontierRelease release = frontier.release(id, outcome, null);
        store.putTarget(target.failed(release.status(), reason));
        if (release.isTerminal()) {
            log.info("Target {} permanently failed after {} failures: {}", id, release.failures(), reason);
            return CycleResult.FAILED_PERMANENTLY;
        }
        log.warn("Transient failure #{} for {}: {} (retry at {})", release.failures(), id, reason, release.notBefore());
        return CycleResult.RETRY_SCHEDULED;
    }

    private CycleResult onUnexpected(Target target, FrontierEntry entry, RuntimeException error) {
        String id = entry.identifier();
        String reason = error.getClass().getSimpleName() + ": " + error.getMessage();
        try {
            FrontierRelease release = frontier.release(id, FetchOutcome.TRANSIENT_FAILURE, null);
            if (target != null) {
                store.putTarget(target.failed(release.status(), reason));
            }
            return release.isTerminal() ? CycleResult.FAILED_PERMANENTLY : CycleResult.RETRY_SCHEDULED;
        } catch (IllegalStateException e) {
            log.warn("{} was already released when the failure occurred: {}", id, e.getMessage());
            return CycleResult.RETRY_SCHEDULED;
        } catch (StoreWriteException e) {
            log.error("Could not record failure of {}", id, e);
            return CycleResult.ROLLED_BACK;
        }
    }

    /**
     * Puts a claimed entry back without counting a failure. The retry waits one backoff step so a
     * store outage does not turn into a refetch loop.
     */
    private void rollBack(String id, Target target) {
        Instant retryAt = clock.instant().plus(policy.backoff(1));
        if (!frontier.requeue(id, retryAt)) {
            log.error("Could not requeue {}: no longer in progress", id);
            return;
        }
        if (target == null) return;
        try {
            store.putTarget(target.withStatus(TargetStatus.PENDING));
        } catch (StoreWriteException e) {
            log.error("Could not reset {} to {}; the store still shows its last written status", id,
                    TargetStatus.PENDING, e);
        }
    }

    private int registerDiscovered(Set<String> discovered, Instant now) {
        int added = 0;
        for (String d : discovered) {
            TargetKind kind = TargetCanonicalizer.kindOf(d);
            // known targets are already scheduled or permanently failed
            if (!store.registerIfAbsent(Target.discovered(d, kind, TargetCanonicalizer.domainOf(d), now))) continue;
            if (frontier.enqueue(d, kind, policy.defaultPriority())) added++;
        }
        return added;
    }
}
