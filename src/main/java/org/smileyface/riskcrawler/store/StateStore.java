package org.smileyface.riskcrawler.store;

import org.smileyface.riskcrawler.crawler.RevisitPolicy;
import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetPage;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every target ever seen, its current verdict, its verdict history and the
 * feedback queue. The only shared mutable state of the pipeline.
 *
 * <p>Writes throw {@link StoreWriteException} when they cannot be completed.
 */
public interface StateStore {

    Optional<Target> getTarget(String identifier);

    /**
     * Stores a newly discovered target unless one with the same identifier exists.
     *
     * @return true if stored
     */
    boolean registerIfAbsent(Target target);

    /**
     * Upserts the target record, leaving its current verdict and history untouched.
     */
    void putTarget(Target target);

    /**
     * Appends {@code verdict} to the target's history, makes it the current verdict and stores
     * {@code target}, as one unit: readers never see the updated target with a stale verdict.
     * History holds one entry per visit ({@link Target#visitCount()}), so retrying a failed write
     * for the same visit does not duplicate it.
     */
    void recordVerdict(Target target, Verdict verdict);

    Optional<Verdict> currentVerdict(String identifier);

    /** Every verdict recorded for the target, oldest first. */
    List<Verdict> verdictHistory(String identifier);

    /** Targets with the given status, or all targets when {@code status} is null. */
    List<Target> listTargets(TargetStatus status);

    /**
     * Targets due for a visit at {@code now}: any target neither done nor permanently failed, plus done
     * targets whose revisit interval has elapsed.
     */
    default List<Target> listPending(Instant now, RevisitPolicy policy) {
        List<Target> out = new ArrayList<>();
        for (Target t : listTargets(null)) {
            if (t.status() == TargetStatus.PERMANENTLY_FAILED) continue;
            if (t.status() != TargetStatus.DONE) {
                out.add(t);
                continue;
            }
            Instant next = policy.nextVisit(t, currentVerdict(t.identifier()).orElse(null));
            if (next == null || !next.isAfter(now)) out.add(t);
        }
        return out;
    }

    /**
     * Targets with a current verdict in {@code band} (any classified or unclassified target when null),
     * optionally restricted to one kind, by risk score then verdict time, both descending.
     */
    TargetPage listByRiskBand(RiskBand band, TargetKind kind, int offset, int limit);

    void putFeedback(FeedbackItem item);

    Optional<FeedbackItem> getFeedback(String id);

    /** Feedback items oldest first, capped at {@code limit}. */
    List<FeedbackItem> listFeedback(boolean unresolvedOnly, int limit);

    PipelineStats stats(Instant now);
}
