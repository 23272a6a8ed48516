package org.smileyface.riskcrawler.crawler;

import org.smileyface.riskcrawler.model.FetchOutcome;
import org.smileyface.riskcrawler.model.FrontierEntry;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Priority-ordered, deduplicated work queue of targets awaiting (re)visit.
 * Identifiers passed in are expected to be canonical.
 */
public interface Frontier {

    /**
     * Adds a target eligible immediately. If the identifier already has a queued entry (pending or
     * waiting for its revisit time), the call only raises its priority, never lowers it. Claimed and
     * permanently failed identifiers are left untouched.
     *
     * @return true if a new entry was created
     */
    boolean enqueue(String identifier, TargetKind kind, double priority);

    /**
     * Claims up to {@code n} entries whose notBefore has passed, by descending priority, then oldest
     * discoveredAt. Claimed entries are not returned again until released or requeued.
     */
    List<FrontierEntry> dequeueBatch(int n);

    /**
     * Completes a claimed entry.
     *
     * @param verdict current verdict after a successful visit, used for the revisit interval; may be null
     * @throws IllegalStateException if the identifier is not claimed
     */
    FrontierRelease release(String identifier, FetchOutcome outcome, Verdict verdict);

    /**
     * Returns a claimed entry to pending, eligible now, without counting a failure.
     *
     * @return false if the identifier was not claimed
     */
    boolean requeue(String identifier);

    /**
     * Returns a claimed entry to the queue, eligible from {@code notBefore}, without counting a failure.
     *
     * @return false if the identifier was not claimed
     */
    boolean requeue(String identifier, Instant notBefore);

    /**
     * Restores an entry verbatim, replacing any queued entry with the same identifier.
     */
    void schedule(FrontierEntry entry);

    Optional<FrontierEntry> find(String identifier);

    boolean isPermanentlyFailed(String identifier);

    /**
     * Clears all entries, claims and permanent-failure markers.
     */
    void init();

    /** Queued plus claimed entries. */
    long size();

    long inProgressCount();
}
