package org.smileyface.riskcrawler.feedback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.FeedbackReason;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.store.StateStore;
import org.smileyface.riskcrawler.util.CrawlerUtils;

import java.time.Clock;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Holding area for verdicts that need a human label. Items live in the State Store; the queue
 * never interprets human labels beyond storing them for the external training pipeline.
 */
public class FeedbackQueue {

    private static final Logger log = LoggerFactory.getLogger(FeedbackQueue.class);

    private final StateStore store;
    private final Clock clock;

    public FeedbackQueue(StateStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Queues {@code verdict} for review. An unresolved item for the same target, content and reason
     * is returned instead of creating a second one.
     *
     * <p>Item ids are derived from target, content hash and reason plus a generation counter:
     * {@code <key>-0} for the first item, {@code <key>-1} once that one is resolved, and so on. Only
     * the newest generation can be unresolved, so deduplication is a few point lookups.
     */
    public synchronized FeedbackItem enqueue(Verdict verdict, FeedbackReason reason) {
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(reason, "reason");
        String key = dedupKey(verdict, reason);
        for (int generation = 0; ; generation++) {
            String id = key + "-" + generation;
            Optional<FeedbackItem> existing = store.getFeedback(id);
            if (existing.isEmpty()) {
                FeedbackItem item = FeedbackItem.open(id, verdict, reason, clock.instant());
                store.putFeedback(item);
                log.info("Feedback item {} queued for {} ({}, label={}, p={})", item.id(), verdict.target(),
                        reason, verdict.label().wireName(), verdict.probability());
                return item;
            }
            if (!existing.get().resolved()) {
                return existing.get();
            }
        }
    }

    static String dedupKey(Verdict verdict, FeedbackReason reason) {
        return CrawlerUtils.sha256Hex(verdict.target() + "\n" + Objects.toString(verdict.sourceHash(), "")
                + "\n" + reason.name());
    }

    /**
     * Unresolved items, oldest first. Draining does not remove items; they stay until resolved.
     */
    public List<FeedbackItem> drain(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return store.listFeedback(true, limit);
    }

    /**
     * @throws NoSuchElementException for an unknown item
     * @throws IllegalStateException  if the item was already resolved
     */
    public synchronized FeedbackItem resolve(String itemId, RiskLabel humanLabel) {
        Objects.requireNonNull(humanLabel, "humanLabel");
        FeedbackItem item = store.getFeedback(itemId)
                .orElseThrow(() -> new NoSuchElementException("No feedback item " + itemId));
        if (item.resolved()) {
            throw new IllegalStateException("Feedback item " + itemId + " already resolved");
        }
        FeedbackItem resolved = item.resolve(humanLabel, clock.instant());
        store.putFeedback(resolved);
        log.info("Feedback item {} for {} resolved as {} (model said {})", itemId, item.identifier(),
                humanLabel.wireName(), item.verdict().label().wireName());
        return resolved;
    }

    /**
     * Analyst flag on a target's current verdict.
     *
     * @throws NoSuchElementException when the target has no verdict yet
     */
    public FeedbackItem flag(String identifier) {
        Verdict current = store.currentVerdict(identifier)
                .orElseThrow(() -> new NoSuchElementException("No verdict for " + identifier));
        return enqueue(current, FeedbackReason.ANALYST_FLAGGED);
    }
}
