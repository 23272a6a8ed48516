package org.smileyface.riskcrawler.processor;

/**
 * How one target's processing cycle ended.
 */
public enum CycleResult {
    /** Fetched, classified, persisted and released for revisit. */
    CLASSIFIED,
    /** Transient failure; the frontier scheduled a retry. */
    RETRY_SCHEDULED,
    /** Permanent failure or retries exhausted; never scheduled again. */
    FAILED_PERMANENTLY,
    /** A store write failed; the entry went back to pending. */
    ROLLED_BACK;

    public boolean isFailure() {
        return this != CLASSIFIED;
    }
}
