package org.smileyface.riskcrawler.model;

/**
 * Lifecycle status of a tracked target.
 */
public enum TargetStatus {
    /** Known and waiting for its first (or next) visit. */
    PENDING,

    /** Claimed by a worker. */
    IN_PROGRESS,

    /** Visited successfully at least once; revisited on schedule. */
    DONE,

    /** Unreachable or blocked by policy; never scheduled again. */
    PERMANENTLY_FAILED;

    public boolean isTerminal() {
        return this == PERMANENTLY_FAILED;
    }
}
