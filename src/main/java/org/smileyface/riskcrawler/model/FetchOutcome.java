package org.smileyface.riskcrawler.model;

/**
 * Outcome of a single fetch attempt.
 */
public enum FetchOutcome {
    SUCCESS,

    /** Network error, timeout, throttling or server error. Worth retrying. */
    TRANSIENT_FAILURE,

    /** Unreachable, forbidden, gone, or blocked by policy. Not retried. */
    PERMANENT_FAILURE
}
