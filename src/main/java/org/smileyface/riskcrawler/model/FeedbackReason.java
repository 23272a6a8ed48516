package org.smileyface.riskcrawler.model;

public enum FeedbackReason {
    LOW_CONFIDENCE,
    ANALYST_FLAGGED
}
