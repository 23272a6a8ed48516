package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A verdict held for human review. Once resolved it carries the analyst's label, which the
 * external training pipeline consumes as a correction signal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedbackItem(String id,
                           Verdict verdict,
                           FeedbackReason reason,
                           Instant enqueuedAt,
                           boolean resolved,
                           RiskLabel humanLabel,
                           Instant resolvedAt) {

    public FeedbackItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    }

    public static FeedbackItem open(String id, Verdict verdict, FeedbackReason reason, Instant now) {
        return new FeedbackItem(id, verdict, reason, now, false, null, null);
    }

    public FeedbackItem resolve(RiskLabel label, Instant now) {
        return new FeedbackItem(id, verdict, reason, enqueuedAt, true, Objects.requireNonNull(label, "label"), now);
    }

    public String identifier() {
        return verdict.target();
    }
}
