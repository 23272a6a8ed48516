package org.smileyface.riskcrawler.elasticsearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.FeedbackReason;
import org.smileyface.riskcrawler.model.RiskLabel;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedbackDocument {

    private String id;
    private String identifier;
    private String reason;
    private Long enqueuedAt;
    private Boolean resolved;
    private String humanLabel;
    private Long resolvedAt;
    private VerdictDocument verdict;

    public FeedbackDocument() {
        // default
    }

    public static FeedbackDocument from(FeedbackItem item) {
        FeedbackDocument d = new FeedbackDocument();
        d.id = item.id();
        d.identifier = item.identifier();
        d.reason = item.reason().name();
        d.enqueuedAt = item.enqueuedAt().toEpochMilli();
        d.resolved = item.resolved();
        d.humanLabel = item.humanLabel() == null ? null : item.humanLabel().wireName();
        d.resolvedAt = item.resolvedAt() == null ? null : item.resolvedAt().toEpochMilli();
        d.verdict = VerdictDocument.from(item.verdict());
        return d;
    }

    public FeedbackItem toItem() {
        return new FeedbackItem(id, verdict.toVerdict(), FeedbackReason.valueOf(reason),
                Instant.ofEpochMilli(enqueuedAt), Boolean.TRUE.equals(resolved),
                humanLabel == null ? null : RiskLabel.fromName(humanLabel),
                resolvedAt == null ? null : Instant.ofEpochMilli(resolvedAt));
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getIdentifier() { return identifier; }
    public void setIdentifier(String identifier) { this.identifier = identifier; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public Long getEnqueuedAt() { return enqueuedAt; }
    public void setEnqueuedAt(Long enqueuedAt) { this.enqueuedAt = enqueuedAt; }

    public Boolean getResolved() { return resolved; }
    public void setResolved(Boolean resolved) { this.resolved = resolved; }

    public String getHumanLabel() { return humanLabel; }
    public void setHumanLabel(String humanLabel) { this.humanLabel = humanLabel; }

    public Long getResolvedAt() { return resolvedAt; }
    public void setResolvedAt(Long resolvedAt) { this.resolvedAt = resolvedAt; }

    public VerdictDocument getVerdict() { return verdict; }
    public void setVerdict(VerdictDocument verdict) { this.verdict = verdict; }
}
