package org.smileyface.riskcrawler.elasticsearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Target document: the target record with its current verdict embedded, plus the derived
 * {@code riskScore}, {@code band} and {@code flagged} fields used for listings and stats.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetDocument {

    private String identifier;
    private String kind;
    private String domain;
    private Long discoveredAt;         // epoch millis
    private Long lastVisitedAt;        // epoch millis
    private Integer visitCount;
    private String status;
    private String lastError;

    private Double riskScore;
    private String band;
    private Boolean flagged;
    private VerdictDocument verdict;

    public TargetDocument() {
        // default
    }

    public static TargetDocument from(Target t, Verdict current) {
        TargetDocument d = new TargetDocument();
        d.identifier = t.identifier();
        d.kind = t.kind().name();
        d.domain = t.domain();
        d.discoveredAt = t.discoveredAt().toEpochMilli();
        d.lastVisitedAt = t.lastVisitedAt() == null ? null : t.lastVisitedAt().toEpochMilli();
        d.visitCount = t.visitCount();
        d.status = t.status().name();
        d.lastError = t.lastError();
        if (current != null) {
            d.riskScore = current.riskScore();
            d.band = current.band().name();
            d.flagged = current.label().isRisky();
            d.verdict = VerdictDocument.from(current);
        }
        return d;
    }

    /**
     * Target fields only, for a partial update that leaves the embedded verdict alone. Null values are
     * kept so that cleared fields are cleared in the stored document.
     */
    public static Map<String, Object> targetFields(Target t) {
        Map<String, Object> m = new HashMap<>();
        m.put("identifier", t.identifier());
        m.put("kind", t.kind().name());
        m.put("domain", t.domain());
        m.put("discoveredAt", t.discoveredAt().toEpochMilli());
        m.put("lastVisitedAt", t.lastVisitedAt() == null ? null : t.lastVisitedAt().toEpochMilli());
        m.put("visitCount", t.visitCount());
        m.put("status", t.status().name());
        m.put("lastError", t.lastError());
        return m;
    }

    public Target toTarget() {
        return new Target(identifier, TargetKind.valueOf(kind), domain, Instant.ofEpochMilli(discoveredAt),
                lastVisitedAt == null ? null : Instant.ofEpochMilli(lastVisitedAt),
                visitCount == null ? 0 : visitCount, TargetStatus.valueOf(status), lastError);
    }

    public Verdict toVerdict() {
        return verdict == null ? null : verdict.toVerdict();
    }

    public String getIdentifier() { return identifier; }
    public void setIdentifier(String identifier) { this.identifier = identifier; }

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public Long getDiscoveredAt() { return discoveredAt; }
    public void setDiscoveredAt(Long discoveredAt) { this.discoveredAt = discoveredAt; }

    public Long getLastVisitedAt() { return lastVisitedAt; }
    public void setLastVisitedAt(Long lastVisitedAt) { this.lastVisitedAt = lastVisitedAt; }

    public Integer getVisitCount() { return visitCount; }
    public void setVisitCount(Integer visitCount) { this.visitCount = visitCount; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public Double getRiskScore() { return riskScore; }
    public void setRiskScore(Double riskScore) { this.riskScore = riskScore; }

    public String getBand() { return band; }
    public void setBand(String band) { this.band = band; }

    public Boolean getFlagged() { return flagged; }
    public void setFlagged(Boolean flagged) { this.flagged = flagged; }

    public VerdictDocument getVerdict() { return verdict; }
    public void setVerdict(VerdictDocument verdict) { this.verdict = verdict; }
}
