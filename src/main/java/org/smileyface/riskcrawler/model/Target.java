package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Objects;

/**
 * A unit of crawl work: a canonical page URL or channel handle under tracking.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Target(String identifier,
                     TargetKind kind,
                     String domain,          // host for pages, handle for channels
                     Instant discoveredAt,
                     Instant lastVisitedAt,  // null until the first successful visit
                     int visitCount,
                     TargetStatus status,
                     String lastError) {

    public Target {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(discoveredAt, "discoveredAt");
        Objects.requireNonNull(status, "status");
    }

    public static Target discovered(String identifier, TargetKind kind, String domain, Instant now) {
        return new Target(identifier, kind, domain, now, null, 0, TargetStatus.PENDING, null);
    }

    public Target withStatus(TargetStatus newStatus) {
        return new Target(identifier, kind, domain, discoveredAt, lastVisitedAt, visitCount, newStatus, lastError);
    }

    public Target visited(Instant when) {
        return new Target(identifier, kind, domain, discoveredAt, when, visitCount + 1, TargetStatus.DONE, null);
    }

    public Target failed(TargetStatus newStatus, String error) {
        return new Target(identifier, kind, domain, discoveredAt, lastVisitedAt, visitCount, newStatus, error);
    }
}
