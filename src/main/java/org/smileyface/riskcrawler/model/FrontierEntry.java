package org.smileyface.riskcrawler.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Lightweight scheduling entry. References its target by identifier only; the State Store
 * owns the target record.
 *
 * @param priority     higher is dequeued first
 * @param discoveredAt tie-break between equal priorities, oldest first
 * @param notBefore    earliest instant the entry may be dequeued
 * @param failures     consecutive transient failures since the last success
 */
public record FrontierEntry(String identifier,
                            TargetKind kind,
                            double priority,
                            Instant discoveredAt,
                            Instant notBefore,
                            int failures) {

    public FrontierEntry {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(discoveredAt, "discoveredAt");
        Objects.requireNonNull(notBefore, "notBefore");
    }

    public boolean isEligible(Instant now) {
        return !notBefore.isAfter(now);
    }
}
