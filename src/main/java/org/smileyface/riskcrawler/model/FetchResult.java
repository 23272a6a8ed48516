package org.smileyface.riskcrawler.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Ephemeral output of one fetch attempt. Raw content and discovered targets are only
 * present on success.
 *
 * @param finalUrl URL the content was served from after redirects, used to resolve relative links
 * @param failureReason short human-readable reason, null on success
 */
public record FetchResult(String target,
                          Instant timestamp,
                          FetchOutcome outcome,
                          String rawContent,
                          String finalUrl,
                          Set<String> discoveredTargets,
                          String failureReason) {

    public FetchResult {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(outcome, "outcome");
        if (outcome != FetchOutcome.SUCCESS) {
            rawContent = null;
            discoveredTargets = Set.of();
        } else {
            discoveredTargets = discoveredTargets == null
                    ? Set.of()
                    : java.util.Collections.unmodifiableSet(new LinkedHashSet<>(discoveredTargets));
        }
    }

    public static FetchResult success(String target, Instant timestamp, String rawContent, String finalUrl) {
        return new FetchResult(target, timestamp, FetchOutcome.SUCCESS, rawContent, finalUrl, Set.of(), null);
    }

    public static FetchResult transientFailure(String target, Instant timestamp, String reason) {
        return new FetchResult(target, timestamp, FetchOutcome.TRANSIENT_FAILURE, null, null, Set.of(), reason);
    }

    public static FetchResult permanentFailure(String target, Instant timestamp, String reason) {
        return new FetchResult(target, timestamp, FetchOutcome.PERMANENT_FAILURE, null, null, Set.of(), reason);
    }

    public FetchResult withDiscoveredTargets(Set<String> discovered) {
        return new FetchResult(target, timestamp, outcome, rawContent, finalUrl, discovered, failureReason);
    }

    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }
}
