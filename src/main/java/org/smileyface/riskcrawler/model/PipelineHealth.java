package org.smileyface.riskcrawler.model;

import java.time.Instant;

/**
 * Pipeline health signal. A degraded scorer is reported here rather than per verdict.
 */
public record PipelineHealth(boolean running,
                             int workers,
                             long frontierSize,
                             long inProgress,
                             boolean scorerEnabled,
                             boolean scorerDegraded,
                             long consecutiveScorerFailures,
                             Instant degradedSince,
                             String lastScorerError) {
}
