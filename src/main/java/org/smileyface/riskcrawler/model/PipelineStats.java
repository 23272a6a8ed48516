package org.smileyface.riskcrawler.model;

import java.util.Map;

/**
 * Aggregate counters served to the dashboard.
 *
 * @param flagged        targets whose current verdict has a risky label
 * @param flaggedByBand  flagged targets per risk band
 * @param avgRiskScore   mean risk score over flagged targets, 0 when none
 */
public record PipelineStats(long totalTargets,
                            Map<TargetStatus, Long> byStatus,
                            long flagged,
                            Map<RiskBand, Long> flaggedByBand,
                            long flaggedToday,
                            long flaggedThisWeek,
                            double avgRiskScore,
                            long uniqueDomains,
                            long unresolvedFeedback) {

    public PipelineStats {
        byStatus = byStatus == null ? Map.of() : Map.copyOf(byStatus);
        flaggedByBand = flaggedByBand == null ? Map.of() : Map.copyOf(flaggedByBand);
    }
}
