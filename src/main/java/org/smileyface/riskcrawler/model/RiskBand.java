package org.smileyface.riskcrawler.model;

/**
 * Coarse risk level derived from a verdict's risk score, used by the revisit policy
 * and by the dashboard listings.
 */
public enum RiskBand {
    HIGH(0.8, Double.POSITIVE_INFINITY),
    MEDIUM(0.6, 0.8),
    LOW(Double.NEGATIVE_INFINITY, 0.6);

    private final double lowerInclusive;
    private final double upperExclusive;

    RiskBand(double lowerInclusive, double upperExclusive) {
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
    }

    public double lowerInclusive() {
        return lowerInclusive;
    }

    public double upperExclusive() {
        return upperExclusive;
    }

    public boolean contains(double riskScore) {
        return riskScore >= lowerInclusive && riskScore < upperExclusive;
    }

    public static RiskBand of(double riskScore) {
        if (riskScore >= HIGH.lowerInclusive) return HIGH;
        if (riskScore >= MEDIUM.lowerInclusive) return MEDIUM;
        return LOW;
    }
}
