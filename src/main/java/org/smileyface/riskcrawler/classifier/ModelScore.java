package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of a model scorer call: a probability distribution over labels, or "unavailable" with a
 * reason. Unavailability is a normal value, never an exception.
 */
public final class ModelScore {

    private final Map<RiskLabel, Double> probabilities;
    private final String unavailableReason;

    private ModelScore(Map<RiskLabel, Double> probabilities, String unavailableReason) {
        this.probabilities = probabilities;
        this.unavailableReason = unavailableReason;
    }

    public static ModelScore of(Map<RiskLabel, Double> probabilities) {
        if (probabilities == null || probabilities.isEmpty()) {
            return unavailable("empty distribution");
        }
        Map<RiskLabel, Double> copy = new EnumMap<>(RiskLabel.class);
        probabilities.forEach((label, p) -> {
            if (label != null && p != null && !p.isNaN()) copy.put(label, Math.max(0.0, Math.min(1.0, p)));
        });
        return new ModelScore(Collections.unmodifiableMap(copy), null);
    }

    public static ModelScore unavailable(String reason) {
        return new ModelScore(Map.of(), reason == null ? "unavailable" : reason);
    }

    public boolean isAvailable() {
        return unavailableReason == null;
    }

    public String unavailableReason() {
        return unavailableReason;
    }

    public Map<RiskLabel, Double> probabilities() {
        return probabilities;
    }

    public double probabilityOf(RiskLabel label) {
        return probabilities.getOrDefault(label, 0.0);
    }

    @Override
    public String toString() {
        return isAvailable() ? "ModelScore" + probabilities : "ModelScore{unavailable: " + unavailableReason + "}";
    }
}
