package org.smileyface.riskcrawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Durable classification record for one target.
 *
 * @param target      canonical identifier of the classified target
 * @param label       winning label
 * @param probability probability of {@code label}, in [0, 1]
 * @param ruleSignals triggered rules in evaluation order
 * @param modelScore  model probability for {@code label}; null when the scorer was unavailable
 * @param producedAt  classification time
 * @param sourceHash  SHA-256 of the normalized text that was classified
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Verdict(String target,
                      RiskLabel label,
                      double probability,
                      List<RuleSignal> ruleSignals,
                      Double modelScore,
                      Instant producedAt,
                      String sourceHash) {

    public Verdict {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(label, "label");
        if (probability < 0.0 || probability > 1.0 || Double.isNaN(probability)) {
            throw new IllegalArgumentException("probability out of range: " + probability);
        }
        if (modelScore != null && (modelScore < 0.0 || modelScore > 1.0)) {
            throw new IllegalArgumentException("modelScore out of range: " + modelScore);
        }
        ruleSignals = ruleSignals == null ? List.of() : List.copyOf(ruleSignals);
    }

    /**
     * Probability that the target is risky: the label probability for risky labels,
     * its complement for a benign verdict.
     */
    @JsonIgnore
    public double riskScore() {
        return label.isRisky() ? probability : 1.0 - probability;
    }

    @JsonIgnore
    public RiskBand band() {
        return RiskBand.of(riskScore());
    }

    @JsonIgnore
    public boolean isModelBacked() {
        return modelScore != null;
    }

    public Verdict withProducedAt(Instant instant) {
        return new Verdict(target, label, probability, ruleSignals, modelScore, instant, sourceHash);
    }

    /**
     * True when both verdicts carry the same classification, ignoring {@code producedAt}.
     */
    public boolean sameClassificationAs(Verdict other) {
        if (other == null) return false;
        return target.equals(other.target)
                && label == other.label
                && Double.compare(probability, other.probability) == 0
                && ruleSignals.equals(other.ruleSignals)
                && Objects.equals(modelScore, other.modelScore)
                && Objects.equals(sourceHash, other.sourceHash);
    }
}
