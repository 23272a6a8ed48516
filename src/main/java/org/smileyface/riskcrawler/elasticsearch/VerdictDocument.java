package org.smileyface.riskcrawler.elasticsearch;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;
import org.smileyface.riskcrawler.model.Verdict;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a {@link Verdict}: one document per entry in the verdict history index, and the
 * embedded {@code verdict} object of a target document.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerdictDocument {

    private String target;
    private String label;              // wire name, e.g. "fraud"
    private Double probability;
    private Double modelScore;
    private Long producedAt;           // epoch millis
    private String sourceHash;
    private List<SignalDocument> ruleSignals;

    public VerdictDocument() {
        // default
    }

    public static VerdictDocument from(Verdict v) {
        VerdictDocument d = new VerdictDocument();
        d.target = v.target();
        d.label = v.label().wireName();
        d.probability = v.probability();
        d.modelScore = v.modelScore();
        d.producedAt = v.producedAt() == null ? null : v.producedAt().toEpochMilli();
        d.sourceHash = v.sourceHash();
        d.ruleSignals = new ArrayList<>();
        for (RuleSignal s : v.ruleSignals()) {
            d.ruleSignals.add(SignalDocument.from(s));
        }
        return d;
    }

    public Verdict toVerdict() {
        List<RuleSignal> signals = new ArrayList<>();
        if (ruleSignals != null) {
            for (SignalDocument s : ruleSignals) signals.add(s.toSignal());
        }
        return new Verdict(target, RiskLabel.fromName(label), probability == null ? 0.0 : probability,
                signals, modelScore, producedAt == null ? null : Instant.ofEpochMilli(producedAt), sourceHash);
    }

    public String getTarget() { return target; }
    public void setTarget(String target) { this.target = target; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public Double getProbability() { return probability; }
    public void setProbability(Double probability) { this.probability = probability; }

    public Double getModelScore() { return modelScore; }
    public void setModelScore(Double modelScore) { this.modelScore = modelScore; }

    public Long getProducedAt() { return producedAt; }
    public void setProducedAt(Long producedAt) { this.producedAt = producedAt; }

    public String getSourceHash() { return sourceHash; }
    public void setSourceHash(String sourceHash) { this.sourceHash = sourceHash; }

    public List<SignalDocument> getRuleSignals() { return ruleSignals; }
    public void setRuleSignals(List<SignalDocument> ruleSignals) { this.ruleSignals = ruleSignals; }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SignalDocument {
        private String rule;
        private String label;
        private Double weight;
        private String match;

        public SignalDocument() {
            // default
        }

        static SignalDocument from(RuleSignal s) {
            SignalDocument d = new SignalDocument();
            d.rule = s.rule();
            d.label = s.label().wireName();
            d.weight = s.weight();
            d.match = s.match();
            return d;
        }

        RuleSignal toSignal() {
            return new RuleSignal(rule, RiskLabel.fromName(label), weight == null ? 0.0 : weight, match);
        }

        public String getRule() { return rule; }
        public void setRule(String rule) { this.rule = rule; }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }

        public Double getWeight() { return weight; }
        public void setWeight(Double weight) { this.weight = weight; }

        public String getMatch() { return match; }
        public void setMatch(String match) { this.match = match; }
    }
}
