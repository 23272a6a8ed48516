package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;

import java.util.Objects;

abstract class AbstractRiskRule implements RiskRule {

    private final String name;
    private final RiskLabel label;
    private final double weight;

    protected AbstractRiskRule(String name, RiskLabel label, double weight) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name must not be null/blank");
        }
        if (!(weight > 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException("rule " + name + " weight must be in (0, 1]: " + weight);
        }
        this.name = name;
        this.label = Objects.requireNonNull(label, "label");
        this.weight = weight;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RiskLabel label() {
        return label;
    }

    @Override
    public double weight() {
        return weight;
    }

    protected RuleSignal signal(String match) {
        return new RuleSignal(name, label, weight, match);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + name + " -> " + label.wireName() + " @" + weight + "}";
    }
}
