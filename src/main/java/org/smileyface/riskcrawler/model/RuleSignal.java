package org.smileyface.riskcrawler.model;

import java.util.Objects;

/**
 * Evidence emitted by one triggered rule.
 *
 * @param rule   rule name
 * @param label  label the rule hints at
 * @param weight fixed contribution of the rule
 * @param match  the term or pattern fragment that triggered it
 */
public record RuleSignal(String rule, RiskLabel label, double weight, String match) {

    public RuleSignal {
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(label, "label");
    }
}
