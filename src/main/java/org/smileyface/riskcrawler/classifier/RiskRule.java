package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;

import java.util.Optional;

/**
 * Deterministic, side-effect-free predicate over normalized text. A triggered rule contributes its
 * fixed weight towards its label.
 */
public interface RiskRule {

    String name();

    RiskLabel label();

    double weight();

    Optional<RuleSignal> evaluate(String text);
}
