package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires when the text contains any of its phrases, case-insensitively. Reports the first phrase
 * (in declaration order) that matched.
 */
public class KeywordRule extends AbstractRiskRule {

    private final List<String> terms;

    public KeywordRule(String name, RiskLabel label, double weight, List<String> terms) {
        super(name, label, weight);
        List<String> cleaned = new ArrayList<>();
        if (terms != null) {
            for (String t : terms) {
                if (t != null && !t.isBlank()) cleaned.add(t.trim().toLowerCase(Locale.ROOT));
            }
        }
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("rule " + name + " has no terms");
        }
        this.terms = List.copyOf(cleaned);
    }

    public List<String> terms() {
        return terms;
    }

    @Override
    public Optional<RuleSignal> evaluate(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String term : terms) {
            if (haystack.contains(term)) {
                return Optional.of(signal(term));
            }
        }
        return Optional.empty();
    }
}
