package org.smileyface.riskcrawler.classifier;

import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Fires on the first case-insensitive regex match; the matched text is reported as evidence.
 */
public class PatternRule extends AbstractRiskRule {

    private static final int MAX_EVIDENCE = 120;

    private final Pattern pattern;

    public PatternRule(String name, RiskLabel label, double weight, String regex) {
        super(name, label, weight);
        if (regex == null || regex.isBlank()) {
            throw new IllegalArgumentException("rule " + name + " has no pattern");
        }
        try {
            this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("rule " + name + " has an invalid pattern: " + e.getDescription(), e);
        }
    }

    @Override
    public Optional<RuleSignal> evaluate(String text) {
        if (text == null || text.isEmpty()) return Optional.empty();
        Matcher m = pattern.matcher(text);
        if (!m.find()) return Optional.empty();
        String match = m.group();
        if (match.length() > MAX_EVIDENCE) match = match.substring(0, MAX_EVIDENCE);
        return Optional.of(signal(match));
    }
}
