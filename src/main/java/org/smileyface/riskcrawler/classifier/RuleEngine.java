package org.smileyface.riskcrawler.classifier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.crawler.CrawlerProperties.RuleConfig;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluates an ordered rule set. The set of triggered rules is independent of order; order only
 * decides how evidence is reported.
 */
public class RuleEngine {

    private static final Logger log = LogManager.getLogger();

    private final List<RiskRule> rules;

    public RuleEngine(List<RiskRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Builds the rules declared in configuration.
     *
     * @throws IllegalStateException for an unknown rule type, label or invalid definition
     */
    public static RuleEngine fromConfig(List<RuleConfig> configs) {
        List<RiskRule> rules = new ArrayList<>();
        if (configs != null) {
            for (RuleConfig c : configs) {
                try {
                    rules.add(build(c));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException("Invalid rule '" + c.getName() + "': " + e.getMessage(), e);
                }
            }
        }
        log.info("Rule engine loaded {} rules", rules.size());
        return new RuleEngine(rules);
    }

    private static RiskRule build(RuleConfig c) {
        RiskLabel label = RiskLabel.fromName(c.getLabel());
        String type = c.getType() == null ? "keyword" : c.getType().trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "keyword" -> new KeywordRule(c.getName(), label, c.getWeight(), c.getTerms());
            case "pattern" -> new PatternRule(c.getName(), label, c.getWeight(), c.getPattern());
            case "indicator-list" -> new IndicatorListRule(c.getName(), label, c.getWeight(), c.getResource());
            default -> throw new IllegalArgumentException("unknown rule type " + c.getType());
        };
    }

    public List<RiskRule> rules() {
        return rules;
    }

    public List<RuleSignal> evaluate(String text) {
        List<RuleSignal> signals = new ArrayList<>();
        for (RiskRule rule : rules) {
            rule.evaluate(text).ifPresent(signals::add);
        }
        return signals;
    }

    /**
     * Sum of triggered weights per risky label, uncapped.
     */
    public static Map<RiskLabel, Double> cumulativeWeights(List<RuleSignal> signals) {
        Map<RiskLabel, Double> sums = new EnumMap<>(RiskLabel.class);
        for (RuleSignal s : signals) {
            if (s.label().isRisky()) sums.merge(s.label(), s.weight(), Double::sum);
        }
        return sums;
    }

    /**
     * Rule-derived probability per label: min(1, sum of weights) for risky labels and
     * 1 - max(risky) for benign.
     */
    public static Map<RiskLabel, Double> probabilities(List<RuleSignal> signals) {
        Map<RiskLabel, Double> sums = cumulativeWeights(signals);
        Map<RiskLabel, Double> probs = new EnumMap<>(RiskLabel.class);
        double maxRisky = 0.0;
        for (RiskLabel label : RiskLabel.values()) {
            if (!label.isRisky()) continue;
            double p = Math.min(1.0, sums.getOrDefault(label, 0.0));
            probs.put(label, p);
            maxRisky = Math.max(maxRisky, p);
        }
        probs.put(RiskLabel.BENIGN, 1.0 - maxRisky);
        return probs;
    }
}
