package org.smileyface.riskcrawler.classifier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.RuleSignal;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.util.CrawlerUtils;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Combines rule evidence and the model scorer into one verdict.
 *
 * <p>Without a model score the verdict is rule-only: the label with the highest cumulative rule
 * weight (benign when nothing fires) and its rule probability. With one, each label's probability is
 * {@code wRule * ruleProb + wModel * modelProb} with the configured weights normalized to sum to 1.
 * Ties go to the label declared first in {@link RiskLabel}. Probabilities are rounded to six decimals,
 * so identical text always yields an identical verdict apart from {@code producedAt}.
 */
public class RiskEnsemble {

    private static final Logger log = LogManager.getLogger();
    private static final double EPSILON = 1e-9;

    private final RuleEngine ruleEngine;
    private final ModelScorer scorer;
    private final ScorerHealth health;
    private final Clock clock;
    private final CrawlerProperties.EnsembleConfig config;

    public RiskEnsemble(RuleEngine ruleEngine, ModelScorer scorer, ScorerHealth health,
                        CrawlerProperties properties, Clock clock) {
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.health = Objects.requireNonNull(health, "health");
        this.config = Objects.requireNonNull(properties, "properties").getEnsemble();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Verdict classify(String text, String target) {
        return classify(text, target, null);
    }

    /**
     * Classifies {@code text}. When {@code current} was model-backed and produced from the same
     * content, it is reissued with a fresh timestamp instead of calling the scorer again.
     */
    public Verdict classify(String text, String target, Verdict current) {
        String normalized = text == null ? "" : text;
        String sourceHash = CrawlerUtils.sha256Hex(normalized);
        if (current != null && current.isModelBacked() && sourceHash.equals(current.sourceHash())
                && target.equals(current.target())) {
            log.debug("Content of {} unchanged; reusing model-backed verdict", target);
            return current.withProducedAt(clock.instant());
        }

        List<RuleSignal> signals = ruleEngine.evaluate(normalized);
        ModelScore modelScore = callScorer(normalized, target);
        health.record(modelScore);

        Verdict verdict = modelScore.isAvailable()
                ? blended(target, signals, modelScore, sourceHash)
                : ruleOnly(target, signals, sourceHash);
        log.debug("Classified {} as {} p={} (rules={}, model={})", target, verdict.label().wireName(),
                verdict.probability(), signals.size(), verdict.modelScore());
        return verdict;
    }

    /**
     * True when the verdict's probability lies within the uncertain margin of any decision boundary.
     */
    public boolean isUncertain(Verdict verdict) {
        double p = verdict.probability();
        for (Double boundary : config.getDecisionBoundaries()) {
            if (boundary != null && Math.abs(p - boundary) <= config.getUncertainMargin() + EPSILON) {
                return true;
            }
        }
        return false;
    }

    private ModelScore callScorer(String text, String target) {
        try {
            ModelScore score = scorer.score(text, target);
            return score == null ? ModelScore.unavailable("scorer returned nothing") : score;
        } catch (RuntimeException e) {
            log.warn("Model scorer failed for {}: {}", target, e.toString());
            return ModelScore.unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Verdict ruleOnly(String target, List<RuleSignal> signals, String sourceHash) {
        Map<RiskLabel, Double> weights = RuleEngine.cumulativeWeights(signals);
        RiskLabel label = RiskLabel.BENIGN;
        double best = 0.0;
        for (RiskLabel l : RiskLabel.values()) {
            double w = weights.getOrDefault(l, 0.0);
            if (w > best + EPSILON) {
                best = w;
                label = l;
            }
        }
        double probability = RuleEngine.probabilities(signals).get(label);
        return new Verdict(target, label, CrawlerUtils.round6(probability), signals, null,
                clock.instant(), sourceHash);
    }

    private Verdict blended(String target, List<RuleSignal> signals, ModelScore modelScore, String sourceHash) {
        double total = config.getRuleWeight() + config.getModelWeight();
        double wRule = config.getRuleWeight() / total;
        double wModel = config.getModelWeight() / total;
        Map<RiskLabel, Double> ruleProbs = RuleEngine.probabilities(signals);

        RiskLabel label = null;
        double best = -1.0;
        for (RiskLabel l : RiskLabel.values()) {
            double p = CrawlerUtils.round6(wRule * ruleProbs.getOrDefault(l, 0.0) + wModel * modelScore.probabilityOf(l));
            if (p > best) {
                best = p;
                label = l;
            }
        }
        return new Verdict(target, label, CrawlerUtils.clamp01(best), signals,
                CrawlerUtils.round6(modelScore.probabilityOf(label)), clock.instant(), sourceHash);
    }
}
