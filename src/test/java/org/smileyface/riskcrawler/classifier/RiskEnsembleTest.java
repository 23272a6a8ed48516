package org.smileyface.riskcrawler.classifier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.model.RiskLabel;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.testutil.MutableClock;
import org.smileyface.riskcrawler.util.CrawlerUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RiskEnsembleTest {

    private static final String TARGET = "https://offers.example/win";
    private static final String TEXT = "Congratulations! To receive your reward please send bank details today.";

    private MutableClock clock;
    private CrawlerProperties props;
    private RuleEngine rules;
    private ModelScorer scorer;
    private ScorerHealth health;
    private RiskEnsemble ensemble;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        props = new CrawlerProperties();
        rules = new RuleEngine(List.of(
                new KeywordRule("bank-details-request", RiskLabel.FRAUD, 0.9, List.of("send bank details"))));
        scorer = mock(ModelScorer.class);
        health = new ScorerHealth(clock, true);
        ensemble = new RiskEnsemble(rules, scorer, health, props, clock);
    }

    private static ModelScore fraudModel(double fraud) {
        Map<RiskLabel, Double> m = new EnumMap<>(RiskLabel.class);
        m.put(RiskLabel.FRAUD, fraud);
        m.put(RiskLabel.BENIGN, 1.0 - fraud);
        return ModelScore.of(m);
    }

    @Test
    void blendsRuleAndModelEvidence() {
        when(scorer.score(anyString(), any())).thenReturn(fraudModel(0.4));

        Verdict v = ensemble.classify(TEXT, TARGET);

        assertThat(v.label()).isEqualTo(RiskLabel.FRAUD);
        assertThat(v.probability()).isEqualTo(0.75);
        assertThat(v.modelScore()).isEqualTo(0.4);
        assertThat(v.ruleSignals()).extracting(s -> s.rule()).containsExactly("bank-details-request");
        assertThat(v.sourceHash()).isEqualTo(CrawlerUtils.sha256Hex(TEXT));
        assertThat(v.producedAt()).isEqualTo(clock.instant());
        assertThat(ensemble.isUncertain(v)).isTrue();
        assertThat(health.isDegraded()).isFalse();
    }

    @Test
    void fallsBackToRulesWhenScorerUnavailable() {
        when(scorer.score(anyString(), any())).thenReturn(ModelScore.unavailable("HTTP 503"));

        Verdict v = ensemble.classify(TEXT, TARGET);

        assertThat(v.label()).isEqualTo(RiskLabel.FRAUD);
        assertThat(v.probability()).isEqualTo(0.9);
        assertThat(v.modelScore()).isNull();
        assertThat(v.isModelBacked()).isFalse();
        assertThat(health.isDegraded()).isTrue();
        assertThat(health.snapshot().lastReason()).isEqualTo("HTTP 503");
    }

    @Test
    void scorerExceptionsAreTreatedAsUnavailable() {
        when(scorer.score(anyString(), any())).thenThrow(new IllegalStateException("boom"));

        Verdict v = ensemble.classify(TEXT, TARGET);

        assertThat(v.modelScore()).isNull();
        assertThat(v.probability()).isEqualTo(0.9);
        assertThat(health.snapshot().consecutiveUnavailable()).isEqualTo(1);
    }

    @Test
    void ruleOnlyWithoutSignalsIsBenign() {
        when(scorer.score(anyString(), any())).thenReturn(ModelScore.unavailable("down"));

        Verdict v = ensemble.classify("A recipe for lemon cake.", TARGET);

        assertThat(v.label()).isEqualTo(RiskLabel.BENIGN);
        assertThat(v.probability()).isEqualTo(1.0);
        assertThat(v.ruleSignals()).isEmpty();
        assertThat(ensemble.isUncertain(v)).isFalse();
    }

    @Test
    void reusesModelBackedVerdictForUnchangedContent() {
        when(scorer.score(anyString(), any())).thenReturn(fraudModel(0.4));
        Verdict first = ensemble.classify(TEXT, TARGET);

        clock.advance(Duration.ofHours(6));
        Verdict second = ensemble.classify(TEXT, TARGET, first);

        verify(scorer, times(1)).score(anyString(), any());
        assertThat(second.sameClassificationAs(first)).isTrue();
        assertThat(second.producedAt()).isEqualTo(clock.instant());
    }

    @Test
    void ruleOnlyVerdictIsNotReused() {
        when(scorer.score(anyString(), any())).thenReturn(ModelScore.unavailable("down"));
        Verdict ruleOnly = ensemble.classify(TEXT, TARGET);

        when(scorer.score(anyString(), any())).thenReturn(fraudModel(0.4));
        Verdict upgraded = ensemble.classify(TEXT, TARGET, ruleOnly);

        assertThat(upgraded.isModelBacked()).isTrue();
        assertThat(upgraded.probability()).isEqualTo(0.75);
    }

    @Test
    void identicalTextGivesIdenticalVerdict() {
        when(scorer.score(anyString(), any())).thenReturn(fraudModel(0.4));
        Verdict a = ensemble.classify(TEXT, TARGET);
        clock.advance(Duration.ofMinutes(1));
        Verdict b = ensemble.classify(TEXT, TARGET);
        assertThat(a.sameClassificationAs(b)).isTrue();
        assertThat(a.producedAt()).isNotEqualTo(b.producedAt());
    }

    @Test
    void changedContentCallsScorerAgain() {
        when(scorer.score(anyString(), any())).thenReturn(fraudModel(0.4));
        Verdict first = ensemble.classify(TEXT, TARGET);
        ensemble.classify(TEXT + " Offer ends soon.", TARGET, first);
        verify(scorer, times(2)).score(anyString(), any());
    }

    @Test
    void disabledScorerClassifiesRuleOnly() {
        ModelScorer disabled = (text, target) -> ModelScore.unavailable("scorer disabled");
        ScorerHealth disabledHealth = new ScorerHealth(clock, false);
        RiskEnsemble ruleOnly = new RiskEnsemble(rules, disabled, disabledHealth, props, clock);

        Verdict v = ruleOnly.classify(TEXT, TARGET);

        assertThat(v.probability()).isEqualTo(0.9);
        assertThat(disabledHealth.snapshot().scorerEnabled()).isFalse();
        assertThat(disabledHealth.snapshot().totalUnavailable()).isEqualTo(1);
    }

    @Test
    void uncertaintyBandsAroundEachBoundary() {
        Verdict atHalf = new Verdict(TARGET, RiskLabel.FRAUD, 0.53, List.of(), null, clock.instant(), "h");
        Verdict clear = new Verdict(TARGET, RiskLabel.FRAUD, 0.95, List.of(), null, clock.instant(), "h");
        Verdict between = new Verdict(TARGET, RiskLabel.FRAUD, 0.7, List.of(), null, clock.instant(), "h");
        assertThat(ensemble.isUncertain(atHalf)).isTrue();
        assertThat(ensemble.isUncertain(clear)).isFalse();
        assertThat(ensemble.isUncertain(between)).isFalse();
    }
}
