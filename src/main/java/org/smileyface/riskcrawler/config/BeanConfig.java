package org.smileyface.riskcrawler.config;

import org.smileyface.riskcrawler.classifier.HttpModelScorer;
import org.smileyface.riskcrawler.classifier.ModelScore;
import org.smileyface.riskcrawler.classifier.ModelScorer;
import org.smileyface.riskcrawler.classifier.RiskEnsemble;
import org.smileyface.riskcrawler.classifier.RuleEngine;
import org.smileyface.riskcrawler.classifier.ScorerHealth;
import org.smileyface.riskcrawler.crawler.CrawlerProperties;
import org.smileyface.riskcrawler.crawler.Frontier;
import org.smileyface.riskcrawler.crawler.InMemoryFrontier;
import org.smileyface.riskcrawler.crawler.RedisFrontier;
import org.smileyface.riskcrawler.crawler.RevisitPolicy;
import org.smileyface.riskcrawler.elasticsearch.ElasticRestClient;
import org.smileyface.riskcrawler.elasticsearch.ElasticStateStore;
import org.smileyface.riskcrawler.extractor.ContentExtractor;
import org.smileyface.riskcrawler.feedback.FeedbackQueue;
import org.smileyface.riskcrawler.fetch.FetchClient;
import org.smileyface.riskcrawler.fetch.JsoupFetchClient;
import org.smileyface.riskcrawler.fetch.RobotsPolicy;
import org.smileyface.riskcrawler.store.InMemoryStateStore;
import org.smileyface.riskcrawler.store.StateStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.Locale;

/**
 * Wires the pipeline components. Frontier and State Store implementations are chosen by
 * {@code crawler.queue.type} and {@code crawler.store.type}.
 */
@Configuration
public class BeanConfig {

    @Value("${crawler.queue.type:in-memory}")
    private String queueType;

    @Value("${crawler.store.type:in-memory}")
    private String storeType;

    @Value("${crawler.store.refresh-on-write:false}")
    private boolean refreshOnWrite;

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RevisitPolicy revisitPolicy(CrawlerProperties properties) {
        return new RevisitPolicy(properties);
    }

    /**
     * Supported values of {@code crawler.queue.type}:
     * - "in-memory" (default): {@link InMemoryFrontier}
     * - "redis": {@link RedisFrontier}; requires a Redis connection
     */
    @Bean
    public Frontier frontier(ObjectProvider<StringRedisTemplate> redisProvider,
                             CrawlerProperties properties,
                             RevisitPolicy policy,
                             Clock clock) {
        String kind = normalize(queueType);
        if ("redis".equals(kind)) {
            StringRedisTemplate template = redisProvider.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("crawler.queue.type=redis but no Redis connection is configured");
            }
            return new RedisFrontier(template, properties, policy, clock);
        }
        if (!"in-memory".equals(kind)) {
            throw new IllegalStateException("Unknown crawler.queue.type: " + queueType);
        }
        return new InMemoryFrontier(policy, clock);
    }

    /**
     * Supported values of {@code crawler.store.type}: "in-memory" (default) and "elasticsearch".
     */
    @Bean
    public StateStore stateStore(ObjectProvider<ElasticRestClient> elasticProvider, CrawlerProperties properties) {
        String kind = normalize(storeType);
        if ("elasticsearch".equals(kind)) {
            ElasticRestClient client = elasticProvider.getIfAvailable();
            if (client == null) {
                throw new IllegalStateException("crawler.store.type=elasticsearch but no Elasticsearch client is configured");
            }
            ElasticStateStore store = new ElasticStateStore(client, properties.getIndexPrefix(), refreshOnWrite);
            store.initialize();
            return store;
        }
        if (!"in-memory".equals(kind)) {
            throw new IllegalStateException("Unknown crawler.store.type: " + storeType);
        }
        return new InMemoryStateStore();
    }

    @Bean
    public RobotsPolicy robotsPolicy(CrawlerProperties properties, Clock clock) {
        return new RobotsPolicy(properties, clock);
    }

    @Bean
    public FetchClient fetchClient(CrawlerProperties properties, RobotsPolicy robotsPolicy, Clock clock) {
        return new JsoupFetchClient(properties, robotsPolicy, clock);
    }

    @Bean
    public ContentExtractor contentExtractor(CrawlerProperties properties) {
        return new ContentExtractor(properties);
    }

    @Bean
    public RuleEngine ruleEngine(CrawlerProperties properties) {
        return RuleEngine.fromConfig(properties.getRules());
    }

    @Bean
    public ModelScorer modelScorer(CrawlerProperties properties) {
        CrawlerProperties.ScorerConfig scorer = properties.getScorer();
        if (scorer.isEnabled()) {
            return new HttpModelScorer(scorer);
        }
        return (text, target) -> ModelScore.unavailable("scorer disabled");
    }

    @Bean
    public ScorerHealth scorerHealth(CrawlerProperties properties, Clock clock) {
        return new ScorerHealth(clock, properties.getScorer().isEnabled());
    }

    @Bean
    public RiskEnsemble riskEnsemble(RuleEngine ruleEngine, ModelScorer modelScorer, ScorerHealth scorerHealth,
                                     CrawlerProperties properties, Clock clock) {
        return new RiskEnsemble(ruleEngine, modelScorer, scorerHealth, properties, clock);
    }

    @Bean
    public FeedbackQueue feedbackQueue(StateStore stateStore, Clock clock) {
        return new FeedbackQueue(stateStore, clock);
    }

    private static String normalize(String type) {
        return type == null || type.isBlank() ? "in-memory" : type.trim().toLowerCase(Locale.ROOT);
    }
}
