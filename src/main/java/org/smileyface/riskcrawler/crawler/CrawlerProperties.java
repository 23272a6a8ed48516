package org.smileyface.riskcrawler.crawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.model.RiskBand;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Configuration properties for the discovery and classification pipeline.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    static final String DEFAULTS_RESOURCE = "RiskCrawlerConfig.json";

    /**
     * Namespace/prefix for distributed frontier keys in Redis. Defaults to "riskcrawler".
     */
    private String queueNamespace = "riskcrawler";

    /** Prefix of the Elasticsearch indices backing the state store. */
    private String indexPrefix = "riskcrawler";

    /** Start the worker pool once the application is ready. */
    private boolean autoStart = false;

    private FrontierConfig frontier = new FrontierConfig();
    private WorkerConfig worker = new WorkerConfig();
    private FetchConfig fetch = new FetchConfig();
    private EnsembleConfig ensemble = new EnsembleConfig();
    private ScorerConfig scorer = new ScorerConfig();
    private SeedsConfig seeds = new SeedsConfig();

    /** Ordered rule definitions evaluated by the rule engine. */
    private List<RuleConfig> rules = new ArrayList<>();

    /** Page-specific extraction settings (URL regex + CSS selector). */
    private List<PageConfig> pages = new ArrayList<>();

    /**
     * Loads default values from classpath resource RiskCrawlerConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                ObjectMapper mapper = new ObjectMapper();
                RiskCrawlerConfig cfg = mapper.readValue(in, RiskCrawlerConfig.class);
                if (cfg.queueNamespace != null && !cfg.queueNamespace.isBlank()) this.queueNamespace = cfg.queueNamespace;
                if (cfg.indexPrefix != null && !cfg.indexPrefix.isBlank()) this.indexPrefix = cfg.indexPrefix;
                if (cfg.autoStart != null) this.autoStart = cfg.autoStart;
                if (cfg.frontier != null) this.frontier = cfg.frontier;
                if (cfg.worker != null) this.worker = cfg.worker;
                if (cfg.fetch != null) this.fetch = cfg.fetch;
                if (cfg.ensemble != null) this.ensemble = cfg.ensemble;
                if (cfg.scorer != null) this.scorer = cfg.scorer;
                if (cfg.seeds != null) this.seeds = cfg.seeds;
                if (cfg.rules != null) this.rules = new ArrayList<>(cfg.rules);
                if (cfg.pages != null) this.pages = new ArrayList<>(cfg.pages);
            }
        } catch (Exception e) {
            // keep built-in defaults, startup guardrails still apply
            log.error("Failed to load default crawler configuration from classpath resource {}", DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Startup guardrails. Violations fail application start.
     */
    @PostConstruct
    public void validate() {
        FrontierConfig f = frontier;
        if (f.getBatchSize() < 1) {
            throw new IllegalStateException("crawler.frontier.batchSize must be >= 1");
        }
        if (f.getMaxRetries() < 1) {
            throw new IllegalStateException("crawler.frontier.maxRetries must be >= 1");
        }
        if (f.getBackoffBaseMs() <= 0 || f.getBackoffMaxMs() < f.getBackoffBaseMs()) {
            throw new IllegalStateException("crawler.frontier backoff requires 0 < backoffBaseMs <= backoffMaxMs");
        }
        if (f.getRevisitHighMs() <= 0
                || f.getRevisitHighMs() > f.getRevisitMediumMs()
                || f.getRevisitMediumMs() > f.getRevisitLowMs()) {
            throw new IllegalStateException("crawler.frontier revisit intervals must satisfy 0 < high <= medium <= low, got "
                    + f.getRevisitHighMs() + "/" + f.getRevisitMediumMs() + "/" + f.getRevisitLowMs());
        }
        if (ensemble.getRuleWeight() < 0 || ensemble.getModelWeight() < 0
                || ensemble.getRuleWeight() + ensemble.getModelWeight() <= 0) {
            throw new IllegalStateException("crawler.ensemble weights must be non-negative with a positive sum");
        }
        if (ensemble.getUncertainMargin() < 0 || ensemble.getUncertainMargin() >= 0.5) {
            throw new IllegalStateException("crawler.ensemble.uncertainMargin must be in [0, 0.5)");
        }
        if (fetch.getPerHostDelayMs() < 0) {
            throw new IllegalStateException("crawler.fetch.perHostDelayMs must be >= 0");
        }
        if (fetch.getRobotsCacheTtlMs() <= 0 || fetch.getRobotsCacheMaxEntries() < 1) {
            throw new IllegalStateException("crawler.fetch robots cache requires robotsCacheTtlMs > 0 and robotsCacheMaxEntries >= 1");
        }
        if (worker.getCount() < 1) {
            throw new IllegalStateException("crawler.worker.count must be >= 1");
        }
        for (RuleConfig r : rules) {
            if (r == null || r.getName() == null || r.getName().isBlank()) {
                throw new IllegalStateException("crawler.rules entries need a name");
            }
            if (r.getWeight() <= 0 || r.getWeight() > 1) {
                throw new IllegalStateException("crawler.rules[" + r.getName() + "].weight must be in (0, 1]");
            }
        }
    }

    /**
     * Returns the CSS selector narrowing text extraction for the given URL: the selector of the first
     * page config (in declaration order) whose pattern is found in the URL, or null when none matches.
     * Invalid regex patterns are skipped.
     */
    public String selectorFor(String url) {
        if (url == null || url.isBlank() || pages == null) return null;
        for (PageConfig p : pages) {
            if (p == null || p.getUrlPattern() == null || p.getUrlPattern().isBlank()) continue;
            try {
                if (Pattern.compile(p.getUrlPattern()).matcher(url).find()) {
                    return p.getSelector();
                }
            } catch (PatternSyntaxException e) {
                log.warn("Invalid page urlPattern in crawler config: {} (ignored)", p.getUrlPattern());
            }
        }
        return null;
    }

    public String getQueueNamespace() {
        return queueNamespace;
    }

    public void setQueueNamespace(String queueNamespace) {
        this.queueNamespace = (queueNamespace == null || queueNamespace.isBlank()) ? "riskcrawler" : queueNamespace;
    }

    public String getIndexPrefix() {
        return indexPrefix;
    }

    public void setIndexPrefix(String indexPrefix) {
        this.indexPrefix = (indexPrefix == null || indexPrefix.isBlank()) ? "riskcrawler" : indexPrefix;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public FrontierConfig getFrontier() {
        return frontier;
    }

    public void setFrontier(FrontierConfig frontier) {
        this.frontier = frontier != null ? frontier : new FrontierConfig();
    }

    public WorkerConfig getWorker() {
        return worker;
    }

    public void setWorker(WorkerConfig worker) {
        this.worker = worker != null ? worker : new WorkerConfig();
    }

    public FetchConfig getFetch() {
        return fetch;
    }

    public void setFetch(FetchConfig fetch) {
        this.fetch = fetch != null ? fetch : new FetchConfig();
    }

    public EnsembleConfig getEnsemble() {
        return ensemble;
    }

    public void setEnsemble(EnsembleConfig ensemble) {
        this.ensemble = ensemble != null ? ensemble : new EnsembleConfig();
    }

    public ScorerConfig getScorer() {
        return scorer;
    }

    public void setScorer(ScorerConfig scorer) {
        this.scorer = scorer != null ? scorer : new ScorerConfig();
    }

    public SeedsConfig getSeeds() {
        return seeds;
    }

    public void setSeeds(SeedsConfig seeds) {
        this.seeds = seeds != null ? seeds : new SeedsConfig();
    }

    public List<RuleConfig> getRules() {
        return rules;
    }

    public void setRules(List<RuleConfig> rules) {
        this.rules = rules != null ? rules : new ArrayList<>();
    }

    public List<PageConfig> getPages() {
        return pages;
    }

    public void setPages(List<PageConfig> pages) {
        this.pages = pages != null ? pages : new ArrayList<>();
    }

    // --------- Nested config DTOs, shared by JSON defaults and Spring binding ---------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RiskCrawlerConfig {
        public String queueNamespace;
        public String indexPrefix;
        public Boolean autoStart;
        public FrontierConfig frontier;
        public WorkerConfig worker;
        public FetchConfig fetch;
        public EnsembleConfig ensemble;
        public ScorerConfig scorer;
        public SeedsConfig seeds;
        public List<RuleConfig> rules;
        public List<PageConfig> pages;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FrontierConfig {
        private int batchSize = 10;
        private double defaultPriority = 1.0;
        /** Added to the default priority, scaled by the verdict's risk score, after a successful visit. */
        private double riskPriorityBoost = 10.0;
        private int maxRetries = 3;
        private long backoffBaseMs = 30_000L;
        private long backoffMaxMs = 3_600_000L;
        private long revisitHighMs = 6 * 3_600_000L;
        private long revisitMediumMs = 24 * 3_600_000L;
        private long revisitLowMs = 72 * 3_600_000L;

        public long revisitIntervalMs(RiskBand band) {
            if (band == null) return revisitLowMs;
            return switch (band) {
                case HIGH -> revisitHighMs;
                case MEDIUM -> revisitMediumMs;
                case LOW -> revisitLowMs;
            };
        }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public double getDefaultPriority() { return defaultPriority; }
        public void setDefaultPriority(double defaultPriority) { this.defaultPriority = defaultPriority; }
        public double getRiskPriorityBoost() { return riskPriorityBoost; }
        public void setRiskPriorityBoost(double riskPriorityBoost) { this.riskPriorityBoost = riskPriorityBoost; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getBackoffBaseMs() { return backoffBaseMs; }
        public void setBackoffBaseMs(long backoffBaseMs) { this.backoffBaseMs = backoffBaseMs; }
        public long getBackoffMaxMs() { return backoffMaxMs; }
        public void setBackoffMaxMs(long backoffMaxMs) { this.backoffMaxMs = backoffMaxMs; }
        public long getRevisitHighMs() { return revisitHighMs; }
        public void setRevisitHighMs(long revisitHighMs) { this.revisitHighMs = revisitHighMs; }
        public long getRevisitMediumMs() { return revisitMediumMs; }
        public void setRevisitMediumMs(long revisitMediumMs) { this.revisitMediumMs = revisitMediumMs; }
        public long getRevisitLowMs() { return revisitLowMs; }
        public void setRevisitLowMs(long revisitLowMs) { this.revisitLowMs = revisitLowMs; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WorkerConfig {
        private int count = 4;
        private long idlePollMs = 500L;
        /** When true, workers complete once the frontier has nothing eligible and nothing in progress. */
        private boolean drain = false;

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
        public long getIdlePollMs() { return idlePollMs; }
        public void setIdlePollMs(long idlePollMs) { this.idlePollMs = idlePollMs; }
        public boolean isDrain() { return drain; }
        public void setDrain(boolean drain) { this.drain = drain; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FetchConfig {
        private String userAgent = "SmileyfaceRiskCrawler/0.1";
        private int requestTimeoutMs = 10_000;
        private int maxBodyBytes = 2 * 1024 * 1024;
        private boolean respectRobots = true;
        private int maxDiscoveredPerPage = 200;
        /**
         * List of Java regex patterns; a URL must match at least one include (if provided) to be accepted.
         */
        private List<String> includeUrlPatterns = new ArrayList<>();
        /**
         * List of Java regex patterns; a URL matching any exclude will be rejected.
         */
        private List<String> excludeUrlPatterns = new ArrayList<>();
        private boolean discoverPages = true;
        private boolean discoverChannels = true;
        /** Base URL of the public channel web preview. */
        private String channelPreviewBaseUrl = "https://t.me";
        private String channelMessageSelector = ".tgme_widget_message_text";
        private int maxMessagesPerChannel = 200;
        /** Minimum gap between two requests to the same host, shared by all workers of a process. */
        private long perHostDelayMs = 2_000L;
        private long robotsCacheTtlMs = 24 * 3_600_000L;
        private int robotsCacheMaxEntries = 10_000;

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }
        public int getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }
        public int getMaxBodyBytes() { return maxBodyBytes; }
        public void setMaxBodyBytes(int maxBodyBytes) { this.maxBodyBytes = maxBodyBytes; }
        public boolean isRespectRobots() { return respectRobots; }
        public void setRespectRobots(boolean respectRobots) { this.respectRobots = respectRobots; }
        public int getMaxDiscoveredPerPage() { return maxDiscoveredPerPage; }
        public void setMaxDiscoveredPerPage(int maxDiscoveredPerPage) { this.maxDiscoveredPerPage = maxDiscoveredPerPage; }
        public List<String> getIncludeUrlPatterns() { return includeUrlPatterns; }
        public void setIncludeUrlPatterns(List<String> includeUrlPatterns) {
            this.includeUrlPatterns = includeUrlPatterns != null ? includeUrlPatterns : new ArrayList<>();
        }
        public List<String> getExcludeUrlPatterns() { return excludeUrlPatterns; }
        public void setExcludeUrlPatterns(List<String> excludeUrlPatterns) {
            this.excludeUrlPatterns = excludeUrlPatterns != null ? excludeUrlPatterns : new ArrayList<>();
        }
        public boolean isDiscoverPages() { return discoverPages; }
        public void setDiscoverPages(boolean discoverPages) { this.discoverPages = discoverPages; }
        public boolean isDiscoverChannels() { return discoverChannels; }
        public void setDiscoverChannels(boolean discoverChannels) { this.discoverChannels = discoverChannels; }
        public String getChannelPreviewBaseUrl() { return channelPreviewBaseUrl; }
        public void setChannelPreviewBaseUrl(String channelPreviewBaseUrl) { this.channelPreviewBaseUrl = channelPreviewBaseUrl; }
        public String getChannelMessageSelector() { return channelMessageSelector; }
        public void setChannelMessageSelector(String channelMessageSelector) { this.channelMessageSelector = channelMessageSelector; }
        public int getMaxMessagesPerChannel() { return maxMessagesPerChannel; }
        public void setMaxMessagesPerChannel(int maxMessagesPerChannel) { this.maxMessagesPerChannel = maxMessagesPerChannel; }
        public long getPerHostDelayMs() { return perHostDelayMs; }
        public void setPerHostDelayMs(long perHostDelayMs) { this.perHostDelayMs = perHostDelayMs; }
        public long getRobotsCacheTtlMs() { return robotsCacheTtlMs; }
        public void setRobotsCacheTtlMs(long robotsCacheTtlMs) { this.robotsCacheTtlMs = robotsCacheTtlMs; }
        public int getRobotsCacheMaxEntries() { return robotsCacheMaxEntries; }
        public void setRobotsCacheMaxEntries(int robotsCacheMaxEntries) { this.robotsCacheMaxEntries = robotsCacheMaxEntries; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EnsembleConfig {
        private double ruleWeight = 0.7;
        private double modelWeight = 0.3;
        private double uncertainMargin = 0.05;
        private List<Double> decisionBoundaries = new ArrayList<>(List.of(0.5, 0.6, 0.8));
        private int maxTextLength = 20_000;

        public double getRuleWeight() { return ruleWeight; }
        public void setRuleWeight(double ruleWeight) { this.ruleWeight = ruleWeight; }
        public double getModelWeight() { return modelWeight; }
        public void setModelWeight(double modelWeight) { this.modelWeight = modelWeight; }
        public double getUncertainMargin() { return uncertainMargin; }
        public void setUncertainMargin(double uncertainMargin) { this.uncertainMargin = uncertainMargin; }
        public List<Double> getDecisionBoundaries() { return decisionBoundaries; }
        public void setDecisionBoundaries(List<Double> decisionBoundaries) {
            this.decisionBoundaries = decisionBoundaries != null ? decisionBoundaries : new ArrayList<>();
        }
        public int getMaxTextLength() { return maxTextLength; }
        public void setMaxTextLength(int maxTextLength) { this.maxTextLength = maxTextLength; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ScorerConfig {
        private boolean enabled = false;
        private String endpoint;
        private int timeoutMs = 5_000;
        /** Model label name -> pipeline label name, e.g. spam -> fraud. */
        private Map<String, String> labelAliases = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public int getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }
        public Map<String, String> getLabelAliases() { return labelAliases; }
        public void setLabelAliases(Map<String, String> labelAliases) {
            this.labelAliases = labelAliases != null ? labelAliases : new LinkedHashMap<>();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedsConfig {
        private List<String> identifiers = new ArrayList<>();
        /** Classpath or filesystem path of a seeds file, one identifier per line, '#' comments. */
        private String file;

        public List<String> getIdentifiers() { return identifiers; }
        public void setIdentifiers(List<String> identifiers) {
            this.identifiers = identifiers != null ? identifiers : new ArrayList<>();
        }
        public String getFile() { return file; }
        public void setFile(String file) { this.file = file; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleConfig {

        public RuleConfig() {} // for JSON mapping
        public RuleConfig(String name, String type, String label, double weight, List<String> terms) {
            this.name = name;
            this.type = type;
            this.label = label;
            this.weight = weight;
            this.terms = terms;
        }

        private String name;
        /** keyword | pattern | indicator-list */
        private String type = "keyword";
        private String label;
        private double weight;
        private List<String> terms = new ArrayList<>();
        private String pattern;
        /** Classpath resource holding indicator terms, for indicator-list rules. */
        private String resource;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
        public List<String> getTerms() { return terms; }
        public void setTerms(List<String> terms) { this.terms = terms != null ? terms : new ArrayList<>(); }
        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public String getResource() { return resource; }
        public void setResource(String resource) { this.resource = resource; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PageConfig {

        public PageConfig() {} // for JSON mapping
        public PageConfig(String urlPattern, String selector) {
            this.urlPattern = urlPattern;
            this.selector = selector;
        }

        private String urlPattern;
        private String selector;

        public String getUrlPattern() { return urlPattern; }
        public void setUrlPattern(String urlPattern) { this.urlPattern = urlPattern; }
        public String getSelector() { return selector; }
        public void setSelector(String selector) { this.selector = selector; }
    }
}
