package org.smileyface.riskcrawler.elasticsearch;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.aggregations.Aggregate;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.riskcrawler.crawler.RevisitPolicy;
import org.smileyface.riskcrawler.model.FeedbackItem;
import org.smileyface.riskcrawler.model.PipelineStats;
import org.smileyface.riskcrawler.model.RiskBand;
import org.smileyface.riskcrawler.model.Target;
import org.smileyface.riskcrawler.model.TargetKind;
import org.smileyface.riskcrawler.model.TargetPage;
import org.smileyface.riskcrawler.model.TargetStatus;
import org.smileyface.riskcrawler.model.TargetView;
import org.smileyface.riskcrawler.model.Verdict;
import org.smileyface.riskcrawler.store.StateStore;
import org.smileyface.riskcrawler.store.StoreWriteException;
import org.smileyface.riskcrawler.util.CrawlerUtils;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State Store on Elasticsearch. Each target is a single document carrying its current verdict, so a
 * verdict write replaces target and verdict together. History documents are keyed by target and
 * visit number and go out in the same bulk request as the target document, so retrying a partly
 * failed write overwrites instead of duplicating.
 */
public class ElasticStateStore implements StateStore {

    private static final Logger log = LogManager.getLogger();

    private static final int PAGE_SIZE = 500;
    private static final int MAX_HISTORY = 10_000;

    private final ElasticRestClient client;
    private final String targetsIndex;
    private final String verdictsIndex;
    private final String feedbackIndex;
    private final boolean refreshOnWrite;

    public ElasticStateStore(ElasticRestClient client, String indexPrefix, boolean refreshOnWrite) {
        this.client = Objects.requireNonNull(client, "client");
        this.targetsIndex = CrawlerUtils.getIndexName(indexPrefix, "targets");
        this.verdictsIndex = CrawlerUtils.getIndexName(indexPrefix, "verdicts");
        this.feedbackIndex = CrawlerUtils.getIndexName(indexPrefix, "feedback");
        this.refreshOnWrite = refreshOnWrite;
    }

    /**
     * Creates the three indices from their classpath mappings when missing.
     */
    public void initialize() {
        try {
            createIfMissing(targetsIndex, "elasticsearch/targets-index.json");
            createIfMissing(verdictsIndex, "elasticsearch/verdicts-index.json");
            createIfMissing(feedbackIndex, "elasticsearch/feedback-index.json");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create state store indices", e);
        }
    }

    /**
     * Deletes all three indices.
     */
    public void dropIndices() {
        try {
            client.deleteIndex(targetsIndex);
            client.deleteIndex(verdictsIndex);
            client.deleteIndex(feedbackIndex);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not delete state store indices", e);
        }
    }

    private void createIfMissing(String index, String mappingResource) throws IOException {
        String body = new ClassPathResource(mappingResource).getContentAsString(StandardCharsets.UTF_8);
        if (client.createIndex(index, body)) {
            log.info("Created index {}", index);
        }
    }

    // ---------------- Targets ----------------

    @Override
    public Optional<Target> getTarget(String identifier) {
        return findDocument(identifier).map(TargetDocument::toTarget);
    }

    @Override
    public boolean registerIfAbsent(Target target) {
        Objects.requireNonNull(target, "target");
        try {
            return client.createDocument(targetsIndex, docId(target.identifier()),
                    TargetDocument.from(target, null), refreshOnWrite);
        } catch (IOException | ElasticsearchException e) {
            throw new StoreWriteException("Could not register " + target.identifier(), e);
        }
    }

    @Override
    public void putTarget(Target target) {
        Objects.requireNonNull(target, "target");
        try {
            client.upsertFields(targetsIndex, docId(target.identifier()),
                    TargetDocument.targetFields(target), refreshOnWrite);
        } catch (IOException | ElasticsearchException e) {
            throw new StoreWriteException("Could not store " + target.identifier(), e);
        }
    }

    @Override
    public void recordVerdict(Target target, Verdict verdict) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(verdict, "verdict");
        if (!target.identifier().equals(verdict.target())) {
            throw new IllegalArgumentException("verdict " + verdict.target() + " does not belong to " + target.identifier());
        }
        String id = docId(target.identifier());
        try {
            client.bulkIndex(List.of(
                    new ElasticRestClient.IndexOp(verdictsIndex, historyId(id, target.visitCount()), VerdictDocument.from(verdict)),
                    new ElasticRestClient.IndexOp(targetsIndex, id, TargetDocument.from(target, verdict))),
                    refreshOnWrite);
        } catch (IOException | ElasticsearchException e) {
            throw new StoreWriteException("Could not record verdict for " + target.identifier(), e);
        }
    }

    @Override
    public Optional<Verdict> currentVerdict(String identifier) {
        return findDocument(identifier).map(TargetDocument::toVerdict);
    }

    @Override
    public List<Verdict> verdictHistory(String identifier) {
        SearchRequest req = SearchRequest.of(s -> s.index(verdictsIndex)
                .query(term("target", identifier))
                .size(MAX_HISTORY)
                .sort(so -> so.field(f -> f.field("producedAt").order(SortOrder.Asc))));
        List<Verdict> out = new ArrayList<>();
        for (VerdictDocument d : read(() -> client.searchSources(req, VerdictDocument.class))) {
            out.add(d.toVerdict());
        }
        return out;
    }

    @Override
    public List<Target> listTargets(TargetStatus status) {
        Query query = status == null ? Query.of(q -> q.matchAll(m -> m)) : term("status", status.name());
        List<Target> out = new ArrayList<>();
        for (TargetDocument d : scanTargets(query)) {
            out.add(d.toTarget());
        }
        return out;
    }

    /**
     * Reads each document once, using its embedded verdict instead of a lookup per target.
     */
    @Override
    public List<Target> listPending(Instant now, RevisitPolicy policy) {
        Query notFailed = Query.of(q -> q.bool(b -> b.mustNot(term("status", TargetStatus.PERMANENTLY_FAILED.name()))));
        List<Target> out = new ArrayList<>();
        for (TargetDocument d : scanTargets(notFailed)) {
            Target t = d.toTarget();
            if (t.status() != TargetStatus.DONE) {
                out.add(t);
                continue;
            }
            Instant next = policy.nextVisit(t, d.toVerdict());
            if (next == null || !next.isAfter(now)) out.add(t);
        }
        return out;
    }

    @Override
    public TargetPage listByRiskBand(RiskBand band, TargetKind kind, int offset, int limit) {
        List<Query> filters = new ArrayList<>();
        if (band != null) filters.add(term("band", band.name()));
        if (kind != null) filters.add(term("kind", kind.name()));
        int from = Math.max(0, offset);
        int size = Math.max(0, limit);
        SearchRequest req = SearchRequest.of(s -> s.index(targetsIndex)
                .query(q -> q.bool(b -> b.filter(filters)))
                .from(from)
                .size(size)
                .trackTotalHits(t -> t.enabled(true))
                .sort(so -> so.field(f -> f.field("riskScore").order(SortOrder.Desc)))
                .sort(so -> so.field(f -> f.field("verdict.producedAt").order(SortOrder.Desc)))
                .sort(so -> so.field(f -> f.field("identifier").order(SortOrder.Asc))));
        SearchResponse<TargetDocument> resp = read(() -> client.search(req, TargetDocument.class));
        List<TargetView> items = new ArrayList<>();
        for (Hit<TargetDocument> h : resp.hits().hits()) {
            if (h.source() == null) continue;
            items.add(TargetView.of(h.source().toTarget(), h.source().toVerdict()));
        }
        long total = resp.hits().total() == null ? items.size() : resp.hits().total().value();
        return new TargetPage(items, total, offset, limit);
    }

    // ---------------- Feedback ----------------

    @Override
    public void putFeedback(FeedbackItem item) {
        Objects.requireNonNull(item, "item");
        try {
            client.indexDocument(feedbackIndex, item.id(), FeedbackDocument.from(item), refreshOnWrite);
        } catch (IOException | ElasticsearchException e) {
            throw new StoreWriteException("Could not store feedback item " + item.id(), e);
        }
    }

    @Override
    public Optional<FeedbackItem> getFeedback(String id) {
        FeedbackDocument d = read(() -> client.getDocument(feedbackIndex, id, FeedbackDocument.class));
        return d == null ? Optional.empty() : Optional.of(d.toItem());
    }

    @Override
    public List<FeedbackItem> listFeedback(boolean unresolvedOnly, int limit) {
        if (limit <= 0) return List.of();
        Query query = unresolvedOnly ? term("resolved", false) : Query.of(q -> q.matchAll(m -> m));
        SearchRequest req = SearchRequest.of(s -> s.index(feedbackIndex)
                .query(query)
                .size(Math.min(limit, MAX_HISTORY))
                .sort(so -> so.field(f -> f.field("enqueuedAt").order(SortOrder.Asc)))
                .sort(so -> so.field(f -> f.field("id").order(SortOrder.Asc))));
        List<FeedbackItem> out = new ArrayList<>();
        for (FeedbackDocument d : read(() -> client.searchSources(req, FeedbackDocument.class))) {
            out.add(d.toItem());
        }
        return out;
    }

    // ---------------- Stats ----------------

    @Override
    public PipelineStats stats(Instant now) {
        Query all = Query.of(q -> q.matchAll(m -> m));
        Query flagged = term("flagged", true);
        long startOfDay = now.truncatedTo(ChronoUnit.DAYS).toEpochMilli();
        long weekAgo = now.minus(Duration.ofDays(7)).toEpochMilli();

        return read(() -> {
            long total = client.count(targetsIndex, all);
            Map<TargetStatus, Long> byStatus = new EnumMap<>(TargetStatus.class);
            for (TargetStatus s : TargetStatus.values()) {
                byStatus.put(s, client.count(targetsIndex, term("status", s.name())));
            }
            long flaggedCount = client.count(targetsIndex, flagged);
            Map<RiskBand, Long> byBand = new EnumMap<>(RiskBand.class);
            for (RiskBand b : RiskBand.values()) {
                byBand.put(b, client.count(targetsIndex, and(flagged, term("band", b.name()))));
            }
            long today = client.count(targetsIndex, and(flagged, producedSince(startOfDay)));
            long week = client.count(targetsIndex, and(flagged, producedSince(weekAgo)));

            double avg = 0.0;
            if (flaggedCount > 0) {
                SearchResponse<Void> resp = client.search(SearchRequest.of(s -> s.index(targetsIndex)
                        .size(0).query(flagged)
                        .aggregations("avg_risk", a -> a.avg(v -> v.field("riskScore")))), Void.class);
                Aggregate agg = resp.aggregations().get("avg_risk");
                avg = agg == null ? 0.0 : agg.avg().value();
            }
            SearchResponse<Void> domains = client.search(SearchRequest.of(s -> s.index(targetsIndex)
                    .size(0).query(all)
                    .aggregations("domains", a -> a.cardinality(c -> c.field("domain")))), Void.class);
            Aggregate domainAgg = domains.aggregations().get("domains");
            long uniqueDomains = domainAgg == null ? 0L : domainAgg.cardinality().value();

            long unresolved = client.count(feedbackIndex, term("resolved", false));
            return new PipelineStats(total, byStatus, flaggedCount, byBand, today, week,
                    CrawlerUtils.round6(avg), uniqueDomains, unresolved);
        });
    }

    // ---------------- Helpers ----------------

    private Optional<TargetDocument> findDocument(String identifier) {
        if (identifier == null || identifier.isBlank()) return Optional.empty();
        return Optional.ofNullable(read(() -> client.getDocument(targetsIndex, docId(identifier), TargetDocument.class)));
    }

    private List<TargetDocument> scanTargets(Query query) {
        List<TargetDocument> out = new ArrayList<>();
        List<FieldValue> after = null;
        while (true) {
            List<FieldValue> cursor = after;
            SearchRequest req = SearchRequest.of(s -> {
                s.index(targetsIndex).query(query).size(PAGE_SIZE)
                        .sort(so -> so.field(f -> f.field("identifier").order(SortOrder.Asc)));
                if (cursor != null) s.searchAfter(cursor);
                return s;
            });
            List<Hit<TargetDocument>> hits = read(() -> client.search(req, TargetDocument.class)).hits().hits();
            for (Hit<TargetDocument> h : hits) {
                if (h.source() != null) out.add(h.source());
            }
            if (hits.size() < PAGE_SIZE) return out;
            after = hits.get(hits.size() - 1).sort();
        }
    }

    static String docId(String identifier) {
        return CrawlerUtils.sha256Hex(identifier);
    }

    static String historyId(String targetDocId, int visitCount) {
        return targetDocId + "-" + visitCount;
    }

    private static Query term(String field, String value) {
        return Query.of(q -> q.term(t -> t.field(field).value(value)));
    }

    private static Query term(String field, boolean value) {
        return Query.of(q -> q.term(t -> t.field(field).value(value)));
    }

    private static Query and(Query a, Query b) {
        return Query.of(q -> q.bool(x -> x.filter(a, b)));
    }

    private static Query producedSince(long epochMillis) {
        return Query.of(q -> q.range(r -> r.field("verdict.producedAt").gte(JsonData.of(epochMillis))));
    }

    private <T> T read(IoCall<T> call) {
        try {
            return call.run();
        } catch (IOException e) {
            throw new UncheckedIOException("State store read failed", e);
        }
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
