package org.smileyface.riskcrawler.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.GetResponse;
import co.elastic.clients.elasticsearch.core.IndexResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.ElasticsearchTransport;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.elasticsearch.client.RestClient;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin wrapper around the Elasticsearch Java API client exposing the index and document operations
 * the state store needs.
 */
public class ElasticRestClient {

    private static final Logger log = LogManager.getLogger();
    private final ElasticsearchClient client;

    public ElasticRestClient(ElasticsearchClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * Builds a standalone client for a single node URL such as {@code http://localhost:9200}.
     */
    public static ElasticRestClient forUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
        log.info("ElasticRestClient initializing on {}", url);
        RestClient lowLevel = RestClient.builder(HttpHost.create(url)).build();
        ElasticsearchTransport transport = new RestClientTransport(lowLevel, new JacksonJsonpMapper());
        return new ElasticRestClient(new ElasticsearchClient(transport));
    }

    // ---------------- Indices ----------------

    public boolean indexExists(String indexName) throws IOException {
        return client.indices().exists(ExistsRequest.of(b -> b.index(indexName))).value();
    }

    /**
     * Creates an index with the provided JSON body (settings/mappings/aliases). The JSON should not include the index name.
     * @return true if created, false if already exists
     */
    public boolean createIndex(String indexName, String jsonBody) throws IOException {
        try {
            if (indexExists(indexName)) return false;
            client.indices().create(b -> b.index(indexName).withJson(new StringReader(jsonBody)));
            log.debug("Index {} created", indexName);
            return true;
        } catch (ElasticsearchException e) {
            log.error("Failed to create index {}", indexName, e);
            throw e;
        }
    }

    /**
     * Deletes the given index if it exists.
     * @return true if deleted, false if it did not exist
     */
    public boolean deleteIndex(String indexName) throws IOException {
        try {
            if (!indexExists(indexName)) return false;
            client.indices().delete(DeleteIndexRequest.of(b -> b.index(indexName)));
            log.debug("Index {} deleted", indexName);
            return true;
        } catch (ElasticsearchException e) {
            log.error("Failed to delete index {}", indexName, e);
            throw e;
        }
    }

    public void refresh(String indexName) throws IOException {
        client.indices().refresh(r -> r.index(indexName));
    }

    // ---------------- Documents ----------------

    /**
     * Indexes (creates or replaces) a document under the given id, or an auto-generated id when null.
     * @return the document id assigned by Elasticsearch
     */
    public String indexDocument(String indexName, String id, Object document, boolean refresh) throws IOException {
        requireIndex(indexName);
        if (document == null) {
            throw new IllegalArgumentException("document must not be null");
        }
        try {
            IndexResponse resp = client.index(b -> {
                b.index(indexName).document(document).refresh(refresh ? Refresh.True : Refresh.False);
                if (id != null && !id.isBlank()) b.id(id);
                return b;
            });
            log.debug("Indexed document {} into {}", resp.id(), indexName);
            return resp.id();
        } catch (ElasticsearchException e) {
            log.error("Failed to index document {} into index {}", id, indexName, e);
            throw e;
        }
    }

    /** One document of a {@link #bulkIndex} call. */
    public record IndexOp(String index, String id, Object document) {
        public IndexOp {
            requireIndex(index);
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id must not be null/blank");
            }
            Objects.requireNonNull(document, "document");
        }
    }

    /**
     * Indexes (creates or replaces) all documents in a single bulk request. Every document has an
     * explicit id, so the whole call can be retried after a partial failure.
     * @throws IOException if any document was rejected
     */
    public void bulkIndex(List<IndexOp> ops, boolean refresh) throws IOException {
        if (ops.isEmpty()) return;
        BulkResponse resp;
        try {
            resp = client.bulk(b -> {
                b.refresh(refresh ? Refresh.True : Refresh.False);
                for (IndexOp op : ops) {
                    b.operations(o -> o.index(i -> i.index(op.index()).id(op.id()).document(op.document())));
                }
                return b;
            });
        } catch (ElasticsearchException e) {
            log.error("Bulk write of {} documents failed", ops.size(), e);
            throw e;
        }
        if (resp.errors()) {
            List<String> failures = new ArrayList<>();
            for (BulkResponseItem item : resp.items()) {
                if (item.error() != null) {
                    failures.add(item.index() + "/" + item.id() + ": " + item.error().reason());
                }
            }
            log.error("Bulk write rejected {} of {} documents: {}", failures.size(), ops.size(), failures);
            throw new IOException("Bulk write rejected " + failures);
        }
    }

    /**
     * Creates a document only if no document with that id exists.
     * @return true if created, false on a version conflict
     */
    public boolean createDocument(String indexName, String id, Object document, boolean refresh) throws IOException {
        requireIndex(indexName);
        try {
            client.create(b -> b.index(indexName).id(id).document(document)
                    .refresh(refresh ? Refresh.True : Refresh.False));
            return true;
        } catch (ElasticsearchException e) {
            if (e.status() == 409) {
                return false;
            }
            log.error("Failed to create document {} in index {}", id, indexName, e);
            throw e;
        }
    }

    /**
     * Merges {@code fields} into the document, creating it from {@code fields} when missing. Null values
     * in the map clear the corresponding fields.
     */
    public void upsertFields(String indexName, String id, Map<String, Object> fields, boolean refresh) throws IOException {
        requireIndex(indexName);
        try {
            client.update(u -> u.index(indexName).id(id).doc(fields).docAsUpsert(true)
                    .refresh(refresh ? Refresh.True : Refresh.False), Object.class);
        } catch (ElasticsearchException e) {
            log.error("Failed to update document {} in index {}", id, indexName, e);
            throw e;
        }
    }

    /**
     * Fetches a document by id. Returns null if the document is not found.
     */
    public <T> T getDocument(String indexName, String id, Class<T> type) throws IOException {
        requireIndex(indexName);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null/blank");
        }
        try {
            GetResponse<T> resp = client.get(b -> b.index(indexName).id(id), type);
            if (!resp.found()) {
                log.debug("Document with id: {} not found in {}", id, indexName);
                return null;
            }
            return resp.source();
        } catch (ElasticsearchException e) {
            log.error("Failed to get document with id {} from index {}", id, indexName, e);
            throw e;
        }
    }

    public <T> SearchResponse<T> search(SearchRequest request, Class<T> type) throws IOException {
        try {
            return client.search(request, type);
        } catch (ElasticsearchException e) {
            log.error("Search on {} failed", request.index(), e);
            throw e;
        }
    }

    /**
     * Runs the request and returns the hit sources in order.
     */
    public <T> List<T> searchSources(SearchRequest request, Class<T> type) throws IOException {
        List<T> out = new ArrayList<>();
        for (Hit<T> h : search(request, type).hits().hits()) {
            if (h.source() != null) out.add(h.source());
        }
        return out;
    }

    public long count(String indexName, Query query) throws IOException {
        requireIndex(indexName);
        try {
            return client.count(c -> c.index(indexName).query(query)).count();
        } catch (ElasticsearchException e) {
            log.error("Count on {} failed", indexName, e);
            throw e;
        }
    }

    private static void requireIndex(String indexName) {
        if (indexName == null || indexName.isBlank()) {
            throw new IllegalArgumentException("indexName must not be null/blank");
        }
    }
}
