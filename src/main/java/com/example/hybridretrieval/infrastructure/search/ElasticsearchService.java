package com.example.hybridretrieval.infrastructure.search;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.Refresh;
import co.elastic.clients.elasticsearch._types.query_dsl.MatchQuery;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.example.hybridretrieval.application.port.SearchBackend;
import com.example.hybridretrieval.domain.exception.BackendUnavailableException;
import com.example.hybridretrieval.domain.model.BulkIndexResult;
import com.example.hybridretrieval.domain.model.Chunk;
import com.example.hybridretrieval.domain.model.ChunkMetadata;
import com.example.hybridretrieval.domain.model.EmbeddedChunk;
import com.example.hybridretrieval.domain.model.HitScore;
import com.example.hybridretrieval.domain.model.RankedHit;
import com.example.hybridretrieval.domain.model.ScoreKind;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * {@link SearchBackend} over one Elasticsearch index holding chunk text (BM25), a {@code dense_vector}
 * embedding (kNN, HNSW) and chunk metadata.
 */
@Service
public class ElasticsearchService implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(ElasticsearchService.class);

    static final String TEXT_FIELD = "text";
    static final String VECTOR_FIELD = "text_vector";
    static final String METADATA_FIELD = "metadata";

    private final ElasticsearchClient client;
    private final String indexName;
    private final int dimensions;
    private final int efSearch;
    private final int hnswM;
    private final int hnswEfConstruction;

    private volatile boolean indexVerified;

    public ElasticsearchService(
            ElasticsearchClient client,
            @Value("${hybridretrieval.elasticsearch.index}") String indexName,
            @Value("${hybridretrieval.vector.dimensions}") int dimensions,
            @Value("${hybridretrieval.vector.ef-search}") int efSearch,
            @Value("${hybridretrieval.vector.hnsw.m}") int hnswM,
            @Value("${hybridretrieval.vector.hnsw.ef-construction}") int hnswEfConstruction
    ) {
        this.client = client;
        this.indexName = indexName;
        this.dimensions = dimensions;
        this.efSearch = efSearch;
        this.hnswM = hnswM;
        this.hnswEfConstruction = hnswEfConstruction;
    }

    public String indexName() {
        return indexName;
    }

    public void ensureIndexExists() {
        if (indexVerified) {
            return;
        }
        try {
            boolean exists = client.indices().exists(e -> e.index(indexName)).value();
            if (!exists) {
                createIndex();
            }
            indexVerified = true;
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Failed to ensure Elasticsearch index exists: " + indexName, e);
        }
    }

    /**
     * Drops the index (when present) and creates it again with the current mapping.
     */
    public void recreateIndex() {
        try {
            boolean exists = client.indices().exists(e -> e.index(indexName)).value();
            if (exists) {
                client.indices().delete(d -> d.index(indexName));
                log.info("event=es_index_deleted index={}", indexName);
            }
            createIndex();
            indexVerified = true;
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Failed to recreate Elasticsearch index: " + indexName, e);
        }
    }

    private void createIndex() throws IOException {
        String body = indexDefinition();
        CreateIndexRequest request = CreateIndexRequest.of(b -> b
                .index(indexName)
                .withJson(new StringReader(body)));
        client.indices().create(request);
        log.info("event=es_index_created index={} dims={} m={} efConstruction={}",
                indexName, dimensions, hnswM, hnswEfConstruction);
    }

    String indexDefinition() {
        return """
                {
                  "settings": {
                    "number_of_shards": 1,
                    "number_of_replicas": 0
                  },
                  "mappings": {
                    "properties": {
                      "text": { "type": "text", "analyzer": "standard" },
                      "text_vector": {
                        "type": "dense_vector",
                        "dims": %d,
                        "index": true,
                        "similarity": "cosine",
                        "index_options": { "type": "hnsw", "m": %d, "ef_construction": %d }
                      },
                      "metadata": {
                        "properties": {
                          "source": { "type": "keyword" },
                          "title": { "type": "text" },
                          "chunk_id": { "type": "integer" },
                          "total_chunks": { "type": "integer" },
                          "created_at": { "type": "date" }
                        }
                      }
                    }
                  }
                }
                """.formatted(dimensions, hnswM, hnswEfConstruction);
    }

    @Override
    public BulkIndexResult bulkIndex(List<EmbeddedChunk> items) {
        if (items == null || items.isEmpty()) {
            return new BulkIndexResult(0, List.of());
        }
        ensureIndexExists();

        List<BulkOperation> ops = new ArrayList<>(items.size());
        for (EmbeddedChunk item : items) {
            Map<String, Object> doc = esDoc(item);
            String id = documentId(item.chunk().metadata());
            ops.add(BulkOperation.of(b -> b
                    .index(i -> i
                            .index(indexName)
                            .id(id)
                            .document(doc)
                    )));
        }

        BulkResponse resp;
        try {
            // wait_for so chunks are searchable (and counted) as soon as ingest returns
            resp = client.bulk(BulkRequest.of(b -> b.operations(ops).refresh(Refresh.WaitFor)));
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Elasticsearch bulk index failed", e);
        }

        List<String> errors = new ArrayList<>();
        int success = 0;
        for (BulkResponseItem item : resp.items()) {
            if (item.error() != null) {
                errors.add(item.id() + ": " + item.error().reason());
                log.error("event=es_bulk_item_error id={} reason={}", item.id(), item.error().reason());
            } else {
                success++;
            }
        }

        if (errors.isEmpty()) {
            log.info("event=es_bulk_index_ok index={} count={} took={}ms", indexName, success, resp.took());
        } else {
            log.warn("event=es_bulk_index_errors index={} ok={} failed={} took={}ms",
                    indexName, success, errors.size(), resp.took());
        }
        return new BulkIndexResult(success, errors);
    }

    @Override
    public List<RankedHit> vectorSearch(float[] vector, int k) {
        ensureIndexExists();
        List<Float> queryVector = new ArrayList<>(vector.length);
        for (float v : vector) {
            queryVector.add(v);
        }
        int numCandidates = Math.max(k, efSearch);

        try {
            SearchResponse<Map> response = client.search(s -> s
                            .index(indexName)
                            .knn(kn -> kn
                                    .field(VECTOR_FIELD)
                                    .queryVector(queryVector)
                                    .k(k)
                                    .numCandidates(numCandidates))
                            .size(k)
                            .source(src -> src.filter(f -> f.includes(TEXT_FIELD, METADATA_FIELD))),
                    Map.class
            );

            List<RankedHit> hits = toRankedHits(response, ScoreKind.COSINE_SIMILARITY);
            log.info("event=es_knn_search topK={} numCandidates={} returned={}", k, numCandidates, hits.size());
            return hits;
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Elasticsearch kNN search failed", e);
        }
    }

    @Override
    public List<RankedHit> keywordSearch(String text, int k) {
        ensureIndexExists();
        try {
            SearchResponse<Map> response = client.search(s -> s
                            .index(indexName)
                            .query(MatchQuery.of(m -> m
                                    .field(TEXT_FIELD)
                                    .query(text)
                                    .fuzziness("AUTO"))._toQuery())
                            .size(k)
                            .source(src -> src.filter(f -> f.includes(TEXT_FIELD, METADATA_FIELD))),
                    Map.class
            );

            List<RankedHit> hits = toRankedHits(response, ScoreKind.BM25);
            log.info("event=es_bm25_search topK={} returned={}", k, hits.size());
            return hits;
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Elasticsearch BM25 search failed", e);
        }
    }

    @Override
    public long count() {
        try {
            return client.count(c -> c.index(indexName)).count();
        } catch (IOException | ElasticsearchException e) {
            throw new BackendUnavailableException("Elasticsearch count failed for index " + indexName, e);
        }
    }

    private static List<RankedHit> toRankedHits(SearchResponse<Map> response, ScoreKind kind) {
        List<RankedHit> hits = new ArrayList<>();
        for (Hit<Map> hit : response.hits().hits()) {
            Map src = hit.source();
            if (src == null) {
                continue;
            }
            hits.add(toRankedHit(src, hit.score(), kind));
        }
        return hits;
    }

    static RankedHit toRankedHit(Map<?, ?> src, Double score, ScoreKind kind) {
        Object text = src.get(TEXT_FIELD);
        Object md = src.get(METADATA_FIELD);
        ChunkMetadata metadata = ChunkMetadata.fromMap(md instanceof Map<?, ?> m ? m : Map.of());
        double value = score == null ? 0.0 : score;
        return new RankedHit(text == null ? "" : String.valueOf(text), metadata, new HitScore(kind, value));
    }

    static Map<String, Object> esDoc(EmbeddedChunk item) {
        Chunk chunk = item.chunk();
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(TEXT_FIELD, chunk.text());
        doc.put(VECTOR_FIELD, item.vector());
        doc.put(METADATA_FIELD, chunk.metadata().toMap());
        return doc;
    }

    // Stable per chunk, so re-ingesting a document overwrites its chunks instead of duplicating them.
    static String documentId(ChunkMetadata metadata) {
        return metadata.source() + "#" + metadata.chunkId();
    }
}
