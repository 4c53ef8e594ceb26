package com.example.hybridretrieval.application.service;

import com.example.hybridretrieval.domain.dto.ContextResponse;
import com.example.hybridretrieval.domain.dto.HitResponse;
import com.example.hybridretrieval.domain.dto.RetrievalRequest;
import com.example.hybridretrieval.domain.dto.RetrievalResponse;
import com.example.hybridretrieval.domain.model.RetrievalResult;
import com.example.hybridretrieval.domain.model.SearchMode;
import com.example.hybridretrieval.infrastructure.ingest.IngestService;
import com.example.hybridretrieval.infrastructure.search.ElasticsearchService;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Facade used by the REST layer: retrieval, prompt assembly, ingestion and index administration.
 */
@Service
public class RagApplicationService {

    private static final Logger log = LoggerFactory.getLogger(RagApplicationService.class);

    private final HybridRetriever retriever;
    private final ContextFormatter contextFormatter;
    private final IngestService ingestService;
    private final ElasticsearchService elasticsearchService;

    private final int defaultTopK;

    public RagApplicationService(
            HybridRetriever retriever,
            ContextFormatter contextFormatter,
            IngestService ingestService,
            ElasticsearchService elasticsearchService,
            @Value("${hybridretrieval.retrieve.top-k}") int defaultTopK
    ) {
        this.retriever = retriever;
        this.contextFormatter = contextFormatter;
        this.ingestService = ingestService;
        this.elasticsearchService = elasticsearchService;
        this.defaultTopK = Math.max(1, defaultTopK);
    }

    public RetrievalResponse search(RetrievalRequest request) {
        SearchMode mode = modeOf(request);
        int k = topKOf(request);
        RetrievalResult result = retrieve(request, mode, k);

        return RetrievalResponse.builder()
                .query(request.getQuery())
                .mode(mode.label())
                .k(k)
                .hits(toHits(result))
                .degraded(result.degraded())
                .failedChannels(result.failedChannels().stream()
                        .map(c -> c.name().toLowerCase(Locale.ROOT))
                        .sorted()
                        .collect(Collectors.toList()))
                .formatted(contextFormatter.formatResults(result.hits()))
                .build();
    }

    /**
     * Pipeline: retrieve -> build prompt. Generation itself is left to the caller.
     */
    public ContextResponse context(RetrievalRequest request) {
        long t0 = System.nanoTime();
        SearchMode mode = modeOf(request);
        RetrievalResult result = retrieve(request, mode, topKOf(request));
        String prompt = contextFormatter.buildContext(request.getQuery(), result.hits());

        log.info("event=context_built mode={} retrieved={} prompt_chars={} ms={}",
                mode.label(), result.hits().size(), prompt.length(), (System.nanoTime() - t0) / 1_000_000);

        return ContextResponse.builder()
                .query(request.getQuery())
                .prompt(prompt)
                .degraded(result.degraded())
                .hits(toHits(result))
                .build();
    }

    public IngestService.IngestResult ingestDirectory(String directory) {
        return ingestService.ingestDirectory(directory);
    }

    public IngestService.IngestResult ingestFile(MultipartFile file) {
        return ingestService.ingestUpload(file);
    }

    public long indexCount() {
        return elasticsearchService.count();
    }

    public void prepareIndex(boolean recreate) {
        if (recreate) {
            elasticsearchService.recreateIndex();
        } else {
            elasticsearchService.ensureIndexExists();
        }
    }

    private RetrievalResult retrieve(RetrievalRequest request, SearchMode mode, int k) {
        double alpha = request.getAlpha() == null ? retriever.defaultAlpha() : request.getAlpha();
        return retriever.retrieve(request.getQuery(), mode, k, alpha);
    }

    private static SearchMode modeOf(RetrievalRequest request) {
        return request.getMode() == null ? SearchMode.HYBRID : SearchMode.from(request.getMode());
    }

    private int topKOf(RetrievalRequest request) {
        return request.getK() == null ? defaultTopK : request.getK();
    }

    private static List<HitResponse> toHits(RetrievalResult result) {
        return result.hits().stream().map(HitResponse::from).collect(Collectors.toList());
    }
}
