package com.example.hybridretrieval.infrastructure.ingest;

import com.example.hybridretrieval.application.port.Embedder;
import com.example.hybridretrieval.application.port.SearchBackend;
import com.example.hybridretrieval.domain.model.BulkIndexResult;
import com.example.hybridretrieval.domain.model.Chunk;
import com.example.hybridretrieval.domain.model.ChunkMetadata;
import com.example.hybridretrieval.domain.model.Document;
import com.example.hybridretrieval.domain.model.EmbeddedChunk;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

@Service
public class IngestService {

    private static final Logger log = LoggerFactory.getLogger(IngestService.class);

    private final DocumentLoader documentLoader;
    private final TextChunker chunker;
    private final Embedder embedder;
    private final SearchBackend searchBackend;

    private final int embedBatchSize;
    private final String dataDir;

    public IngestService(
            DocumentLoader documentLoader,
            TextChunker chunker,
            Embedder embedder,
            SearchBackend searchBackend,
            @Value("${hybridretrieval.ingest.embed-batch-size}") int embedBatchSize,
            @Value("${hybridretrieval.ingest.data-dir}") String dataDir
    ) {
        this.documentLoader = documentLoader;
        this.chunker = chunker;
        this.embedder = embedder;
        this.searchBackend = searchBackend;
        this.embedBatchSize = Math.max(1, embedBatchSize);
        this.dataDir = dataDir;
    }

    /**
     * @param totalInIndex documents in the index after ingest; {@code null} when nothing was written
     */
    public record IngestResult(int documents, int chunks, int indexed, List<String> errors, Long totalInIndex) {

        public int failed() {
            return errors.size();
        }
    }

    public IngestResult ingestDirectory(String directory) {
        String dir = directory == null || directory.isBlank() ? dataDir : directory.trim();
        return ingest(documentLoader.loadDirectory(Path.of(dir)));
    }

    public IngestResult ingestUpload(MultipartFile file) {
        return ingest(List.of(documentLoader.loadUpload(file)));
    }

    /**
     * Offline ingest pipeline:
     * documents -> boundary-aware chunking -> batched embeddings -> Elasticsearch bulk (vector + BM25).
     * Per-chunk index failures are collected in the result and never abort the remaining batches.
     */
    public IngestResult ingest(List<Document> documents) {
        long t0 = System.nanoTime();

        List<Chunk> chunks = new ArrayList<>();
        int usable = 0;
        for (Document doc : documents) {
            List<Chunk> docChunks = toChunks(doc);
            if (docChunks.isEmpty()) {
                log.warn("event=ingest_document_skipped source={} reason=blank", doc.source());
                continue;
            }
            usable++;
            chunks.addAll(docChunks);
        }

        if (chunks.isEmpty()) {
            log.warn("event=ingest_no_content documents={}", documents.size());
            return new IngestResult(usable, 0, 0, List.of(), null);
        }
        log.info("event=ingest_chunked documents={} chunks={} size={} overlap={}",
                usable, chunks.size(), chunker.chunkSize(), chunker.overlap());

        int indexed = 0;
        List<String> errors = new ArrayList<>();
        for (int from = 0; from < chunks.size(); from += embedBatchSize) {
            List<Chunk> batch = chunks.subList(from, Math.min(chunks.size(), from + embedBatchSize));
            List<EmbeddedChunk> items = embed(batch);
            BulkIndexResult result = searchBackend.bulkIndex(items);
            indexed += result.successCount();
            errors.addAll(result.errors());
        }

        long total = searchBackend.count();
        long ms = (System.nanoTime() - t0) / 1_000_000;
        if (errors.isEmpty()) {
            log.info("event=ingest_complete documents={} chunks={} indexed={} totalInIndex={} ms={}",
                    usable, chunks.size(), indexed, total, ms);
        } else {
            log.warn("event=ingest_complete_with_errors documents={} chunks={} indexed={} failed={} first_error={} ms={}",
                    usable, chunks.size(), indexed, errors.size(), errors.get(0), ms);
        }
        return new IngestResult(usable, chunks.size(), indexed, List.copyOf(errors), total);
    }

    List<Chunk> toChunks(Document doc) {
        if (doc.text() == null || doc.text().isBlank()) {
            return List.of();
        }
        List<String> pieces = chunker.chunk(doc.text());
        List<Chunk> out = new ArrayList<>(pieces.size());
        for (int i = 0; i < pieces.size(); i++) {
            ChunkMetadata md = new ChunkMetadata(doc.source(), doc.title(), i, pieces.size(), doc.createdAt());
            out.add(new Chunk(pieces.get(i), md));
        }
        return out;
    }

    private List<EmbeddedChunk> embed(List<Chunk> batch) {
        List<String> texts = new ArrayList<>(batch.size());
        for (Chunk c : batch) {
            texts.add(c.text());
        }
        List<float[]> vectors = embedder.embedBatch(texts);
        List<EmbeddedChunk> items = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            items.add(new EmbeddedChunk(batch.get(i), vectors.get(i)));
        }
        return items;
    }
}
