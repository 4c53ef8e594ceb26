package com.example.hybridretrieval.infrastructure.embedding;

import com.example.hybridretrieval.application.port.Embedder;
import com.example.hybridretrieval.domain.exception.BackendUnavailableException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * {@link Embedder} backed by the Spring AI {@link EmbeddingModel} (Ollama by default).
 * Transport failures are retried with exponential backoff and then surface as
 * {@link BackendUnavailableException}.
 */
@Service
public class SpringAiEmbedder implements Embedder {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbedder.class);

    private final EmbeddingModel embeddingModel;
    private final int dimensions;

    public SpringAiEmbedder(
            EmbeddingModel embeddingModel,
            @Value("${hybridretrieval.vector.dimensions}") int dimensions
    ) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("vector dimensions must be > 0");
        }
        this.embeddingModel = embeddingModel;
        this.dimensions = dimensions;
        log.info("event=embedder_config model={} dimensions={}", embeddingModel.getClass().getSimpleName(), dimensions);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    @Retryable(
            retryFor = {BackendUnavailableException.class},
            maxAttemptsExpression = "#{${hybridretrieval.embedding.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public float[] embed(String text) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text == null ? "" : text);
        } catch (RuntimeException e) {
            log.warn("event=embed_failed chars={} err={}", text == null ? 0 : text.length(), e.toString());
            throw new BackendUnavailableException("Embedding request failed", e);
        }
        return checkDimensions(vector);
    }

    @Override
    @Retryable(
            retryFor = {BackendUnavailableException.class},
            maxAttemptsExpression = "#{${hybridretrieval.embedding.retries:2} + 1}",
            backoff = @Backoff(delay = 200, multiplier = 2.0)
    )
    public List<float[]> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        long t0 = System.nanoTime();
        List<float[]> vectors;
        try {
            vectors = embeddingModel.embed(texts);
        } catch (RuntimeException e) {
            log.warn("event=embed_batch_failed size={} err={}", texts.size(), e.toString());
            throw new BackendUnavailableException("Batch embedding request failed", e);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new IllegalStateException("Embedding model returned "
                    + (vectors == null ? 0 : vectors.size()) + " vectors for " + texts.size() + " texts");
        }
        vectors.forEach(this::checkDimensions);

        log.info("event=embed_batch_ok size={} ms={}", texts.size(), (System.nanoTime() - t0) / 1_000_000);
        return vectors;
    }

    private float[] checkDimensions(float[] vector) {
        if (vector == null || vector.length != dimensions) {
            throw new IllegalStateException("Expected embedding of dimension " + dimensions
                    + " but got " + (vector == null ? "null" : vector.length));
        }
        return vector;
    }
}
