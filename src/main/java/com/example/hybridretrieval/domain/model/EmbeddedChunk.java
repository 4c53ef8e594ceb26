package com.example.hybridretrieval.domain.model;

/**
 * A chunk paired with its embedding, ready for bulk indexing.
 */
public record EmbeddedChunk(
        Chunk chunk,
        float[] vector
) {
}
