package com.example.hybridretrieval.domain.model;

public record Chunk(
        String text,
        ChunkMetadata metadata
) {

    public FusionKey fusionKey() {
        return metadata.fusionKey();
    }
}
