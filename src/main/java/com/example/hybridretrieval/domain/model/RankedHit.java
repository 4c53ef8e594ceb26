package com.example.hybridretrieval.domain.model;

public record RankedHit(
        String text,
        ChunkMetadata metadata,
        HitScore score
) {

    public FusionKey fusionKey() {
        return metadata.fusionKey();
    }

    public RankedHit withScore(HitScore newScore) {
        return new RankedHit(text, metadata, newScore);
    }
}
