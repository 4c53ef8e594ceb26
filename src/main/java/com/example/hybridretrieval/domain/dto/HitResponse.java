package com.example.hybridretrieval.domain.dto;

import com.example.hybridretrieval.domain.model.RankedHit;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class HitResponse {
    private String text;
    private String source;
    private String title;
    private int chunkId;
    private int totalChunks;
    private double score;
    private String scoreKind;

    public static HitResponse from(RankedHit hit) {
        return HitResponse.builder()
                .text(hit.text())
                .source(hit.metadata().source())
                .title(hit.metadata().title())
                .chunkId(hit.metadata().chunkId())
                .totalChunks(hit.metadata().totalChunks())
                .score(hit.score().value())
                .scoreKind(hit.score().kind().name())
                .build();
    }
}
