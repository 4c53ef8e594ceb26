package com.example.hybridretrieval.domain.dto;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class RetrievalResponse {
    private String query;
    private String mode;
    private int k;
    private List<HitResponse> hits;
    private boolean degraded;
    private List<String> failedChannels;
    private String formatted;
}
