package com.example.hybridretrieval.domain.dto;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Builder
@Getter
public class ContextResponse {
    private String query;
    private String prompt;
    private boolean degraded;
    private List<HitResponse> hits;
}
