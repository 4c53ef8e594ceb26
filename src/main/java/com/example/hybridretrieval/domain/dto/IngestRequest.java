package com.example.hybridretrieval.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class IngestRequest {

    // Falls back to hybridretrieval.ingest.data-dir when absent
    private String directory;
}
