package com.example.hybridretrieval.domain.model;

import java.util.List;

public record BulkIndexResult(
        int successCount,
        List<String> errors
) {

    public BulkIndexResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
