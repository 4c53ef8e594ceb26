package com.example.hybridretrieval.domain.model;

import java.time.Instant;

/**
 * Raw document body as loaded from disk or an upload. Discarded once chunked.
 */
public record Document(
        String text,
        String source,
        String title,
        Instant createdAt
) {
}
