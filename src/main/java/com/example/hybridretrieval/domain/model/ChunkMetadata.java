package com.example.hybridretrieval.domain.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

public record ChunkMetadata(
        String source,
        String title,
        int chunkId,
        int totalChunks,
        Instant createdAt
) {

    public static final String SOURCE = "source";
    public static final String TITLE = "title";
    public static final String CHUNK_ID = "chunk_id";
    public static final String TOTAL_CHUNKS = "total_chunks";
    public static final String CREATED_AT = "created_at";

    public FusionKey fusionKey() {
        return new FusionKey(source, chunkId);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> md = new LinkedHashMap<>();
        md.put(SOURCE, source);
        md.put(TITLE, title);
        md.put(CHUNK_ID, chunkId);
        md.put(TOTAL_CHUNKS, totalChunks);
        md.put(CREATED_AT, createdAt == null ? null : createdAt.toString());
        return md;
    }

    /**
     * Lenient reverse of {@link #toMap()}: missing fields fall back to empty / zero,
     * the way search hits written by older ingests may lack some of them.
     */
    public static ChunkMetadata fromMap(Map<?, ?> md) {
        if (md == null) {
            return new ChunkMetadata("", "", 0, 0, null);
        }
        return new ChunkMetadata(
                asString(md.get(SOURCE)),
                asString(md.get(TITLE)),
                asInt(md.get(CHUNK_ID)),
                asInt(md.get(TOTAL_CHUNKS)),
                asInstant(md.get(CREATED_AT))
        );
    }

    private static String asString(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    private static int asInt(Object v) {
        if (v instanceof Number n) {
            return n.intValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static Instant asInstant(Object v) {
        if (v == null) {
            return null;
        }
        try {
            return Instant.parse(String.valueOf(v));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
