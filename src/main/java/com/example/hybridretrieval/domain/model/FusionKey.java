package com.example.hybridretrieval.domain.model;

import java.util.Comparator;

/**
 * Identity of a chunk across independently ranked result lists.
 * Ordering is used only to break score ties deterministically.
 */
public record FusionKey(String source, int chunkId) implements Comparable<FusionKey> {

    private static final Comparator<FusionKey> ORDER = Comparator
            .comparing(FusionKey::source, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(FusionKey::chunkId);

    public String value() {
        return (source == null ? "" : source) + chunkId;
    }

    @Override
    public int compareTo(FusionKey other) {
        return ORDER.compare(this, other);
    }
}
