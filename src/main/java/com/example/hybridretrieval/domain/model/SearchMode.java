package com.example.hybridretrieval.domain.model;

import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum SearchMode {
    VECTOR(EnumSet.of(SearchChannel.VECTOR)),
    KEYWORD(EnumSet.of(SearchChannel.KEYWORD)),
    HYBRID(EnumSet.of(SearchChannel.VECTOR, SearchChannel.KEYWORD));

    private final Set<SearchChannel> channels;

    SearchMode(Set<SearchChannel> channels) {
        this.channels = channels;
    }

    public Set<SearchChannel> channels() {
        return EnumSet.copyOf(channels);
    }

    /**
     * Parses a mode name case-insensitively. No fallback for unknown names.
     */
    public static SearchMode from(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("Search mode is required (vector, keyword or hybrid)");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (SearchMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Unknown search mode: " + name);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
