package com.example.hybridretrieval.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered hits of one retrieval plus the channels that failed while producing them.
 * An empty hit list with {@link #allChannelsFailed()} means a backend outage, not "no matches".
 */
public record RetrievalResult(
        SearchMode mode,
        List<RankedHit> hits,
        Set<SearchChannel> failedChannels
) {

    public RetrievalResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
        failedChannels = failedChannels == null || failedChannels.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(failedChannels));
    }

    public boolean degraded() {
        return !failedChannels.isEmpty();
    }

    public boolean allChannelsFailed() {
        return failedChannels.containsAll(mode.channels());
    }
}
