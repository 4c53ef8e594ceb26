package com.example.hybridretrieval.application.service;

import com.example.hybridretrieval.application.port.Embedder;
import com.example.hybridretrieval.application.port.SearchBackend;
import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import com.example.hybridretrieval.domain.exception.RetrievalInterruptedException;
import com.example.hybridretrieval.domain.model.RankedHit;
import com.example.hybridretrieval.domain.model.RetrievalResult;
import com.example.hybridretrieval.domain.model.SearchChannel;
import com.example.hybridretrieval.domain.model.SearchMode;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Query-time entry point: dispatches to vector, keyword or hybrid retrieval.
 * <p>
 * A failing sub-search never aborts retrieval. Its channel contributes no hits and is reported in
 * {@link RetrievalResult#failedChannels()}, so hybrid mode degrades to the surviving channel.
 */
@Service
public class HybridRetriever {

    private static final Logger log = LoggerFactory.getLogger(HybridRetriever.class);

    /** Candidates requested from each channel in hybrid mode, as a multiple of {@code k}. */
    public static final int HYBRID_OVERFETCH_FACTOR = 2;

    /**
     * Largest accepted {@code k}. Hybrid mode asks each channel for {@code 2 * k} hits, which stays well
     * inside the default Elasticsearch result window of 10000.
     */
    public static final int MAX_K = 1000;

    private final Embedder embedder;
    private final SearchBackend searchBackend;
    private final ReciprocalRankFuser fuser;
    private final ExecutorService executor;

    private final double defaultAlpha;
    private final long timeoutMs;

    public HybridRetriever(
            Embedder embedder,
            SearchBackend searchBackend,
            ReciprocalRankFuser fuser,
            @Qualifier("hybridSearchExecutor") ExecutorService executor,
            @Value("${hybridretrieval.retrieve.alpha}") double defaultAlpha,
            @Value("${hybridretrieval.retrieve.timeout-ms}") long timeoutMs
    ) {
        if (Double.isNaN(defaultAlpha) || defaultAlpha < 0.0 || defaultAlpha > 1.0) {
            throw new InvalidConfigurationException("default alpha must be within [0, 1], got " + defaultAlpha);
        }
        this.embedder = embedder;
        this.searchBackend = searchBackend;
        this.fuser = fuser;
        this.executor = executor;
        this.defaultAlpha = defaultAlpha;
        this.timeoutMs = Math.max(1, timeoutMs);
    }

    public double defaultAlpha() {
        return defaultAlpha;
    }

    public RetrievalResult retrieve(String query, String mode, int k) {
        return retrieve(query, SearchMode.from(mode), k, defaultAlpha);
    }

    public RetrievalResult retrieve(String query, SearchMode mode, int k) {
        return retrieve(query, mode, k, defaultAlpha);
    }

    /**
     * @param alpha weight of the vector ranking in hybrid mode; ignored by the other modes
     */
    public RetrievalResult retrieve(String query, SearchMode mode, int k, double alpha) {
        if (mode == null) {
            throw new InvalidConfigurationException("Search mode is required");
        }
        if (query == null || query.isBlank()) {
            throw new InvalidConfigurationException("query must not be blank");
        }
        if (k <= 0 || k > MAX_K) {
            throw new InvalidConfigurationException("k must be within [1, " + MAX_K + "], got " + k);
        }
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new InvalidConfigurationException("alpha must be within [0, 1], got " + alpha);
        }

        long t0 = System.nanoTime();
        RetrievalResult result = switch (mode) {
            case VECTOR -> single(mode, vectorChannel(query, k), k);
            case KEYWORD -> single(mode, keywordChannel(query, k), k);
            case HYBRID -> hybrid(query, k, alpha);
        };
        long ms = (System.nanoTime() - t0) / 1_000_000;

        if (result.allChannelsFailed()) {
            log.error("event=retrieve_all_channels_failed mode={} k={} failed={} ms={}",
                    mode.label(), k, result.failedChannels(), ms);
        } else {
            log.info("event=retrieve_done mode={} k={} returned={} degraded={} ms={}",
                    mode.label(), k, result.hits().size(), result.degraded(), ms);
        }
        return result;
    }

    private RetrievalResult single(SearchMode mode, ChannelResult channel, int k) {
        List<RankedHit> hits = channel.hits().size() > k ? channel.hits().subList(0, k) : channel.hits();
        Set<SearchChannel> failed = channel.failed() ? EnumSet.of(channel.channel()) : Set.of();
        return new RetrievalResult(mode, hits, failed);
    }

    private RetrievalResult hybrid(String query, int k, double alpha) {
        int candidates = k * HYBRID_OVERFETCH_FACTOR;

        // cancel(true) on these futures interrupts the worker thread
        Future<ChannelResult> vecF = executor.submit(() -> vectorChannel(query, candidates));
        Future<ChannelResult> kwF = executor.submit(() -> keywordChannel(query, candidates));

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        ChannelResult vec = await(vecF, SearchChannel.VECTOR, deadline, kwF);
        ChannelResult kw = await(kwF, SearchChannel.KEYWORD, deadline, vecF);

        List<RankedHit> fused = fuser.fuse(vec.hits(), kw.hits(), alpha, k);

        Set<SearchChannel> failed = EnumSet.noneOf(SearchChannel.class);
        if (vec.failed()) {
            failed.add(SearchChannel.VECTOR);
        }
        if (kw.failed()) {
            failed.add(SearchChannel.KEYWORD);
        }

        log.info("event=hybrid_fusion_done k={} candidates={} alpha={} vecN={} kwN={} outN={}",
                k, candidates, alpha, vec.hits().size(), kw.hits().size(), fused.size());
        return new RetrievalResult(SearchMode.HYBRID, fused, failed);
    }

    private ChannelResult await(Future<ChannelResult> future,
                                SearchChannel channel,
                                long deadlineNanos,
                                Future<?> sibling) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("event=retrieve_channel_timeout channel={} timeoutMs={}", channel, timeoutMs);
            return ChannelResult.failed(channel);
        } catch (InterruptedException e) {
            future.cancel(true);
            sibling.cancel(true);
            Thread.currentThread().interrupt();
            throw new RetrievalInterruptedException("Hybrid retrieval interrupted", e);
        } catch (CancellationException e) {
            log.warn("event=retrieve_channel_cancelled channel={}", channel);
            return ChannelResult.failed(channel);
        } catch (ExecutionException e) {
            log.warn("event=retrieve_channel_failed channel={} err={}", channel, String.valueOf(e.getCause()));
            return ChannelResult.failed(channel);
        }
    }

    private ChannelResult vectorChannel(String query, int k) {
        try {
            float[] vector = embedder.embed(query);
            return ChannelResult.ok(SearchChannel.VECTOR, searchBackend.vectorSearch(vector, k));
        } catch (RuntimeException e) {
            log.warn("event=retrieve_channel_failed channel={} err={}", SearchChannel.VECTOR, e.toString());
            return ChannelResult.failed(SearchChannel.VECTOR);
        }
    }

    private ChannelResult keywordChannel(String query, int k) {
        try {
            return ChannelResult.ok(SearchChannel.KEYWORD, searchBackend.keywordSearch(query, k));
        } catch (RuntimeException e) {
            log.warn("event=retrieve_channel_failed channel={} err={}", SearchChannel.KEYWORD, e.toString());
            return ChannelResult.failed(SearchChannel.KEYWORD);
        }
    }

    private record ChannelResult(SearchChannel channel, List<RankedHit> hits, boolean failed) {

        static ChannelResult ok(SearchChannel channel, List<RankedHit> hits) {
            return new ChannelResult(channel, hits == null ? List.of() : hits, false);
        }

        static ChannelResult failed(SearchChannel channel) {
            return new ChannelResult(channel, List.of(), true);
        }
    }
}
