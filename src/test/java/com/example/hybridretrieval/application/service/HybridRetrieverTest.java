package com.example.hybridretrieval.application.service;

import static com.example.hybridretrieval.application.service.ReciprocalRankFuserTest.keywordHit;
import static com.example.hybridretrieval.application.service.ReciprocalRankFuserTest.vectorHit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.hybridretrieval.application.port.Embedder;
import com.example.hybridretrieval.application.port.SearchBackend;
import com.example.hybridretrieval.domain.exception.BackendUnavailableException;
import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import com.example.hybridretrieval.domain.exception.RetrievalInterruptedException;
import com.example.hybridretrieval.domain.model.RankedHit;
import com.example.hybridretrieval.domain.model.RetrievalResult;
import com.example.hybridretrieval.domain.model.ScoreKind;
import com.example.hybridretrieval.domain.model.SearchChannel;
import com.example.hybridretrieval.domain.model.SearchMode;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.stubbing.Answer;

class HybridRetrieverTest {

    private static final float[] QUERY_VECTOR = {0.1f, 0.2f, 0.3f};

    private Embedder embedder;
    private SearchBackend backend;
    private HybridRetriever retriever;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        embedder = mock(Embedder.class);
        backend = mock(SearchBackend.class);
        when(embedder.embed(anyString())).thenReturn(QUERY_VECTOR);
        pool = Executors.newFixedThreadPool(2);
        retriever = new HybridRetriever(embedder, backend, new ReciprocalRankFuser(), pool, 0.5, 10_000);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static List<String> sources(RetrievalResult result) {
        return result.hits().stream().map(h -> h.metadata().source()).toList();
    }

    @Test
    void hybridFusesOverfetchedRankings() {
        when(backend.vectorSearch(QUERY_VECTOR, 4))
                .thenReturn(List.of(vectorHit("A", 0.9), vectorHit("B", 0.8), vectorHit("C", 0.7)));
        when(backend.keywordSearch("q", 4))
                .thenReturn(List.of(keywordHit("C", 5.0), keywordHit("A", 3.0), keywordHit("D", 1.0)));

        RetrievalResult result = retriever.retrieve("q", "hybrid", 2);

        assertThat(sources(result)).containsExactly("A", "C");
        assertThat(result.degraded()).isFalse();
        assertThat(result.hits()).allSatisfy(h -> assertThat(h.score().kind()).isEqualTo(ScoreKind.RECIPROCAL_RANK));
        verify(backend).vectorSearch(QUERY_VECTOR, 2 * HybridRetriever.HYBRID_OVERFETCH_FACTOR);
        verify(backend).keywordSearch("q", 2 * HybridRetriever.HYBRID_OVERFETCH_FACTOR);
    }

    @Test
    void vectorModeReturnsBackendOrderAndScores() {
        List<RankedHit> hits = List.of(vectorHit("A", 0.9), vectorHit("B", 0.8));
        when(backend.vectorSearch(QUERY_VECTOR, 2)).thenReturn(hits);

        RetrievalResult result = retriever.retrieve("q", "VECTOR", 2);

        assertThat(result.hits()).containsExactlyElementsOf(hits);
        verify(backend, never()).keywordSearch(anyString(), anyInt());
    }

    @Test
    void keywordModeSkipsEmbedding() {
        when(backend.keywordSearch("q", 3)).thenReturn(List.of(keywordHit("K", 4.2)));

        RetrievalResult result = retriever.retrieve("q", SearchMode.KEYWORD, 3);

        assertThat(result.hits()).hasSize(1);
        assertThat(result.hits().get(0).score().value()).isEqualTo(4.2);
        verify(embedder, never()).embed(anyString());
    }

    @Test
    void singleChannelResultIsCappedAtK() {
        when(backend.keywordSearch("q", 1)).thenReturn(List.of(keywordHit("K1", 2.0), keywordHit("K2", 1.0)));

        assertThat(retriever.retrieve("q", SearchMode.KEYWORD, 1).hits()).hasSize(1);
    }

    @Test
    void unknownModeIsRejected() {
        assertThatThrownBy(() -> retriever.retrieve("q", "fuzzy", 5))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void nonPositiveKIsRejected() {
        assertThatThrownBy(() -> retriever.retrieve("q", SearchMode.HYBRID, 0))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void hybridDegradesToKeywordWhenVectorChannelFails() {
        when(backend.vectorSearch(any(), anyInt())).thenThrow(new BackendUnavailableException("down"));
        when(backend.keywordSearch("q", 4)).thenReturn(List.of(keywordHit("K1", 3.0), keywordHit("K2", 2.0)));

        RetrievalResult result = retriever.retrieve("q", SearchMode.HYBRID, 2);

        assertThat(sources(result)).containsExactly("K1", "K2");
        assertThat(result.failedChannels()).containsExactly(SearchChannel.VECTOR);
        assertThat(result.degraded()).isTrue();
        assertThat(result.allChannelsFailed()).isFalse();
    }

    @Test
    void embedderFailureCountsAsVectorChannelFailure() {
        when(embedder.embed(anyString())).thenThrow(new BackendUnavailableException("embedding service down"));
        when(backend.keywordSearch("q", 4)).thenReturn(List.of(keywordHit("K1", 3.0)));

        RetrievalResult result = retriever.retrieve("q", SearchMode.HYBRID, 2);

        assertThat(sources(result)).containsExactly("K1");
        assertThat(result.failedChannels()).containsExactly(SearchChannel.VECTOR);
    }

    @Test
    void bothChannelsFailingGivesEmptyResultFlaggedAsOutage() {
        when(backend.vectorSearch(any(), anyInt())).thenThrow(new BackendUnavailableException("down"));
        when(backend.keywordSearch(anyString(), anyInt())).thenThrow(new BackendUnavailableException("down"));

        RetrievalResult result = retriever.retrieve("q", SearchMode.HYBRID, 5);

        assertThat(result.hits()).isEmpty();
        assertThat(result.allChannelsFailed()).isTrue();
    }

    @Test
    void singleModeFailureIsReportedNotThrown() {
        when(backend.vectorSearch(any(), anyInt())).thenThrow(new BackendUnavailableException("down"));

        RetrievalResult result = retriever.retrieve("q", SearchMode.VECTOR, 5);

        assertThat(result.hits()).isEmpty();
        assertThat(result.allChannelsFailed()).isTrue();
    }

    @Test
    void slowChannelTimesOutAndOtherChannelStillCounts() {
        retriever = new HybridRetriever(embedder, backend, new ReciprocalRankFuser(), pool, 0.5, 200);
        when(backend.vectorSearch(QUERY_VECTOR, 4)).thenReturn(List.of(vectorHit("V1", 0.9)));
        when(backend.keywordSearch("q", 4)).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return List.of(keywordHit("late", 1.0));
        });

        RetrievalResult result = retriever.retrieve("q", SearchMode.HYBRID, 2);

        assertThat(sources(result)).containsExactly("V1");
        assertThat(result.failedChannels()).containsExactly(SearchChannel.KEYWORD);
    }

    @Test
    void timedOutChannelWorkerIsInterrupted() throws InterruptedException {
        retriever = new HybridRetriever(embedder, backend, new ReciprocalRankFuser(), pool, 0.5, 200);
        CountDownLatch keywordInterrupted = new CountDownLatch(1);
        when(backend.vectorSearch(QUERY_VECTOR, 4)).thenReturn(List.of(vectorHit("V1", 0.9)));
        when(backend.keywordSearch("q", 4)).thenAnswer(inv -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                keywordInterrupted.countDown();
                throw e;
            }
            return List.of(keywordHit("late", 1.0));
        });

        RetrievalResult result = retriever.retrieve("q", SearchMode.HYBRID, 2);

        assertThat(result.failedChannels()).containsExactly(SearchChannel.KEYWORD);
        assertThat(keywordInterrupted.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void interruptedCallerCancelsBothChannels() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(2);
        CountDownLatch workersInterrupted = new CountDownLatch(2);
        Answer<List<RankedHit>> blocking = inv -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                workersInterrupted.countDown();
                throw e;
            }
            return List.of();
        };
        when(backend.vectorSearch(any(), anyInt())).thenAnswer(blocking);
        when(backend.keywordSearch(anyString(), anyInt())).thenAnswer(blocking);

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlagRestored = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            try {
                retriever.retrieve("q", SearchMode.HYBRID, 2);
            } catch (RuntimeException e) {
                thrown.set(e);
                interruptFlagRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(5_000);

        assertThat(caller.isAlive()).isFalse();
        assertThat(thrown.get()).isInstanceOf(RetrievalInterruptedException.class);
        assertThat(interruptFlagRestored.get()).isTrue();
        assertThat(workersInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void oversizedKIsRejectedBeforeSearching() {
        assertThatThrownBy(() -> retriever.retrieve("q", SearchMode.HYBRID, Integer.MAX_VALUE))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> retriever.retrieve("q", SearchMode.KEYWORD, HybridRetriever.MAX_K + 1))
                .isInstanceOf(InvalidConfigurationException.class);
        verifyNoInteractions(backend);
    }

    @Test
    void largestAllowedKIsOverfetchedWithoutOverflow() {
        when(backend.keywordSearch(anyString(), anyInt())).thenReturn(List.of());
        when(backend.vectorSearch(any(), anyInt())).thenReturn(List.of());

        retriever.retrieve("q", SearchMode.HYBRID, HybridRetriever.MAX_K);

        verify(backend).keywordSearch("q", HybridRetriever.MAX_K * HybridRetriever.HYBRID_OVERFETCH_FACTOR);
    }

    @Test
    void defaultAlphaMustBeInUnitInterval() {
        assertThatThrownBy(() -> new HybridRetriever(embedder, backend, new ReciprocalRankFuser(), pool, 2.0, 1000))
                .isInstanceOf(InvalidConfigurationException.class);
    }
}
