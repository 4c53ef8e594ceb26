package com.example.hybridretrieval.infrastructure.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.hybridretrieval.application.port.Embedder;
import com.example.hybridretrieval.application.port.SearchBackend;
import com.example.hybridretrieval.domain.model.BulkIndexResult;
import com.example.hybridretrieval.domain.model.Chunk;
import com.example.hybridretrieval.domain.model.Document;
import com.example.hybridretrieval.domain.model.EmbeddedChunk;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class IngestServiceTest {

    private static final Instant LOADED_AT = Instant.parse("2024-05-01T10:00:00Z");

    private Embedder embedder;
    private SearchBackend backend;
    private IngestService service;

    @BeforeEach
    void setUp() {
        embedder = mock(Embedder.class);
        backend = mock(SearchBackend.class);
        when(embedder.embedBatch(anyList())).thenAnswer(inv -> {
            List<?> texts = inv.getArgument(0);
            List<float[]> vectors = new ArrayList<>();
            for (int i = 0; i < texts.size(); i++) {
                vectors.add(new float[]{i, 1f});
            }
            return vectors;
        });
        service = new IngestService(new DocumentLoader(new PdfExtractor()), new TextChunker(20, 5),
                embedder, backend, 2, "./data");
    }

    private static Document doc(String source, String text) {
        return new Document(text, source, source, LOADED_AT);
    }

    @Test
    void chunksEmbedsAndIndexesInBatches() {
        when(backend.bulkIndex(anyList()))
                .thenReturn(new BulkIndexResult(2, List.of()))
                .thenReturn(new BulkIndexResult(0, List.of("short.txt#0: mapper_parsing_exception")));
        when(backend.count()).thenReturn(5L);

        IngestService.IngestResult result = service.ingest(List.of(
                doc("long.md", "aaaa bbbb cccc dddd eeee ffff gggg"),
                doc("blank.md", "   \n "),
                doc("short.txt", "short text")));

        assertThat(result.documents()).isEqualTo(2);
        assertThat(result.chunks()).isEqualTo(3);
        assertThat(result.indexed()).isEqualTo(2);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.errors()).containsExactly("short.txt#0: mapper_parsing_exception");
        assertThat(result.totalInIndex()).isEqualTo(5L);
        verify(embedder, times(2)).embedBatch(anyList());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<EmbeddedChunk>> captor = ArgumentCaptor.forClass(List.class);
        verify(backend, times(2)).bulkIndex(captor.capture());
        List<EmbeddedChunk> first = captor.getAllValues().get(0);
        assertThat(first).hasSize(2);
        assertThat(first.get(0).chunk().text()).isEqualTo("aaaa bbbb cccc dddd");
        assertThat(first.get(1).chunk().text()).isEqualTo("dddd eeee ffff gggg");
        assertThat(first.get(1).chunk().metadata().chunkId()).isEqualTo(1);
        assertThat(first.get(1).chunk().metadata().totalChunks()).isEqualTo(2);
        assertThat(captor.getAllValues().get(1)).hasSize(1);
    }

    @Test
    void nothingIsWrittenForBlankDocuments() {
        IngestService.IngestResult result = service.ingest(List.of(doc("blank.md", "  ")));

        assertThat(result.chunks()).isZero();
        assertThat(result.totalInIndex()).isNull();
        verify(embedder, never()).embedBatch(anyList());
        verify(backend, never()).bulkIndex(any());
    }

    @Test
    void chunkMetadataCarriesDocumentFields() {
        List<Chunk> chunks = service.toChunks(doc("notes/a.md", "one two three four five six seven"));

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(c -> {
            assertThat(c.metadata().source()).isEqualTo("notes/a.md");
            assertThat(c.metadata().totalChunks()).isEqualTo(chunks.size());
            assertThat(c.metadata().createdAt()).isEqualTo(LOADED_AT);
        });
        for (int i = 0; i < chunks.size(); i++) {
            assertThat(chunks.get(i).metadata().chunkId()).isEqualTo(i);
        }
    }
}
