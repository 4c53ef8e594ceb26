package com.example.hybridretrieval.infrastructure.ingest;

import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Character-window chunking with overlap that prefers to end a window on a sentence or line break.
 */
@Component
public class TextChunker {

    private final int chunkSize;
    private final int overlap;

    public TextChunker(
            @Value("${hybridretrieval.chunk.size}") int chunkSize,
            @Value("${hybridretrieval.chunk.overlap}") int overlap
    ) {
        validate(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    public List<String> chunk(String text) {
        return chunk(text, chunkSize, overlap);
    }

    /**
     * Slides a window of {@code size} characters over the text with step {@code size - overlap}.
     * A window that does not reach the end of the text is cut right after its last {@code '.'} or
     * {@code '\n'} when that break lies past the window's midpoint; otherwise the full window is kept.
     * Chunks are trimmed and blank ones dropped.
     * The loop ends with the window that reaches the end of the text, so no trailing chunk made only
     * of overlap is emitted.
     */
    public List<String> chunk(String text, int size, int overlap) {
        validate(size, overlap);
        String body = text == null ? "" : text;
        int length = body.length();

        if (length <= size) {
            return List.of(body.trim());
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + size, length);

            if (end < length) {
                String window = body.substring(start, end);
                int breakPoint = Math.max(window.lastIndexOf('.'), window.lastIndexOf('\n'));
                if (breakPoint > size * 0.5) {
                    end = start + breakPoint + 1;
                }
            }

            String chunk = body.substring(start, end).trim();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }

            if (end >= length) {
                break;
            }
            // a boundary cut shorter than the overlap must still move forward
            start = Math.max(end - overlap, start + 1);
        }

        return chunks;
    }

    private static void validate(int size, int overlap) {
        if (size <= 0) {
            throw new InvalidConfigurationException("chunk size must be > 0, got " + size);
        }
        if (overlap < 0 || overlap >= size) {
            throw new InvalidConfigurationException(
                    "chunk overlap must be >= 0 and < chunk size (" + size + "), got " + overlap);
        }
    }
}
