package com.example.hybridretrieval.application.service;

import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import com.example.hybridretrieval.domain.model.RankedHit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved hits for display and assembles the prompt handed to a downstream LLM.
 */
@Component
public class ContextFormatter {

    static final int PREVIEW_CHARS = 300;
    static final String NO_RESULTS = "No results found.";

    static final int MIN_CONTEXT_CHARS = 500;

    static final String PROMPT_INSTRUCTION = "Answer the following question based only on the provided context.";

    private final int maxContextChars;

    public ContextFormatter(@Value("${hybridretrieval.context.max-chars}") int maxContextChars) {
        if (maxContextChars < MIN_CONTEXT_CHARS) {
            throw new InvalidConfigurationException(
                    "context max-chars must be >= " + MIN_CONTEXT_CHARS + ", got " + maxContextChars);
        }
        this.maxContextChars = maxContextChars;
    }

    public String formatResults(List<RankedHit> hits) {
        if (hits == null || hits.isEmpty()) {
            return NO_RESULTS;
        }

        List<String> blocks = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            RankedHit hit = hits.get(i);
            blocks.add("[" + (i + 1) + "] Source: " + sourceOf(hit) + " (chunk " + hit.metadata().chunkId() + ")\n"
                    + "    Score: " + String.format(Locale.ROOT, "%.4f", hit.score().value()) + "\n"
                    + "    Text: " + preview(hit.text()) + "\n");
        }
        return String.join("\n", blocks);
    }

    /**
     * Context blocks are added in rank order until the character budget is spent; a block that
     * does not fit is cut, and dropped entirely when less than 200 characters would remain.
     */
    public String buildContext(String query, List<RankedHit> hits) {
        List<String> parts = new ArrayList<>();
        int used = 0;

        if (hits != null) {
            for (int i = 0; i < hits.size(); i++) {
                RankedHit hit = hits.get(i);
                String text = hit.text() == null ? "" : hit.text().trim();
                String block = "Document " + (i + 1) + " (" + sourceOf(hit) + "):\n" + text;

                if (used + block.length() + 2 > maxContextChars) {
                    int remaining = maxContextChars - used - 2;
                    if (remaining > 200) {
                        parts.add(block.substring(0, Math.min(block.length(), remaining)));
                    }
                    break;
                }
                parts.add(block);
                used += block.length() + 2;
            }
        }

        String context = parts.isEmpty() ? NO_RESULTS : String.join("\n\n", parts);
        return PROMPT_INSTRUCTION + "\n\n"
                + "Context:\n" + context + "\n\n"
                + "Question: " + (query == null ? "" : query.trim()) + "\n\n"
                + "Answer:";
    }

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > PREVIEW_CHARS ? text.substring(0, PREVIEW_CHARS) + "..." : text;
    }

    private static String sourceOf(RankedHit hit) {
        String source = hit.metadata().source();
        return source == null || source.isBlank() ? "Unknown" : source;
    }
}
