package com.example.hybridretrieval.application.port;

import com.example.hybridretrieval.domain.model.BulkIndexResult;
import com.example.hybridretrieval.domain.model.EmbeddedChunk;
import com.example.hybridretrieval.domain.model.RankedHit;
import java.util.List;

/**
 * Index holding chunk text, embedding and metadata, searchable both by vector and by keyword.
 * Result lists are ordered best first.
 */
public interface SearchBackend {

    List<RankedHit> vectorSearch(float[] vector, int k);

    List<RankedHit> keywordSearch(String text, int k);

    /**
     * Best-effort bulk write: individual item failures are reported, never thrown.
     */
    BulkIndexResult bulkIndex(List<EmbeddedChunk> items);

    long count();
}
