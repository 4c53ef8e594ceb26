package com.example.hybridretrieval.application.port;

import java.util.List;

/**
 * Maps text to a dense vector of a fixed, deployment-wide dimension.
 */
public interface Embedder {

    float[] embed(String text);

    /**
     * Embeds several texts in one call. The result has one vector per input, in input order.
     */
    List<float[]> embedBatch(List<String> texts);

    int dimensions();
}
