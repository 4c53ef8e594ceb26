package com.example.hybridretrieval.domain.model;

/**
 * Scale a {@link HitScore} is expressed in. Values of different kinds are not comparable.
 */
public enum ScoreKind {
    COSINE_SIMILARITY,
    BM25,
    RECIPROCAL_RANK
}
