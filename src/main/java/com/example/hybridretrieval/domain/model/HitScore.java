package com.example.hybridretrieval.domain.model;

public record HitScore(ScoreKind kind, double value) {

    public static HitScore cosine(double value) {
        return new HitScore(ScoreKind.COSINE_SIMILARITY, value);
    }

    public static HitScore bm25(double value) {
        return new HitScore(ScoreKind.BM25, value);
    }

    public static HitScore reciprocalRank(double value) {
        return new HitScore(ScoreKind.RECIPROCAL_RANK, value);
    }
}
