package com.example.hybridretrieval.application.service;

import com.example.hybridretrieval.domain.exception.InvalidConfigurationException;
import com.example.hybridretrieval.domain.model.FusionKey;
import com.example.hybridretrieval.domain.model.HitScore;
import com.example.hybridretrieval.domain.model.RankedHit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Weighted Reciprocal Rank Fusion of a vector ranking and a keyword ranking.
 * <p>
 * Only the zero-based rank position {@code r} of a hit in its own list matters: the vector list
 * contributes {@code alpha / (r + 60)}, the keyword list {@code (1 - alpha) / (r + 60)}. Hits sharing a
 * {@link FusionKey} are merged and their contributions summed. Raw backend scores are never read, since
 * cosine and BM25 values live on different scales.
 */
@Component
public class ReciprocalRankFuser {

    /** Damping offset added to every rank position. Fixed so fusion stays deterministic. */
    public static final int RRF_RANK_OFFSET = 60;

    public List<RankedHit> fuse(List<RankedHit> vectorRanked, List<RankedHit> keywordRanked, double alpha, int k) {
        if (Double.isNaN(alpha) || alpha < 0.0 || alpha > 1.0) {
            throw new InvalidConfigurationException("alpha must be within [0, 1], got " + alpha);
        }
        if (k <= 0) {
            throw new InvalidConfigurationException("k must be > 0, got " + k);
        }

        Map<FusionKey, Candidate> merged = new LinkedHashMap<>();
        accumulate(merged, vectorRanked, alpha);
        accumulate(merged, keywordRanked, 1.0 - alpha);

        List<Candidate> ranked = new ArrayList<>(merged.values());
        ranked.sort(Comparator.comparingDouble(Candidate::score).reversed()
                .thenComparing(c -> c.hit().fusionKey()));

        List<RankedHit> out = new ArrayList<>(Math.min(k, ranked.size()));
        for (Candidate c : ranked) {
            if (out.size() >= k) {
                break;
            }
            out.add(c.hit().withScore(HitScore.reciprocalRank(c.score())));
        }
        return out;
    }

    public static double contribution(int rank, double weight) {
        return weight * (1.0 / (rank + RRF_RANK_OFFSET));
    }

    private static void accumulate(Map<FusionKey, Candidate> merged, List<RankedHit> ranked, double weight) {
        if (ranked == null) {
            return;
        }
        Set<FusionKey> seen = new HashSet<>();
        for (int rank = 0; rank < ranked.size(); rank++) {
            RankedHit hit = ranked.get(rank);
            // a repeated key within one list only counts at its best rank
            if (!seen.add(hit.fusionKey())) {
                continue;
            }
            double add = contribution(rank, weight);
            // first occurrence keeps its text and metadata
            merged.merge(hit.fusionKey(), new Candidate(hit, add),
                    (existing, ignored) -> new Candidate(existing.hit(), existing.score() + add));
        }
    }

    private record Candidate(RankedHit hit, double score) {
    }
}
