package com.fatec.rag_compliance.service.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal Rank Fusion (RRF) of the lexical and dense rankings.
 * <p>
 * RRF only looks at ranks, so BM25 scores and cosine similarities never need to
 * be normalized to a common scale. Each candidate gets
 * {@code sum(weight / (k + rank))} over the signals that ranked it. Equal fused
 * scores are ordered by source index, ascending.
 */
public class FusionRanker {

    private final double k;
    private final Map<RetrievalSignal, Double> weights;

    public FusionRanker(double k) {
        this(k, Map.of());
    }

    /**
     * @param weights per-signal weight; signals missing from the map weigh 1.0
     */
    public FusionRanker(double k, Map<RetrievalSignal, Double> weights) {
        if (k <= 0) {
            throw new IllegalArgumentException("RRF k must be positive, was " + k);
        }
        this.k = k;
        this.weights = new EnumMap<>(RetrievalSignal.class);
        this.weights.putAll(weights);
    }

    public double getK() {
        return k;
    }

    /**
     * Ranks candidates by score descending, best = 1. Equal scores share the
     * best rank of their group (1, 2, 2, 4), so a signal that scores every
     * candidate alike adds the same amount to each and leaves the fused order
     * to the other signal.
     *
     * @param scores aligned with {@code candidates}
     * @return source index to rank, iterated best first (equal scores by source index)
     */
    public static Map<Integer, Integer> rank(int[] candidates, double[] scores) {
        if (candidates.length != scores.length) {
            throw new IllegalArgumentException("Got " + scores.length + " scores for "
                    + candidates.length + " candidates");
        }
        Map<Integer, Double> byIndex = new HashMap<>();
        List<Integer> order = new ArrayList<>(candidates.length);
        for (int i = 0; i < candidates.length; i++) {
            byIndex.put(candidates[i], scores[i]);
            order.add(candidates[i]);
        }
        order.sort(descendingThenByIndex(byIndex));

        Map<Integer, Integer> ranks = new LinkedHashMap<>();
        int rank = 0;
        double previous = Double.NaN;
        for (int position = 0; position < order.size(); position++) {
            double score = byIndex.get(order.get(position));
            if (position == 0 || Double.compare(score, previous) != 0) {
                rank = position + 1;
                previous = score;
            }
            ranks.put(order.get(position), rank);
        }
        return ranks;
    }

    /**
     * Fuses per-signal ranks into one ordering of every candidate ranked by at
     * least one signal, best first.
     */
    public List<Integer> fuse(Map<RetrievalSignal, Map<Integer, Integer>> rankings) {
        Map<Integer, Double> fused = new HashMap<>();
        for (Map.Entry<RetrievalSignal, Map<Integer, Integer>> signal : rankings.entrySet()) {
            double weight = weights.getOrDefault(signal.getKey(), 1.0);
            for (Map.Entry<Integer, Integer> ranked : signal.getValue().entrySet()) {
                fused.merge(ranked.getKey(), weight / (k + ranked.getValue()), Double::sum);
            }
        }
        List<Integer> result = new ArrayList<>(fused.keySet());
        result.sort(descendingThenByIndex(fused));
        return result;
    }

    private static Comparator<Integer> descendingThenByIndex(Map<Integer, Double> scores) {
        return (a, b) -> {
            int byScore = Double.compare(scores.get(b), scores.get(a));
            return byScore != 0 ? byScore : Integer.compare(a, b);
        };
    }
}
