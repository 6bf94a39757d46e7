package com.fatec.rag_compliance.service.retrieval;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Second pass over the head of the fused ranking with a cross-encoder
 * {@link ScoringModel}. Candidates beyond the pool keep their fused order.
 */
public class RuleReranker {

    private static final Logger log = LoggerFactory.getLogger(RuleReranker.class);

    private final ScoringModel scoringModel;
    private final int candidatePoolSize;

    public RuleReranker(ScoringModel scoringModel, int candidatePoolSize) {
        this.scoringModel = scoringModel;
        this.candidatePoolSize = Math.max(1, candidatePoolSize);
    }

    /**
     * @param fused source indexes in fused order
     * @param texts corpus texts addressed by source index
     * @return the reordered indexes, or {@code fused} unchanged if scoring fails
     */
    public List<Integer> rerank(String query, List<Integer> fused, List<String> texts) {
        if (fused.size() < 2) {
            return fused;
        }
        int poolSize = Math.min(candidatePoolSize, fused.size());
        List<Integer> pool = fused.subList(0, poolSize);
        List<TextSegment> segments = new ArrayList<>(poolSize);
        for (int index : pool) {
            segments.add(TextSegment.from(texts.get(index)));
        }

        List<Double> scores;
        try {
            Response<List<Double>> response = scoringModel.scoreAll(segments, query);
            scores = response == null ? null : response.content();
        } catch (RuntimeException e) {
            log.warn("Reranker prediction failed, keeping fused order: {}", e.getMessage());
            return fused;
        }
        if (scores == null || scores.size() != poolSize) {
            log.warn("Reranker returned {} scores for {} candidates, keeping fused order",
                    scores == null ? 0 : scores.size(), poolSize);
            return fused;
        }

        List<Integer> order = new ArrayList<>(poolSize);
        for (int i = 0; i < poolSize; i++) {
            order.add(i);
        }
        // stable sort: equal scores keep fused order
        order.sort(Comparator.comparing((Integer i) -> scores.get(i)).reversed());

        List<Integer> reranked = new ArrayList<>(fused.size());
        for (int i : order) {
            reranked.add(pool.get(i));
        }
        reranked.addAll(fused.subList(poolSize, fused.size()));
        return reranked;
    }
}
