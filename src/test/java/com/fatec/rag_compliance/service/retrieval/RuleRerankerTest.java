package com.fatec.rag_compliance.service.retrieval;

import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class RuleRerankerTest {

    private static final List<String> TEXTS = List.of("first rule", "second rule", "third rule");

    private final ScoringModel scoringModel = mock(ScoringModel.class);

    @Test
    void reordersByCrossEncoderScore() {
        when(scoringModel.scoreAll(anyList(), eq("query"))).thenReturn(Response.from(List.of(0.1, 0.9, 0.5)));

        List<Integer> reranked = new RuleReranker(scoringModel, 20).rerank("query", List.of(0, 1, 2), TEXTS);

        assertEquals(List.of(1, 2, 0), reranked);
    }

    @Test
    void onlyThePoolIsRescored() {
        when(scoringModel.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(0.2, 0.8)));

        List<Integer> reranked = new RuleReranker(scoringModel, 2).rerank("query", List.of(2, 0, 1), TEXTS);

        assertEquals(List.of(0, 2, 1), reranked);
    }

    @Test
    void equalScoresKeepFusedOrder() {
        when(scoringModel.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(0.5, 0.5, 0.5)));

        assertEquals(List.of(2, 0, 1), new RuleReranker(scoringModel, 20).rerank("query", List.of(2, 0, 1), TEXTS));
    }

    @Test
    void scoringFailureKeepsFusedOrder() {
        when(scoringModel.scoreAll(anyList(), anyString())).thenThrow(new IllegalStateException("timeout"));

        assertEquals(List.of(0, 1, 2), new RuleReranker(scoringModel, 20).rerank("query", List.of(0, 1, 2), TEXTS));
    }

    @Test
    void wrongScoreCountKeepsFusedOrder() {
        when(scoringModel.scoreAll(anyList(), anyString())).thenReturn(Response.from(List.of(0.7)));

        assertEquals(List.of(0, 1, 2), new RuleReranker(scoringModel, 20).rerank("query", List.of(0, 1, 2), TEXTS));
        verify(scoringModel).scoreAll(anyList(), eq("query"));
    }

    @Test
    void singleCandidateIsNotScored() {
        assertEquals(List.of(1), new RuleReranker(scoringModel, 20).rerank("query", List.of(1), TEXTS));
        verifyNoInteractions(scoringModel);
    }
}
