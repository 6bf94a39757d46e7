package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.exception.EmbeddingModelUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;

/**
 * One embedding per corpus document, in corpus order, queried by cosine similarity.
 */
public class DenseIndex {

    private static final DenseIndex EMPTY = new DenseIndex(new float[0][], new double[0], 0);

    private final float[][] vectors;
    private final double[] norms;
    private final int dimension;

    private DenseIndex(float[][] vectors, double[] norms, int dimension) {
        this.vectors = vectors;
        this.norms = norms;
        this.dimension = dimension;
    }

    public static DenseIndex empty() {
        return EMPTY;
    }

    /**
     * Embeds every text through {@code embeddingModel}, {@code batchSize} texts per call.
     *
     * @throws EmbeddingModelUnavailableException if the model fails, returns fewer
     *         vectors than texts, or returns vectors of differing dimension
     */
    public static DenseIndex build(List<String> texts, EmbeddingModel embeddingModel, int batchSize) {
        if (texts.isEmpty()) {
            return EMPTY;
        }
        int step = Math.max(1, batchSize);
        float[][] vectors = new float[texts.size()][];
        for (int from = 0; from < texts.size(); from += step) {
            int to = Math.min(texts.size(), from + step);
            List<TextSegment> batch = new ArrayList<>(to - from);
            for (String text : texts.subList(from, to)) {
                batch.add(TextSegment.from(text));
            }
            List<Embedding> embeddings = embedBatch(embeddingModel, batch);
            for (int i = 0; i < embeddings.size(); i++) {
                vectors[from + i] = vectorOf(embeddings.get(i));
            }
        }

        int dimension = vectors[0].length;
        double[] norms = new double[vectors.length];
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i].length != dimension) {
                throw new EmbeddingModelUnavailableException("Embedding dimension mismatch at document " + i
                        + ": expected " + dimension + " but was " + vectors[i].length);
            }
            norms[i] = norm(vectors[i]);
        }
        return new DenseIndex(vectors, norms, dimension);
    }

    public static float[] embedQuery(String query, EmbeddingModel embeddingModel) {
        try {
            Response<Embedding> response = embeddingModel.embed(query);
            if (response == null) {
                throw new EmbeddingModelUnavailableException("Embedding model returned no response for query");
            }
            return vectorOf(response.content());
        } catch (EmbeddingModelUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingModelUnavailableException("Failed to embed query", e);
        }
    }

    private static List<Embedding> embedBatch(EmbeddingModel embeddingModel, List<TextSegment> batch) {
        Response<List<Embedding>> response;
        try {
            response = embeddingModel.embedAll(batch);
        } catch (RuntimeException e) {
            throw new EmbeddingModelUnavailableException("Failed to embed corpus batch", e);
        }
        if (response == null || response.content() == null || response.content().size() != batch.size()) {
            throw new EmbeddingModelUnavailableException("Embedding model returned "
                    + (response == null || response.content() == null ? 0 : response.content().size())
                    + " vectors for " + batch.size() + " documents");
        }
        return response.content();
    }

    private static float[] vectorOf(Embedding embedding) {
        if (embedding == null || embedding.vector() == null) {
            throw new EmbeddingModelUnavailableException("Embedding model returned an empty vector");
        }
        return embedding.vector();
    }

    public int size() {
        return vectors.length;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Cosine similarity of {@code query} with each candidate, aligned with
     * {@code candidates}. A zero vector on either side scores 0.0.
     */
    public double[] score(float[] query, int[] candidates) {
        double[] scores = new double[candidates.length];
        if (candidates.length == 0) {
            return scores;
        }
        if (query.length != dimension) {
            throw new EmbeddingModelUnavailableException("Query embedding has dimension " + query.length
                    + " but the index holds " + dimension);
        }
        double queryNorm = norm(query);
        if (queryNorm == 0.0) {
            return scores;
        }
        for (int i = 0; i < candidates.length; i++) {
            int doc = candidates[i];
            if (norms[doc] == 0.0) {
                continue;
            }
            float[] vector = vectors[doc];
            double dot = 0.0;
            for (int d = 0; d < dimension; d++) {
                dot += (double) query[d] * vector[d];
            }
            scores[i] = dot / (queryNorm * norms[doc]);
        }
        return scores;
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }
}
