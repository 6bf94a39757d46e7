package com.fatec.rag_compliance.model;

import java.util.List;

/**
 * Parameters of one retrieval. {@code discipline}, {@code documentType} and
 * {@code contextEntities} only steer query expansion; filtering is done by
 * {@code categoryFilter} alone.
 */
public class RetrievalRequest {
    private final String query;
    private final int topK;
    private final String categoryFilter;
    private final String discipline;
    private final String documentType;
    private final List<String> contextEntities;

    private RetrievalRequest(Builder builder) {
        this.query = builder.query;
        this.topK = builder.topK;
        this.categoryFilter = builder.categoryFilter;
        this.discipline = builder.discipline;
        this.documentType = builder.documentType;
        this.contextEntities = builder.contextEntities == null ? List.of() : List.copyOf(builder.contextEntities);
    }

    public static RetrievalRequest of(String query, int topK, String categoryFilter) {
        return builder().query(query).topK(topK).categoryFilter(categoryFilter).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQuery() {
        return query;
    }

    public int getTopK() {
        return topK;
    }

    public String getCategoryFilter() {
        return categoryFilter;
    }

    public String getDiscipline() {
        return discipline;
    }

    public String getDocumentType() {
        return documentType;
    }

    /** Entities named in the source document, such as treatments or body parts. */
    public List<String> getContextEntities() {
        return contextEntities;
    }

    public static class Builder {
        private String query;
        private int topK = 5;
        private String categoryFilter;
        private String discipline;
        private String documentType;
        private List<String> contextEntities;

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder categoryFilter(String categoryFilter) {
            this.categoryFilter = categoryFilter;
            return this;
        }

        public Builder discipline(String discipline) {
            this.discipline = discipline;
            return this;
        }

        public Builder documentType(String documentType) {
            this.documentType = documentType;
            return this;
        }

        public Builder contextEntities(List<String> contextEntities) {
            this.contextEntities = contextEntities;
            return this;
        }

        public RetrievalRequest build() {
            return new RetrievalRequest(this);
        }
    }
}
