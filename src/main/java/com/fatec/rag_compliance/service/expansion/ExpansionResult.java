package com.fatec.rag_compliance.service.expansion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public class ExpansionResult {
    private final String originalQuery;
    private final List<String> expandedTerms;
    private final Map<String, List<String>> sources;
    private final Map<String, Double> confidence;

    public ExpansionResult(String originalQuery, List<String> expandedTerms,
            Map<String, List<String>> sources, Map<String, Double> confidence) {
        this.originalQuery = originalQuery;
        this.expandedTerms = List.copyOf(expandedTerms);
        this.sources = Map.copyOf(sources);
        this.confidence = Map.copyOf(confidence);
    }

    public static ExpansionResult unchanged(String query) {
        return new ExpansionResult(query, List.of(), Map.of(), Map.of());
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<String> getExpandedTerms() {
        return expandedTerms;
    }

    /** Expansion strategy name to the terms it contributed. */
    public Map<String, List<String>> getSources() {
        return sources;
    }

    public int getTotalTerms() {
        return expandedTerms.size() + 1;
    }

    /**
     * The original query followed by expansion terms. With a limit, the original
     * query counts as one term and the most confident expansions fill the rest.
     */
    public String toQuery(int maxTerms) {
        List<String> terms = new ArrayList<>(expandedTerms);
        if (maxTerms > 0 && terms.size() + 1 > maxTerms) {
            terms.sort(Comparator.comparing((String t) -> confidence.getOrDefault(t, 0.0)).reversed());
            terms = terms.subList(0, Math.max(0, maxTerms - 1));
        }
        if (terms.isEmpty()) {
            return originalQuery;
        }
        return originalQuery + " " + String.join(" ", terms);
    }
}
