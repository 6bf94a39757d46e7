package com.fatec.rag_compliance.model;

import java.util.List;

/**
 * Rules used as context for one progress note and the raw model answer.
 */
public class ComplianceAnalysis {
    private final List<Rule> rules;
    private final String modelOutput;

    public ComplianceAnalysis(List<Rule> rules, String modelOutput) {
        this.rules = List.copyOf(rules);
        this.modelOutput = modelOutput;
    }

    public List<Rule> getRules() {
        return rules;
    }

    public String getModelOutput() {
        return modelOutput;
    }
}
