package com.fatec.rag_compliance.service.retrieval;

import com.fatec.rag_compliance.model.Rule;

import java.util.List;

/**
 * Corpus and both indexes built together; source index {@code i} addresses the
 * same document in all three. Never modified after construction.
 */
final class RetrieverSnapshot {

    private static final RetrieverSnapshot EMPTY = new RetrieverSnapshot(
            RuleCorpus.empty(), LexicalIndex.build(List.of(), 1.5f, 0.75f), DenseIndex.empty());

    private final RuleCorpus corpus;
    private final LexicalIndex lexicalIndex;
    private final DenseIndex denseIndex;

    RetrieverSnapshot(RuleCorpus corpus, LexicalIndex lexicalIndex, DenseIndex denseIndex) {
        if (lexicalIndex.size() != corpus.size() || denseIndex.size() != corpus.size()) {
            throw new IllegalStateException("Indexes out of step with corpus: corpus=" + corpus.size()
                    + ", lexical=" + lexicalIndex.size() + ", dense=" + denseIndex.size());
        }
        this.corpus = corpus;
        this.lexicalIndex = lexicalIndex;
        this.denseIndex = denseIndex;
    }

    static RetrieverSnapshot empty() {
        return EMPTY;
    }

    RuleCorpus corpus() {
        return corpus;
    }

    LexicalIndex lexicalIndex() {
        return lexicalIndex;
    }

    DenseIndex denseIndex() {
        return denseIndex;
    }

    List<Rule> rules() {
        return corpus.getRules();
    }

    boolean isEmpty() {
        return corpus.isEmpty();
    }

    void close() {
        if (this != EMPTY) {
            lexicalIndex.close();
        }
    }
}
