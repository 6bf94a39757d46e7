package com.fatec.rag_compliance.service.analysis;

import com.fatec.rag_compliance.config.RetrievalProperties;
import com.fatec.rag_compliance.exception.InvalidQueryException;
import com.fatec.rag_compliance.model.ComplianceAnalysis;
import com.fatec.rag_compliance.model.RetrievalRequest;
import com.fatec.rag_compliance.model.Rule;
import com.fatec.rag_compliance.service.retrieval.HybridRetriever;
import dev.langchain4j.model.chat.ChatLanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Checks a progress note against the compliance rules most relevant to it:
 * retrieves the rules, then asks the chat model for findings. The model answer
 * is returned as-is.
 */
@Service
public class ComplianceAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(ComplianceAnalysisService.class);

    static final String NO_RULES_MESSAGE = "No applicable compliance rules were found for this document.";

    // Only the head of a long note is used as the retrieval query.
    private static final int MAX_QUERY_CHARS = 2000;

    private final HybridRetriever retriever;
    private final ChatLanguageModel chatModel;
    private final ProgressNoteLoader noteLoader;
    private final RetrievalProperties properties;
    private final Executor executor;

    public ComplianceAnalysisService(HybridRetriever retriever,
            ChatLanguageModel chatModel,
            ProgressNoteLoader noteLoader,
            RetrievalProperties properties,
            @Qualifier("analysisExecutor") Executor executor) {
        this.retriever = retriever;
        this.chatModel = chatModel;
        this.noteLoader = noteLoader;
        this.properties = properties;
        this.executor = executor;
    }

    public CompletableFuture<ComplianceAnalysis> analyze(Path notePath, String discipline) {
        return analyze(noteLoader.load(notePath), discipline);
    }

    /**
     * The chat model runs on the analysis executor, never on the retriever's pool.
     *
     * @param discipline rule category to restrict to ("PT", "OT", "SLP"), or {@code null} for all rules
     * @throws InvalidQueryException if the note text is null or blank
     */
    public CompletableFuture<ComplianceAnalysis> analyze(String noteText, String discipline) {
        if (noteText == null || noteText.isBlank()) {
            throw new InvalidQueryException("Progress note text must not be empty");
        }
        String query = noteText.length() > MAX_QUERY_CHARS ? noteText.substring(0, MAX_QUERY_CHARS) : noteText;
        RetrievalRequest request = RetrievalRequest.builder()
                .query(query)
                .topK(properties.getDefaultTopK())
                .categoryFilter(discipline)
                .discipline(discipline)
                .documentType("progress_note")
                .build();

        return retriever.retrieve(request).thenApplyAsync(rules -> {
            if (rules.isEmpty()) {
                log.info("No rules retrieved (retriever ready={}), skipping model call", retriever.isReady());
                return new ComplianceAnalysis(rules, NO_RULES_MESSAGE);
            }
            String answer = chatModel.generate(buildPrompt(noteText, rules));
            return new ComplianceAnalysis(rules, answer);
        }, executor);
    }

    String buildPrompt(String noteText, List<Rule> rules) {
        StringBuilder rulesBuilder = new StringBuilder();
        for (Rule rule : rules) {
            rulesBuilder.append("- [").append(rule.getId()).append("] ")
                    .append(rule.getName()).append(": ")
                    .append(rule.getContent()).append("\n");
        }

        return String.format(
                "You are a clinical documentation compliance reviewer. Check the therapy progress note below "
                        + "ONLY against the listed rules.\n"
                        + "For each rule that the note violates, name the rule id, quote the problematic text "
                        + "and suggest a correction. If the note satisfies every rule, say so.\n\n"
                        + "Rules:\n%s\n"
                        + "Progress note:\n%s\n\n"
                        + "Findings:",
                rulesBuilder,
                noteText);
    }
}
