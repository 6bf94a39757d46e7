package com.fatec.rag_compliance.service.expansion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Widens a retrieval query with clinical synonyms, abbreviation long forms and
 * discipline or document-type vocabulary.
 */
public class QueryExpander {

    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);

    static final double SYNONYM_WEIGHT = 0.9;
    static final double ABBREVIATION_WEIGHT = 0.8;
    static final double SPECIALTY_WEIGHT = 0.7;
    static final double CONTEXT_WEIGHT = 0.6;

    private static final int MAX_TOTAL_EXPANSIONS = 10;
    private static final int MAX_SPECIALTY_TERMS = 3;
    private static final int MAX_CONTEXT_ENTITIES = 5;
    private static final int MAX_SYNONYMS_PER_ENTITY = 2;

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");
    private static final Pattern CLINICAL_TERM = Pattern.compile(
            "\\b(?:PT|OT|SLP|ROM|ADL|IADL|therapy|treatment|assessment|goals?|progress|function|mobility|strength|pain|discharge)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final List<String> CLINICAL_PHRASES = List.of(
            "physical therapy", "occupational therapy", "speech therapy",
            "range of motion", "activities of daily living", "manual muscle testing",
            "plan of care", "medical necessity", "treatment frequency");
    private static final List<String> GENERIC_CLINICAL_WORDS = List.of(
            "assessment", "treatment", "therapy", "goals", "progress");
    private static final List<String> CLINICAL_ENTITY_WORDS = List.of(
            "therapy", "treatment", "assessment", "exercise", "training", "intervention");

    private final MedicalVocabulary vocabulary;

    public QueryExpander(MedicalVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    public ExpansionResult expand(String query) {
        return expand(query, null, null);
    }

    public ExpansionResult expand(String query, String discipline, String documentType) {
        return expand(query, discipline, documentType, List.of());
    }

    /**
     * @param discipline optional discipline hint ("pt", "ot", "slp")
     * @param documentType optional document type hint ("progress_note", "evaluation", ...)
     * @param contextEntities entities found in the source document; the synonyms
     *        of the first five relevant ones are added
     */
    public ExpansionResult expand(String query, String discipline, String documentType,
            List<String> contextEntities) {
        List<String> keyTerms = extractKeyTerms(query);
        Map<String, List<String>> sources = new LinkedHashMap<>();
        Map<String, Double> confidence = new HashMap<>();
        List<String> expanded = new ArrayList<>();

        List<String> synonyms = new ArrayList<>();
        for (String term : keyTerms) {
            synonyms.addAll(vocabulary.synonymsOf(term));
        }
        collect("synonyms", synonyms, SYNONYM_WEIGHT, expanded, sources, confidence);

        List<String> abbreviations = new ArrayList<>();
        for (String term : keyTerms) {
            abbreviations.addAll(vocabulary.expandAbbreviation(term));
        }
        collect("abbreviations", abbreviations, ABBREVIATION_WEIGHT, expanded, sources, confidence);

        if (discipline != null && !discipline.isBlank()) {
            collect("specialty", specialtyTerms(query, discipline), SPECIALTY_WEIGHT, expanded, sources, confidence);
        }
        if (contextEntities != null && !contextEntities.isEmpty()) {
            collect("context", contextTerms(contextEntities), CONTEXT_WEIGHT, expanded, sources, confidence);
        }
        if (documentType != null && !documentType.isBlank()) {
            collect("document_type", vocabulary.documentTypeTerms(documentType), SPECIALTY_WEIGHT,
                    expanded, sources, confidence);
        }

        String queryLower = query.toLowerCase(Locale.ROOT);
        Set<String> seen = new LinkedHashSet<>();
        List<String> unique = new ArrayList<>();
        for (String term : expanded) {
            String lower = term.toLowerCase(Locale.ROOT);
            if (!lower.equals(queryLower) && seen.add(lower)) {
                unique.add(term);
            }
        }
        if (unique.size() > MAX_TOTAL_EXPANSIONS) {
            unique.sort((a, b) -> Double.compare(confidence.getOrDefault(b, 0.0), confidence.getOrDefault(a, 0.0)));
            unique = new ArrayList<>(unique.subList(0, MAX_TOTAL_EXPANSIONS));
        }

        log.debug("Expanded query '{}' with {} terms", query, unique.size());
        return new ExpansionResult(query, unique, sources, confidence);
    }

    private static void collect(String source, List<String> terms, double weight, List<String> expanded,
            Map<String, List<String>> sources, Map<String, Double> confidence) {
        if (terms.isEmpty()) {
            return;
        }
        expanded.addAll(terms);
        sources.put(source, List.copyOf(terms));
        for (String term : terms) {
            confidence.putIfAbsent(term, weight);
        }
    }

    List<String> extractKeyTerms(String query) {
        Set<String> keyTerms = new LinkedHashSet<>();
        String lower = query.toLowerCase(Locale.ROOT);
        Matcher matcher = WORD.matcher(lower);
        while (matcher.find()) {
            String word = matcher.group();
            if (word.length() > 2
                    && (CLINICAL_TERM.matcher(word).find() || vocabulary.isKnownTerm(word))) {
                keyTerms.add(word);
            }
        }
        for (String phrase : CLINICAL_PHRASES) {
            if (lower.contains(phrase)) {
                keyTerms.add(phrase);
            }
        }
        return new ArrayList<>(keyTerms);
    }

    // Clinical entities, or any entity longer than three characters.
    private List<String> contextTerms(List<String> contextEntities) {
        List<String> terms = new ArrayList<>();
        int used = 0;
        for (String entity : contextEntities) {
            if (used == MAX_CONTEXT_ENTITIES) {
                break;
            }
            if (entity == null) {
                continue;
            }
            String lower = entity.toLowerCase(Locale.ROOT);
            boolean clinical = CLINICAL_ENTITY_WORDS.stream().anyMatch(lower::contains);
            if (clinical || entity.length() > 3) {
                used++;
                List<String> synonyms = vocabulary.synonymsOf(entity);
                terms.addAll(synonyms.subList(0, Math.min(MAX_SYNONYMS_PER_ENTITY, synonyms.size())));
            }
        }
        return terms;
    }

    private List<String> specialtyTerms(String query, String discipline) {
        String lower = query.toLowerCase(Locale.ROOT);
        Set<String> queryWords = new HashSet<>(Arrays.asList(lower.split("\\s+")));
        boolean generic = GENERIC_CLINICAL_WORDS.stream().anyMatch(lower::contains);

        List<String> relevant = new ArrayList<>();
        for (String term : vocabulary.specialtyTerms(discipline)) {
            boolean overlaps = false;
            for (String word : term.toLowerCase(Locale.ROOT).split("\\s+")) {
                if (queryWords.contains(word)) {
                    overlaps = true;
                    break;
                }
            }
            if (overlaps || generic) {
                relevant.add(term);
            }
            if (relevant.size() == MAX_SPECIALTY_TERMS) {
                break;
            }
        }
        return relevant;
    }
}
