package com.fatec.rag_compliance.service.expansion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Clinical synonyms, abbreviations and discipline vocabulary used to widen
 * retrieval queries. Keys of {@code synonyms} are lowercase; keys of
 * {@code abbreviations} are uppercase.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MedicalVocabulary {

    private Map<String, List<String>> synonyms = new LinkedHashMap<>();
    private Map<String, List<String>> abbreviations = new LinkedHashMap<>();
    private Map<String, List<String>> specialties = new LinkedHashMap<>();
    private Map<String, List<String>> documentTypes = new LinkedHashMap<>();

    public static MedicalVocabulary read(InputStream in, ObjectMapper objectMapper) throws IOException {
        return objectMapper.readValue(in, MedicalVocabulary.class);
    }

    /**
     * Synonyms of {@code term}; when {@code term} is itself listed as a synonym,
     * its head term and sibling synonyms as well.
     */
    public List<String> synonymsOf(String term) {
        String lower = term.toLowerCase(Locale.ROOT);
        Set<String> result = new LinkedHashSet<>(synonyms.getOrDefault(lower, List.of()));
        for (Map.Entry<String, List<String>> entry : synonyms.entrySet()) {
            if (containsIgnoreCase(entry.getValue(), lower)) {
                result.add(entry.getKey());
                for (String synonym : entry.getValue()) {
                    if (!synonym.equalsIgnoreCase(lower)) {
                        result.add(synonym);
                    }
                }
            }
        }
        return new ArrayList<>(result);
    }

    /**
     * Long forms of an abbreviation, or the abbreviations whose long form is {@code term}.
     */
    public List<String> expandAbbreviation(String term) {
        List<String> result = new ArrayList<>(abbreviations.getOrDefault(term.toUpperCase(Locale.ROOT), List.of()));
        for (Map.Entry<String, List<String>> entry : abbreviations.entrySet()) {
            if (containsIgnoreCase(entry.getValue(), term)) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    /**
     * Terms of a discipline given as "pt", "ot", "slp" or the full discipline key.
     */
    public List<String> specialtyTerms(String discipline) {
        String key = discipline.toLowerCase(Locale.ROOT);
        List<String> direct = specialties.get(key);
        if (direct != null) {
            return direct;
        }
        for (String longForm : abbreviations.getOrDefault(key.toUpperCase(Locale.ROOT), List.of())) {
            List<String> terms = specialties.get(longForm.toLowerCase(Locale.ROOT).replace(' ', '_'));
            if (terms != null) {
                return terms;
            }
        }
        return List.of();
    }

    public List<String> documentTypeTerms(String documentType) {
        return documentTypes.getOrDefault(documentType.toLowerCase(Locale.ROOT).replace(' ', '_'), List.of());
    }

    public boolean isKnownTerm(String lowerCaseWord) {
        return synonyms.containsKey(lowerCaseWord) || abbreviations.containsKey(lowerCaseWord.toUpperCase(Locale.ROOT));
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        for (String value : values) {
            if (value.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms;
    }

    public Map<String, List<String>> getAbbreviations() {
        return abbreviations;
    }

    public void setAbbreviations(Map<String, List<String>> abbreviations) {
        this.abbreviations = abbreviations;
    }

    public Map<String, List<String>> getSpecialties() {
        return specialties;
    }

    public void setSpecialties(Map<String, List<String>> specialties) {
        this.specialties = specialties;
    }

    public Map<String, List<String>> getDocumentTypes() {
        return documentTypes;
    }

    public void setDocumentTypes(Map<String, List<String>> documentTypes) {
        this.documentTypes = documentTypes;
    }
}
