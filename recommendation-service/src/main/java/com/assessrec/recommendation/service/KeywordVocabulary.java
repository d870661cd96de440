package com.assessrec.recommendation.service;

import java.util.List;
import java.util.Locale;

/**
 * Keyword tables used to classify query intent. Matching is case-insensitive substring
 * membership, so stems such as {@code motivat} cover several word forms.
 */
public enum KeywordVocabulary {
    TECHNICAL(List.of(
            "java", "python", "sql", "javascript", "js", "programming",
            "coding", "technical", "excel", "development", "engineer",
            "developer", "software", "data analyst", "analyst", "sales")),
    SOFT(List.of(
            "communication", "personality", "leadership", "behavior",
            "cultural", "collaborate", "interpersonal", "emotional",
            "team", "social", "motivat", "cultural fit")),
    COGNITIVE(List.of(
            "cognitive", "aptitude", "reasoning", "numerical",
            "verbal", "analytical", "problem solving", "logic")),
    ENTRY_LEVEL(List.of(
            "new graduate", "graduate", "entry", "fresher", "junior"));

    private final List<String> keywords;

    KeywordVocabulary(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    public boolean matches(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
