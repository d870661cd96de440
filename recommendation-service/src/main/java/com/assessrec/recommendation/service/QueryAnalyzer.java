package com.assessrec.recommendation.service;

import com.assessrec.recommendation.model.QueryRequirements;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives duration and intent constraints from raw query text. Never throws.
 */
public class QueryAnalyzer {

    private static final int MINUTES = 1;
    private static final int HOURS = 60;

    // Evaluated in order, first match wins. Later rules are shadowed by the first two for most
    // inputs; the order is kept because it decides the value for text like "2 hour 30 min".
    private static final List<DurationRule> DURATION_RULES = List.of(
            rule("(\\d+)\\s*-?\\s*(\\d+)?\\s*(min|minute)s?", MINUTES),
            rule("(\\d+)\\s*-?\\s*(\\d+)?\\s*(hour|hr)s?", HOURS),
            rule("under\\s+(\\d+)\\s*(min|minute)s?", MINUTES),
            rule("under\\s+(\\d+)\\s*(hour|hr)s?", HOURS),
            rule("maximum\\s+(\\d+)\\s*(min|minute)s?", MINUTES),
            rule("maximum\\s+(\\d+)\\s*(hour|hr)s?", HOURS),
            rule("max\\s+(\\d+)\\s*(min|minute)s?", MINUTES),
            rule("max\\s+(\\d+)\\s*(hour|hr)s?", HOURS),
            rule("(\\d+)\\s*min", MINUTES),
            rule("(\\d+)\\s*hour", HOURS)
    );

    // \s and \d also match non-breaking spaces and non-ASCII digits.
    private static DurationRule rule(String regex, int multiplier) {
        return new DurationRule(Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS), multiplier);
    }

    public QueryRequirements analyze(String query) {
        if (query == null || query.isEmpty()) {
            return QueryRequirements.none();
        }
        String lower = query.toLowerCase(Locale.ROOT);
        return new QueryRequirements(
                extractMaxDuration(lower),
                KeywordVocabulary.TECHNICAL.matches(lower),
                KeywordVocabulary.SOFT.matches(lower),
                KeywordVocabulary.COGNITIVE.matches(lower),
                KeywordVocabulary.ENTRY_LEVEL.matches(lower)
        );
    }

    /**
     * @return the duration cap in minutes, or {@code null} when no rule matches or the cap is zero
     */
    Integer extractMaxDuration(String lowerQuery) {
        for (DurationRule rule : DURATION_RULES) {
            Matcher matcher = rule.pattern().matcher(lowerQuery);
            if (matcher.find()) {
                int minutes = toMinutes(matcher.group(1), rule.multiplier());
                return minutes > 0 ? minutes : null;
            }
        }
        return null;
    }

    private static int toMinutes(String digits, int multiplier) {
        long value;
        try {
            value = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            return Integer.MAX_VALUE;
        }
        if (value > Integer.MAX_VALUE / multiplier) {
            return Integer.MAX_VALUE;
        }
        return (int) value * multiplier;
    }

    private record DurationRule(Pattern pattern, int multiplier) {
    }
}
