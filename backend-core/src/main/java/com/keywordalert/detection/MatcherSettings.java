package com.keywordalert.detection;

import com.keywordalert.exception.KeywordConfigurationException;

import java.util.List;
import java.util.Set;

/**
 * Tunables for {@link FuzzyMatcher}. Keyword lengths up to {@code shortMaxLength} use
 * {@code shortThreshold}, up to {@code mediumMaxLength} use {@code mediumThreshold}, longer ones
 * {@code longThreshold}. Confusable pairs must already be in normalized form. With
 * {@code foldPlurals} a token whose English singular equals the keyword is a fuzzy match.
 */
public record MatcherSettings(
        int shortMaxLength,
        int mediumMaxLength,
        int shortThreshold,
        int mediumThreshold,
        int longThreshold,
        int fuzzyMinKeywordLength,
        int substringSlack,
        int substringMinKeywordLength,
        List<String> derivationalSuffixes,
        Set<ConfusablePair> confusables,
        boolean foldPlurals
) {

    public MatcherSettings {
        if (shortMaxLength < 1 || mediumMaxLength < shortMaxLength) {
            throw new KeywordConfigurationException(
                    "Length buckets must satisfy 1 <= short (%d) <= medium (%d)".formatted(shortMaxLength, mediumMaxLength));
        }
        if (shortThreshold < 0 || mediumThreshold < 0 || longThreshold < 0) {
            throw new KeywordConfigurationException("Fuzzy thresholds must not be negative");
        }
        if (fuzzyMinKeywordLength < 1 || substringMinKeywordLength < 1 || substringSlack < 0) {
            throw new KeywordConfigurationException("Minimum keyword lengths must be positive and slack non-negative");
        }
        derivationalSuffixes = derivationalSuffixes == null
                ? List.of()
                : derivationalSuffixes.stream().filter(s -> s != null && !s.isBlank()).toList();
        confusables = confusables == null ? Set.of() : Set.copyOf(confusables);
    }

    public static MatcherSettings defaults() {
        return new MatcherSettings(4, 8, 1, 1, 2, 2, 2, 5,
                List.of("ing", "ly", "ed", "er", "est", "ness", "ment", "ful", "less"),
                Set.of(), true);
    }

    public int thresholdFor(int keywordLength) {
        if (keywordLength <= shortMaxLength) {
            return shortThreshold;
        }
        if (keywordLength <= mediumMaxLength) {
            return mediumThreshold;
        }
        return longThreshold;
    }

    public MatcherSettings withConfusables(Set<ConfusablePair> pairs) {
        return new MatcherSettings(shortMaxLength, mediumMaxLength, shortThreshold, mediumThreshold, longThreshold,
                fuzzyMinKeywordLength, substringSlack, substringMinKeywordLength, derivationalSuffixes, pairs, foldPlurals);
    }
}
