package com.keywordalert.detection;

import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Compares an already normalized token with an already normalized keyword.
 * <p>
 * Order of checks: empty input, exact equality, confusable blacklist, plural folding, bounded
 * edit distance, then substring containment with limited decoration. The token/keyword roles are fixed.
 */
public final class FuzzyMatcher {

    private final MatcherSettings settings;
    private final Map<Integer, LevenshteinDistance> distances = new ConcurrentHashMap<>();

    public FuzzyMatcher(MatcherSettings settings) {
        this.settings = settings;
    }

    public MatcherSettings settings() {
        return settings;
    }

    public MatchType match(String token, String keyword) {
        return match(token, keyword, null);
    }

    /**
     * @param fuzzyBudget edit distance allowed for this keyword, or {@code null} for the length bucket default
     */
    public MatchType match(String token, String keyword, Integer fuzzyBudget) {
        if (token == null || keyword == null || token.isEmpty() || keyword.isEmpty()) {
            return MatchType.NONE;
        }
        if (token.equals(keyword)) {
            return MatchType.EXACT;
        }
        if (settings.confusables().contains(new ConfusablePair(token, keyword))) {
            return MatchType.NONE;
        }
        if (settings.foldPlurals() && isPluralOf(token, keyword)) {
            return MatchType.FUZZY;
        }
        if (isFuzzy(token, keyword, fuzzyBudget)) {
            return MatchType.FUZZY;
        }
        if (isDecoratedSubstring(token, keyword)) {
            return MatchType.SUBSTRING;
        }
        return MatchType.NONE;
    }

    private static boolean isPluralOf(String token, String keyword) {
        String singular = singular(token);
        if (singular.equals(token)) {
            return false;
        }
        return singular.equals(keyword) || singular.equals(singular(keyword));
    }

    /**
     * English singular: "parties" to "party", "boxes" to "box", "cakes" to "cake". Words of three
     * letters or fewer are left alone.
     */
    static String singular(String word) {
        if (word.length() <= 3) {
            return word;
        }
        if (word.endsWith("ies") && word.length() > 4) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("es")) {
            String base = word.substring(0, word.length() - 2);
            if (base.endsWith("s") || base.endsWith("sh") || base.endsWith("ch") || base.endsWith("x") || base.endsWith("z")) {
                return base;
            }
        }
        if (word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    private boolean isFuzzy(String token, String keyword, Integer fuzzyBudget) {
        if (keyword.length() < settings.fuzzyMinKeywordLength()) {
            return false;
        }
        int threshold = fuzzyBudget != null ? fuzzyBudget : settings.thresholdFor(keyword.length());
        if (threshold <= 0 || Math.abs(token.length() - keyword.length()) > threshold) {
            return false;
        }
        // the bounded instance returns -1 as soon as the threshold is exceeded
        int distance = distances.computeIfAbsent(threshold, LevenshteinDistance::new).apply(token, keyword);
        return distance >= 0;
    }

    private boolean isDecoratedSubstring(String token, String keyword) {
        if (keyword.length() < settings.substringMinKeywordLength() || token.length() <= keyword.length()) {
            return false;
        }
        int idx = token.indexOf(keyword);
        while (idx >= 0) {
            String prefix = token.substring(0, idx);
            String suffix = token.substring(idx + keyword.length());
            if (!startsWithDerivationalSuffix(suffix)) {
                if (prefix.length() + suffix.length() <= settings.substringSlack()) {
                    return true;
                }
                if (prefix.isEmpty() && isDigits(suffix)) {
                    return true;
                }
            }
            idx = token.indexOf(keyword, idx + 1);
        }
        return false;
    }

    private boolean startsWithDerivationalSuffix(String suffix) {
        if (suffix.isEmpty()) {
            return false;
        }
        for (String derivational : settings.derivationalSuffixes()) {
            if (suffix.startsWith(derivational)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isDigits(String value) {
        return !value.isEmpty() && value.chars().allMatch(Character::isDigit);
    }
}
