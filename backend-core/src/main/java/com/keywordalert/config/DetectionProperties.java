package com.keywordalert.config;

import com.keywordalert.detection.ConfusablePair;
import com.keywordalert.detection.MatcherSettings;
import com.keywordalert.detection.TextNormalizer;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "app.detection")
public record DetectionProperties(
        Integer shortMaxLength,
        Integer mediumMaxLength,
        Integer shortThreshold,
        Integer mediumThreshold,
        Integer longThreshold,
        Integer fuzzyMinKeywordLength,
        Integer substringSlack,
        Integer substringMinKeywordLength,
        Boolean foldPlurals,
        List<String> derivationalSuffixes,
        List<String> confusables,
        String equivalenceTables,
        List<String> seedKeywords
) {
    public static final String BUNDLED_EQUIVALENCE_TABLES = "classpath:normalization/script-equivalences.json";

    static final List<String> DEFAULT_CONFUSABLES = List.of(
            "make:cake", "take:cake", "wake:cake",
            "held:help", "hell:help", "heel:help",
            "last:list", "lost:list", "lift:list",
            "argent:urgent", "regent:urgent");

    public DetectionProperties {
        MatcherSettings defaults = MatcherSettings.defaults();
        shortMaxLength = shortMaxLength != null ? shortMaxLength : defaults.shortMaxLength();
        mediumMaxLength = mediumMaxLength != null ? mediumMaxLength : defaults.mediumMaxLength();
        shortThreshold = shortThreshold != null ? shortThreshold : defaults.shortThreshold();
        mediumThreshold = mediumThreshold != null ? mediumThreshold : defaults.mediumThreshold();
        longThreshold = longThreshold != null ? longThreshold : defaults.longThreshold();
        fuzzyMinKeywordLength = fuzzyMinKeywordLength != null ? fuzzyMinKeywordLength : defaults.fuzzyMinKeywordLength();
        substringSlack = substringSlack != null ? substringSlack : defaults.substringSlack();
        substringMinKeywordLength = substringMinKeywordLength != null
                ? substringMinKeywordLength
                : defaults.substringMinKeywordLength();
        foldPlurals = foldPlurals != null ? foldPlurals : defaults.foldPlurals();
        derivationalSuffixes = derivationalSuffixes != null ? derivationalSuffixes : defaults.derivationalSuffixes();
        confusables = confusables != null ? confusables : DEFAULT_CONFUSABLES;
        equivalenceTables = equivalenceTables != null && !equivalenceTables.isBlank()
                ? equivalenceTables
                : BUNDLED_EQUIVALENCE_TABLES;
        seedKeywords = seedKeywords != null ? seedKeywords : List.of();
    }

    public static DetectionProperties defaults() {
        return new DetectionProperties(null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Matcher settings with confusable pairs brought into normalized form.
     *
     * @throws com.keywordalert.exception.KeywordConfigurationException when a value is out of range
     *                                                                  or a pair is malformed
     */
    public MatcherSettings toMatcherSettings(TextNormalizer normalizer) {
        Set<ConfusablePair> pairs = new LinkedHashSet<>();
        for (String value : confusables) {
            ConfusablePair pair = ConfusablePair.parse(value);
            pairs.add(new ConfusablePair(normalizer.normalizeKeyword(pair.token()), normalizer.normalizeKeyword(pair.keyword())));
        }
        return new MatcherSettings(shortMaxLength, mediumMaxLength, shortThreshold, mediumThreshold, longThreshold,
                fuzzyMinKeywordLength, substringSlack, substringMinKeywordLength, derivationalSuffixes, pairs, foldPlurals);
    }
}
