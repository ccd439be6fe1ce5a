package com.keywordalert.detection;

import com.keywordalert.domain.enums.KeywordMatchMode;
import com.keywordalert.exception.KeywordConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs every enabled keyword visible to a user against the tokens of a message and its
 * filename. Each keyword is reported at most once, with the strongest match found.
 */
@Slf4j
@Service
public class DetectionEngine {

    private final KeywordIndex keywordIndex;
    private final TextNormalizer textNormalizer;
    private final AtomicReference<FuzzyMatcher> matcher;

    public DetectionEngine(KeywordIndex keywordIndex, TextNormalizer textNormalizer, FuzzyMatcher fuzzyMatcher) {
        this.keywordIndex = keywordIndex;
        this.textNormalizer = textNormalizer;
        this.matcher = new AtomicReference<>(fuzzyMatcher);
    }

    public MatcherSettings currentSettings() {
        return matcher.get().settings();
    }

    /**
     * Swaps in a matcher built from {@code settings}. When building the settings fails the
     * current matcher stays in place.
     */
    public boolean reconfigure(Supplier<MatcherSettings> settings) {
        try {
            matcher.set(new FuzzyMatcher(settings.get()));
            log.info("Matcher reconfigured. settings={}", matcher.get().settings());
            return true;
        } catch (KeywordConfigurationException e) {
            log.error("Rejected matcher configuration, keeping previous one. error={}", e.getMessage());
            return false;
        }
    }

    public List<Match> detect(String text, String filename, String forUser) {
        try {
            return detectAgainst(keywordIndex.snapshot(), text, filename, forUser);
        } catch (RuntimeException e) {
            log.error("Detection failed, reporting no matches. userId={}, error={}", forUser, e.getMessage(), e);
            return List.of();
        }
    }

    private List<Match> detectAgainst(KeywordSnapshot snapshot, String text, String filename, String forUser) {
        List<Keyword> keywords = snapshot.enabledFor(forUser);
        if (keywords.isEmpty()) {
            return List.of();
        }
        Map<SourceField, List<String>> surface = new EnumMap<>(SourceField.class);
        surface.put(SourceField.FILENAME, tokenTexts(filename));
        surface.put(SourceField.BODY, tokenTexts(text));
        if (surface.values().stream().allMatch(List::isEmpty)) {
            return List.of();
        }

        FuzzyMatcher current = matcher.get();
        List<Match> matches = new ArrayList<>();
        for (Keyword keyword : keywords) {
            Match best = bestMatch(current, keyword, surface);
            if (best != null) {
                matches.add(best);
            }
        }
        if (!matches.isEmpty()) {
            log.debug("Detected keywords. userId={}, version={}, matches={}", forUser, snapshot.version(), matches.size());
        }
        return matches;
    }

    private Match bestMatch(FuzzyMatcher current, Keyword keyword, Map<SourceField, List<String>> surface) {
        List<String> parts = keyword.normalizedTokens();
        Match best = null;
        for (Map.Entry<SourceField, List<String>> field : surface.entrySet()) {
            List<String> tokens = field.getValue();
            for (int start = 0; start + parts.size() <= tokens.size(); start++) {
                MatchType type = matchAt(current, keyword, parts, tokens, start);
                if (type.isMatch() && (best == null || type.isStrongerThan(best.matchType()))) {
                    String matched = String.join(" ", tokens.subList(start, start + parts.size()));
                    best = new Match(keyword, matched, type, field.getKey(), keyword.ownerUserId());
                    if (type == MatchType.EXACT) {
                        return best;
                    }
                }
            }
        }
        return best;
    }

    private MatchType matchAt(FuzzyMatcher current, Keyword keyword, List<String> parts, List<String> tokens, int start) {
        MatchType result = MatchType.EXACT;
        for (int i = 0; i < parts.size(); i++) {
            MatchType type = matchToken(current, keyword, tokens.get(start + i), parts.get(i));
            if (!type.isMatch()) {
                return MatchType.NONE;
            }
            result = MatchType.weakest(result, type);
        }
        return result;
    }

    private static MatchType matchToken(FuzzyMatcher current, Keyword keyword, String token, String part) {
        if (keyword.matchMode() == KeywordMatchMode.EXACT) {
            return token.equals(part) ? MatchType.EXACT : MatchType.NONE;
        }
        return current.match(token, part, keyword.fuzzyBudget());
    }

    private List<String> tokenTexts(String raw) {
        return textNormalizer.tokenize(raw).stream()
                .map(Token::text)
                .collect(Collectors.toList());
    }
}
