package com.keywordalert.detection;

import com.keywordalert.domain.enums.KeywordMatchMode;
import com.keywordalert.domain.enums.KeywordScope;

import java.util.List;

/**
 * A configured keyword. {@code normalizedText} is the identity used for uniqueness and
 * matching; {@code ownerUserId} is set only for personal keywords.
 */
public record Keyword(
        String text,
        String normalizedText,
        KeywordScope scope,
        String ownerUserId,
        KeywordMatchMode matchMode,
        Integer fuzzyBudget,
        boolean enabled
) {

    public static Keyword global(String text, String normalizedText) {
        return new Keyword(text, normalizedText, KeywordScope.GLOBAL, null, KeywordMatchMode.FUZZY, null, true);
    }

    public static Keyword personal(String userId, String text, String normalizedText) {
        return new Keyword(text, normalizedText, KeywordScope.PERSONAL, userId, KeywordMatchMode.FUZZY, null, true);
    }

    public boolean isGlobal() {
        return scope == KeywordScope.GLOBAL;
    }

    public List<String> normalizedTokens() {
        return List.of(normalizedText.split(" "));
    }

    public Keyword withEnabled(boolean value) {
        return new Keyword(text, normalizedText, scope, ownerUserId, matchMode, fuzzyBudget, value);
    }

    public Keyword withMatchMode(KeywordMatchMode mode, Integer budget) {
        return new Keyword(text, normalizedText, scope, ownerUserId, mode, budget, enabled);
    }
}
