package com.keywordalert.detection;

/**
 * One keyword found in one inbound message. {@code userScope} is the owner of a personal
 * keyword and {@code null} for global ones.
 */
public record Match(
        Keyword keyword,
        String matchedToken,
        MatchType matchType,
        SourceField sourceField,
        String userScope
) {

    public boolean isPersonal() {
        return !keyword.isGlobal();
    }
}
