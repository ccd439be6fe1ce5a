package com.keywordalert.detection;

/**
 * Outcome of comparing one token with one keyword, ordered by strength.
 */
public enum MatchType {
    NONE(0),
    FUZZY(1),
    SUBSTRING(2),
    EXACT(3);

    private final int strength;

    MatchType(int strength) {
        this.strength = strength;
    }

    public boolean isMatch() {
        return this != NONE;
    }

    public boolean isStrongerThan(MatchType other) {
        return other == null || strength > other.strength;
    }

    public static MatchType weakest(MatchType first, MatchType second) {
        return first.strength <= second.strength ? first : second;
    }
}
