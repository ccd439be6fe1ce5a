package com.keywordalert.detection;

/**
 * Writing system of a single code point. Tokens are maximal runs of one word script;
 * {@link #MARK} attaches to the run it follows and {@link #SEPARATOR} ends a run.
 */
public enum Script {
    LATIN,
    HEBREW,
    CYRILLIC,
    ARABIC,
    DIGIT,
    OTHER,
    MARK,
    SEPARATOR;

    public boolean isWord() {
        return this != MARK && this != SEPARATOR;
    }

    public static Script classify(int codePoint) {
        int type = Character.getType(codePoint);
        if (type == Character.NON_SPACING_MARK
                || type == Character.COMBINING_SPACING_MARK
                || type == Character.ENCLOSING_MARK) {
            return MARK;
        }
        if (Character.isDigit(codePoint)) {
            return DIGIT;
        }
        if (!Character.isLetter(codePoint)) {
            return SEPARATOR;
        }
        return switch (Character.UnicodeScript.of(codePoint)) {
            case LATIN -> LATIN;
            case HEBREW -> HEBREW;
            case CYRILLIC -> CYRILLIC;
            case ARABIC -> ARABIC;
            default -> OTHER;
        };
    }
}
