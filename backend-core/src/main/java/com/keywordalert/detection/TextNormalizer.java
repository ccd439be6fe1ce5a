package com.keywordalert.detection;

import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Turns raw text into comparable tokens. Text is lower-cased, has leetspeak characters that sit
 * between Latin letters replaced ("p@rty", "l00k"), is folded with the per-script equivalence tables, stripped of the configured combining marks and split on whitespace,
 * punctuation and script transitions ("helloКРАСНЫЙ" gives two tokens).
 * <p>
 * Stateless after construction and safe to share between threads.
 */
public class TextNormalizer {

    private final ScriptEquivalenceTables tables;
    private final Map<String, List<Token>> abbreviations;

    public TextNormalizer(ScriptEquivalenceTables tables) {
        this.tables = tables;
        Map<String, List<Token>> expanded = new HashMap<>();
        tables.abbreviations().forEach((abbreviation, expansion) -> {
            List<Token> key = split(fold(abbreviation), false);
            List<Token> value = split(fold(expansion), false);
            if (key.size() == 1 && !value.isEmpty()) {
                expanded.put(key.get(0).text(), List.copyOf(value));
            }
        });
        this.abbreviations = Collections.unmodifiableMap(expanded);
    }

    /**
     * Lazy token sequence over {@code raw}. Every call to {@code iterator()} starts over.
     */
    public Iterable<Token> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }
        String folded = fold(raw);
        return () -> new TokenIterator(folded, true);
    }

    public List<Token> tokenize(String raw) {
        List<Token> tokens = new ArrayList<>();
        normalize(raw).forEach(tokens::add);
        return tokens;
    }

    /**
     * Normalized form of a keyword: its tokens joined by single spaces, or an empty string
     * when nothing matchable is left.
     */
    public String normalizeKeyword(String raw) {
        return tokenize(raw).stream()
                .map(Token::text)
                .collect(Collectors.joining(" "));
    }

    String fold(String raw) {
        String composed = replaceLeetspeak(Normalizer.normalize(raw.toLowerCase(Locale.ROOT), Normalizer.Form.NFC));

        StringBuilder folded = new StringBuilder(composed.length());
        composed.codePoints().forEach(codePoint -> {
            String replacement = tables.rulesFor(Script.classify(codePoint)).fold(codePoint);
            if (replacement == null) {
                folded.appendCodePoint(codePoint);
            } else {
                folded.append(replacement);
            }
        });

        String decomposed = Normalizer.normalize(folded, Normalizer.Form.NFD);
        StringBuilder stripped = new StringBuilder(decomposed.length());
        Script base = Script.SEPARATOR;
        for (int i = 0; i < decomposed.length(); ) {
            int codePoint = decomposed.codePointAt(i);
            i += Character.charCount(codePoint);
            Script script = Script.classify(codePoint);
            if (script == Script.MARK) {
                if (tables.rulesFor(base).strips(codePoint)) {
                    continue;
                }
            } else {
                base = script;
            }
            stripped.appendCodePoint(codePoint);
        }
        return Normalizer.normalize(stripped, Normalizer.Form.NFC);
    }

    // a substitute only counts when a Latin letter is on both sides within the same word,
    // so "2024", "$100" and "5pm" stay as they are
    private String replaceLeetspeak(String text) {
        int[] codePoints = text.codePoints().toArray();
        boolean changed = false;
        for (int i = 0; i < codePoints.length; i++) {
            Integer letter = tables.leetspeakLetter(codePoints[i]);
            if (letter != null && latinLetterBeside(codePoints, i, -1) && latinLetterBeside(codePoints, i, 1)) {
                codePoints[i] = letter;
                changed = true;
            }
        }
        return changed ? new String(codePoints, 0, codePoints.length) : text;
    }

    private boolean latinLetterBeside(int[] codePoints, int index, int step) {
        int i = index + step;
        while (i >= 0 && i < codePoints.length && tables.leetspeakLetter(codePoints[i]) != null) {
            i += step;
        }
        return i >= 0 && i < codePoints.length && Script.classify(codePoints[i]) == Script.LATIN;
    }

    private List<Token> split(String folded, boolean expandAbbreviations) {
        List<Token> tokens = new ArrayList<>();
        new TokenIterator(folded, expandAbbreviations).forEachRemaining(tokens::add);
        return tokens;
    }

    private final class TokenIterator implements Iterator<Token> {

        private final String text;
        private final boolean expandAbbreviations;
        private final Deque<Token> pending = new ArrayDeque<>();
        private int position;

        private TokenIterator(String text, boolean expandAbbreviations) {
            this.text = text;
            this.expandAbbreviations = expandAbbreviations;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty() && position < text.length()) {
                Token token = nextRun();
                if (token != null) {
                    enqueue(token);
                }
            }
            return !pending.isEmpty();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        private Token nextRun() {
            StringBuilder run = new StringBuilder();
            Script current = null;
            while (position < text.length()) {
                int codePoint = text.codePointAt(position);
                Script script = Script.classify(codePoint);
                if (script == Script.SEPARATOR) {
                    if (current != null) {
                        break;
                    }
                    position += Character.charCount(codePoint);
                    continue;
                }
                if (script == Script.MARK) {
                    // a mark with no base letter before it is dropped
                    if (current != null) {
                        run.appendCodePoint(codePoint);
                    }
                    position += Character.charCount(codePoint);
                    continue;
                }
                if (current == null) {
                    current = script;
                } else if (script != current) {
                    break;
                }
                run.appendCodePoint(codePoint);
                position += Character.charCount(codePoint);
            }
            return current == null ? null : new Token(run.toString(), current);
        }

        private void enqueue(Token token) {
            List<Token> expansion = expandAbbreviations ? abbreviations.get(token.text()) : null;
            if (expansion == null) {
                pending.add(token);
            } else {
                pending.addAll(expansion);
            }
        }
    }
}
