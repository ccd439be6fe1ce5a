package com.keywordalert.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordalert.exception.KeywordConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-script orthographic equivalences used by {@link TextNormalizer}: single code point folds
 * (word-final letter forms, ё to е), combining marks to strip, whole-token abbreviations and the
 * leetspeak characters that stand for a Latin letter inside a word.
 */
public final class ScriptEquivalenceTables {

    private final Map<Script, ScriptRules> rules;
    private final Map<String, String> abbreviations;
    private final Map<Integer, Integer> leetspeak;

    private ScriptEquivalenceTables(Map<Script, ScriptRules> rules, Map<String, String> abbreviations,
                                    Map<Integer, Integer> leetspeak) {
        this.rules = rules;
        this.abbreviations = abbreviations;
        this.leetspeak = leetspeak;
    }

    public static ScriptEquivalenceTables empty() {
        return new ScriptEquivalenceTables(new EnumMap<>(Script.class), Map.of(), Map.of());
    }

    public static ScriptEquivalenceTables read(InputStream in, ObjectMapper objectMapper) {
        TablesFile file;
        try {
            file = objectMapper.readValue(in, TablesFile.class);
        } catch (IOException e) {
            throw new KeywordConfigurationException("Unreadable script equivalence tables: " + e.getMessage(), e);
        }
        if (file == null) {
            throw new KeywordConfigurationException("Script equivalence tables are empty");
        }

        Map<Script, ScriptRules> rules = new EnumMap<>(Script.class);
        if (file.scripts() != null) {
            for (Map.Entry<String, ScriptFile> entry : file.scripts().entrySet()) {
                Script script = parseScript(entry.getKey());
                rules.put(script, toRules(script, entry.getValue()));
            }
        }

        Map<String, String> abbreviations = new LinkedHashMap<>();
        if (file.abbreviations() != null) {
            file.abbreviations().forEach((abbreviation, expansion) -> {
                if (abbreviation == null || abbreviation.isBlank() || expansion == null || expansion.isBlank()) {
                    throw new KeywordConfigurationException("Blank abbreviation entry: " + abbreviation);
                }
                abbreviations.put(abbreviation, expansion);
            });
        }

        Map<Integer, Integer> leetspeak = new HashMap<>();
        if (file.leetspeak() != null) {
            file.leetspeak().forEach((from, to) -> {
                int letter = singleCodePoint(Script.LATIN, to);
                if (Script.classify(letter) != Script.LATIN) {
                    throw new KeywordConfigurationException("Leetspeak entry '" + from + "' must map to a Latin letter");
                }
                leetspeak.put(singleCodePoint(Script.LATIN, from), letter);
            });
        }
        return new ScriptEquivalenceTables(rules, Collections.unmodifiableMap(abbreviations), Map.copyOf(leetspeak));
    }

    public ScriptRules rulesFor(Script script) {
        return rules.getOrDefault(script, ScriptRules.NONE);
    }

    public Map<String, String> abbreviations() {
        return abbreviations;
    }

    /**
     * Latin letter that {@code codePoint} stands for inside a word, or {@code null}.
     */
    public Integer leetspeakLetter(int codePoint) {
        return leetspeak.get(codePoint);
    }

    private static Script parseScript(String name) {
        try {
            Script script = Script.valueOf(name.trim().toUpperCase(Locale.ROOT));
            if (!script.isWord()) {
                throw new KeywordConfigurationException("Script " + name + " cannot carry equivalence rules");
            }
            return script;
        } catch (IllegalArgumentException e) {
            throw new KeywordConfigurationException("Unknown script in equivalence tables: " + name, e);
        }
    }

    private static ScriptRules toRules(Script script, ScriptFile file) {
        if (file == null) {
            return ScriptRules.NONE;
        }
        Map<Integer, String> folds = new HashMap<>();
        if (file.fold() != null) {
            file.fold().forEach((from, to) -> folds.put(singleCodePoint(script, from), to == null ? "" : to));
        }
        Set<Integer> marks = new HashSet<>();
        if (file.stripMarks() != null) {
            for (String mark : file.stripMarks()) {
                int codePoint = singleCodePoint(script, mark);
                if (Script.classify(codePoint) != Script.MARK) {
                    throw new KeywordConfigurationException(
                            "Entry U+%04X in %s stripMarks is not a combining mark".formatted(codePoint, script));
                }
                marks.add(codePoint);
            }
        }
        return new ScriptRules(Map.copyOf(folds), Boolean.TRUE.equals(file.stripAllMarks()), Set.copyOf(marks));
    }

    private static int singleCodePoint(Script script, String value) {
        if (value == null || value.codePointCount(0, value.length()) != 1) {
            throw new KeywordConfigurationException(
                    "Expected a single character in " + script + " rules, got '" + value + "'");
        }
        return value.codePointAt(0);
    }

    public record ScriptRules(Map<Integer, String> folds, boolean stripAllMarks, Set<Integer> strippedMarks) {

        static final ScriptRules NONE = new ScriptRules(Map.of(), false, Set.of());

        public String fold(int codePoint) {
            return folds.get(codePoint);
        }

        public boolean strips(int markCodePoint) {
            return stripAllMarks || strippedMarks.contains(markCodePoint);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TablesFile(Map<String, ScriptFile> scripts, Map<String, String> abbreviations,
                      Map<String, String> leetspeak) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScriptFile(Boolean stripAllMarks, List<String> stripMarks, Map<String, String> fold) {
    }
}
