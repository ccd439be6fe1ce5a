package com.keywordalert.detection;

import com.keywordalert.domain.enums.KeywordScope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, versioned view of all keywords. Detection always runs against one snapshot;
 * mutations produce a new snapshot that is swapped in atomically.
 */
public final class KeywordSnapshot {

    private static final KeywordSnapshot EMPTY = new KeywordSnapshot(0, Map.of(), Map.of());

    private final long version;
    private final Map<String, Keyword> global;
    private final Map<String, Map<String, Keyword>> personal;

    private KeywordSnapshot(long version, Map<String, Keyword> global, Map<String, Map<String, Keyword>> personal) {
        this.version = version;
        this.global = global;
        this.personal = personal;
    }

    public static KeywordSnapshot empty() {
        return EMPTY;
    }

    public static KeywordSnapshot of(long version, Collection<Keyword> keywords) {
        Map<String, Keyword> global = new LinkedHashMap<>();
        Map<String, Map<String, Keyword>> personal = new HashMap<>();
        for (Keyword keyword : keywords) {
            if (keyword.isGlobal()) {
                global.put(keyword.normalizedText(), keyword);
            } else {
                personal.computeIfAbsent(keyword.ownerUserId(), ignored -> new LinkedHashMap<>())
                        .put(keyword.normalizedText(), keyword);
            }
        }
        return new KeywordSnapshot(version, freeze(global), freezeNested(personal));
    }

    public long version() {
        return version;
    }

    public Optional<Keyword> find(KeywordScope scope, String ownerUserId, String normalizedText) {
        if (scope == KeywordScope.GLOBAL) {
            return Optional.ofNullable(global.get(normalizedText));
        }
        return Optional.ofNullable(personal.getOrDefault(ownerUserId, Map.of()).get(normalizedText));
    }

    public List<Keyword> globalKeywords() {
        return List.copyOf(global.values());
    }

    public List<Keyword> personalKeywords(String userId) {
        return List.copyOf(personal.getOrDefault(userId, Map.of()).values());
    }

    public List<Keyword> enabledFor(String userId) {
        List<Keyword> result = new ArrayList<>();
        for (Keyword keyword : global.values()) {
            if (keyword.enabled()) {
                result.add(keyword);
            }
        }
        if (userId != null) {
            for (Keyword keyword : personal.getOrDefault(userId, Map.of()).values()) {
                if (keyword.enabled()) {
                    result.add(keyword);
                }
            }
        }
        return result;
    }

    public KeywordSnapshot with(Keyword keyword) {
        if (keyword.isGlobal()) {
            Map<String, Keyword> nextGlobal = new LinkedHashMap<>(global);
            nextGlobal.put(keyword.normalizedText(), keyword);
            return new KeywordSnapshot(version + 1, freeze(nextGlobal), personal);
        }
        Map<String, Map<String, Keyword>> nextPersonal = new HashMap<>(personal);
        Map<String, Keyword> userKeywords = new LinkedHashMap<>(personal.getOrDefault(keyword.ownerUserId(), Map.of()));
        userKeywords.put(keyword.normalizedText(), keyword);
        nextPersonal.put(keyword.ownerUserId(), freeze(userKeywords));
        return new KeywordSnapshot(version + 1, global, Collections.unmodifiableMap(nextPersonal));
    }

    public KeywordSnapshot without(Keyword keyword) {
        if (keyword.isGlobal()) {
            Map<String, Keyword> nextGlobal = new LinkedHashMap<>(global);
            nextGlobal.remove(keyword.normalizedText());
            return new KeywordSnapshot(version + 1, freeze(nextGlobal), personal);
        }
        Map<String, Map<String, Keyword>> nextPersonal = new HashMap<>(personal);
        Map<String, Keyword> userKeywords = new LinkedHashMap<>(personal.getOrDefault(keyword.ownerUserId(), Map.of()));
        userKeywords.remove(keyword.normalizedText());
        if (userKeywords.isEmpty()) {
            nextPersonal.remove(keyword.ownerUserId());
        } else {
            nextPersonal.put(keyword.ownerUserId(), freeze(userKeywords));
        }
        return new KeywordSnapshot(version + 1, global, Collections.unmodifiableMap(nextPersonal));
    }

    private static Map<String, Keyword> freeze(Map<String, Keyword> map) {
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Map<String, Keyword>> freezeNested(Map<String, Map<String, Keyword>> map) {
        Map<String, Map<String, Keyword>> copy = new HashMap<>();
        map.forEach((user, keywords) -> copy.put(user, freeze(keywords)));
        return Collections.unmodifiableMap(copy);
    }
}
