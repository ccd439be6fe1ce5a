package com.keywordalert.detection;

import com.keywordalert.domain.enums.KeywordMatchMode;
import com.keywordalert.domain.enums.KeywordScope;
import com.keywordalert.util.KeyedLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global and per-user keyword sets. Every mutation is written to the {@link KeywordStore}
 * first and only then published as a new {@link KeywordSnapshot}, so a failed write leaves
 * the in-memory view equal to the durable one and the caller gets the exception.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KeywordIndex {

    private static final String GLOBAL_LOCK_KEY = "__global__";
    private static final int MAX_RELOAD_ATTEMPTS = 3;

    private final KeywordStore keywordStore;
    private final TextNormalizer textNormalizer;
    private final KeyedLocks locks = new KeyedLocks();
    private final AtomicReference<KeywordSnapshot> snapshot = new AtomicReference<>(KeywordSnapshot.empty());

    public KeywordSnapshot snapshot() {
        return snapshot.get();
    }

    /**
     * Replaces the in-memory view with the store contents. A failed load keeps the last known
     * good snapshot and returns {@code false}. When a mutation is published while the store is
     * being read, the load is repeated so that mutation is not lost.
     */
    public boolean reload() {
        try {
            for (int attempt = 1; attempt <= MAX_RELOAD_ATTEMPTS; attempt++) {
                KeywordSnapshot before = snapshot.get();
                List<Keyword> keywords = keywordStore.loadAll();
                KeywordSnapshot loaded = KeywordSnapshot.of(before.version() + 1, keywords);
                if (snapshot.compareAndSet(before, loaded)) {
                    log.info("Keyword index loaded. version={}, global={}, total={}",
                            loaded.version(), loaded.globalKeywords().size(), keywords.size());
                    return true;
                }
                log.debug("Keyword index changed during reload, loading again. attempt={}", attempt);
            }
            log.warn("Keyword index kept changing during reload, keeping current set. version={}",
                    snapshot.get().version());
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to load keywords, keeping last known good set. version={}, error={}",
                    snapshot.get().version(), e.getMessage(), e);
            return false;
        }
    }

    public int seedGlobal(Collection<String> words) {
        if (words == null || words.isEmpty() || !snapshot.get().globalKeywords().isEmpty()) {
            return 0;
        }
        int added = 0;
        for (String word : words) {
            if (addGlobal(word) == KeywordChange.ADDED) {
                added++;
            }
        }
        log.info("Seeded global keywords. added={}", added);
        return added;
    }

    public KeywordChange addGlobal(String word) {
        return add(KeywordScope.GLOBAL, null, word, KeywordMatchMode.FUZZY, null);
    }

    public KeywordChange addGlobal(String word, KeywordMatchMode matchMode, Integer fuzzyBudget) {
        return add(KeywordScope.GLOBAL, null, word, matchMode, fuzzyBudget);
    }

    public KeywordChange removeGlobal(String word) {
        return remove(KeywordScope.GLOBAL, null, word);
    }

    public List<Keyword> listGlobal() {
        return snapshot.get().globalKeywords();
    }

    public KeywordChange setGlobalEnabled(String word, boolean enabled) {
        String normalized = normalizeOrNull(word);
        if (normalized == null) {
            return KeywordChange.INVALID;
        }
        return locks.withLock(GLOBAL_LOCK_KEY, () -> {
            Optional<Keyword> existing = snapshot.get().find(KeywordScope.GLOBAL, null, normalized);
            if (existing.isEmpty()) {
                return KeywordChange.NOT_FOUND;
            }
            if (existing.get().enabled() == enabled) {
                return KeywordChange.ALREADY_PRESENT;
            }
            Keyword saved = keywordStore.save(existing.get().withEnabled(enabled));
            snapshot.updateAndGet(current -> current.with(saved));
            log.info("Global keyword toggled. keyword={}, enabled={}", saved.text(), enabled);
            return KeywordChange.UPDATED;
        });
    }

    public KeywordChange addPersonal(String userId, String word) {
        return add(KeywordScope.PERSONAL, userId, word, KeywordMatchMode.FUZZY, null);
    }

    public KeywordChange removePersonal(String userId, String word) {
        return remove(KeywordScope.PERSONAL, userId, word);
    }

    public List<Keyword> listPersonal(String userId) {
        return snapshot.get().personalKeywords(userId);
    }

    private KeywordChange add(KeywordScope scope, String userId, String word,
                              KeywordMatchMode matchMode, Integer fuzzyBudget) {
        String normalized = normalizeOrNull(word);
        if (normalized == null || (scope == KeywordScope.PERSONAL && isBlank(userId))) {
            log.warn("Rejected keyword. scope={}, userId={}, word={}", scope, userId, word);
            return KeywordChange.INVALID;
        }
        return locks.withLock(lockKey(scope, userId), () -> {
            if (snapshot.get().find(scope, userId, normalized).isPresent()) {
                log.info("Keyword already present. scope={}, userId={}, keyword={}", scope, userId, normalized);
                return KeywordChange.ALREADY_PRESENT;
            }
            Keyword keyword = scope == KeywordScope.GLOBAL
                    ? Keyword.global(word.trim(), normalized)
                    : Keyword.personal(userId, word.trim(), normalized);
            Keyword saved = keywordStore.save(keyword.withMatchMode(matchMode, fuzzyBudget));
            KeywordSnapshot next = snapshot.updateAndGet(current -> current.with(saved));
            log.info("Keyword added. scope={}, userId={}, keyword={}, version={}",
                    scope, userId, saved.text(), next.version());
            return KeywordChange.ADDED;
        });
    }

    private KeywordChange remove(KeywordScope scope, String userId, String word) {
        String normalized = normalizeOrNull(word);
        if (normalized == null) {
            return KeywordChange.NOT_FOUND;
        }
        return locks.withLock(lockKey(scope, userId), () -> {
            Optional<Keyword> existing = snapshot.get().find(scope, userId, normalized);
            if (existing.isEmpty()) {
                log.info("Keyword not found for removal. scope={}, userId={}, keyword={}", scope, userId, normalized);
                return KeywordChange.NOT_FOUND;
            }
            keywordStore.delete(existing.get());
            KeywordSnapshot next = snapshot.updateAndGet(current -> current.without(existing.get()));
            log.info("Keyword removed. scope={}, userId={}, keyword={}, version={}",
                    scope, userId, existing.get().text(), next.version());
            return KeywordChange.REMOVED;
        });
    }

    private String normalizeOrNull(String word) {
        if (isBlank(word)) {
            return null;
        }
        String normalized = textNormalizer.normalizeKeyword(word);
        return normalized.isEmpty() ? null : normalized;
    }

    private static String lockKey(KeywordScope scope, String userId) {
        return scope == KeywordScope.GLOBAL ? GLOBAL_LOCK_KEY : userId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
