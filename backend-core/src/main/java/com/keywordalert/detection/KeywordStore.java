package com.keywordalert.detection;

import java.util.List;

/**
 * Durable keyword storage. Implementations throw
 * {@link com.keywordalert.exception.PersistenceFailureException} when a write does not land.
 */
public interface KeywordStore {

    List<Keyword> loadAll();

    /**
     * Inserts or updates the keyword identified by scope, owner and normalized text.
     */
    Keyword save(Keyword keyword);

    boolean delete(Keyword keyword);
}
