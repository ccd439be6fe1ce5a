package com.keywordalert.repository;

import com.keywordalert.detection.Keyword;
import com.keywordalert.detection.KeywordStore;
import com.keywordalert.domain.model.KeywordEntity;
import com.keywordalert.exception.PersistenceFailureException;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaKeywordStore implements KeywordStore {

    private final KeywordRepository keywordRepository;

    @Override
    @Transactional(readOnly = true)
    public List<Keyword> loadAll() {
        try {
            return keywordRepository.findAll().stream().map(JpaKeywordStore::toKeyword).toList();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load keywords", e);
        }
    }

    @Override
    @Transactional
    public Keyword save(Keyword keyword) {
        try {
            KeywordEntity entity = find(keyword).orElseGet(KeywordEntity::new);
            entity.setText(keyword.text());
            entity.setNormalizedText(keyword.normalizedText());
            entity.setScope(keyword.scope());
            entity.setOwnerUserId(keyword.ownerUserId());
            entity.setMatchMode(keyword.matchMode());
            entity.setFuzzyBudget(keyword.fuzzyBudget());
            entity.setEnabled(keyword.enabled());
            // flush here so a constraint violation is raised inside this try, not at commit
            return toKeyword(keywordRepository.saveAndFlush(entity));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to save keyword " + keyword.normalizedText(), e);
        }
    }

    @Override
    @Transactional
    public boolean delete(Keyword keyword) {
        try {
            Optional<KeywordEntity> entity = find(keyword);
            if (entity.isEmpty()) {
                return false;
            }
            keywordRepository.delete(entity.get());
            keywordRepository.flush();
            return true;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to delete keyword " + keyword.normalizedText(), e);
        }
    }

    private Optional<KeywordEntity> find(Keyword keyword) {
        return keywordRepository.findByScopeAndOwnerUserIdAndNormalizedText(
                keyword.scope(), keyword.ownerUserId(), keyword.normalizedText());
    }

    private static Keyword toKeyword(KeywordEntity entity) {
        return new Keyword(entity.getText(), entity.getNormalizedText(), entity.getScope(), entity.getOwnerUserId(),
                entity.getMatchMode(), entity.getFuzzyBudget(), Boolean.TRUE.equals(entity.getEnabled()));
    }
}
