package com.keywordalert.repository;

import com.keywordalert.domain.enums.KeywordScope;
import com.keywordalert.domain.model.KeywordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface KeywordRepository extends JpaRepository<KeywordEntity, UUID> {
    Optional<KeywordEntity> findByScopeAndOwnerUserIdAndNormalizedText(KeywordScope scope, String ownerUserId, String normalizedText);
}
