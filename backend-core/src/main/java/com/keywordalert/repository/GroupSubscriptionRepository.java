package com.keywordalert.repository;

import com.keywordalert.domain.model.GroupSubscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface GroupSubscriptionRepository extends JpaRepository<GroupSubscription, UUID> {
    List<GroupSubscription> findByGroupId(String groupId);
}
