package com.keywordalert.repository;

import com.keywordalert.domain.model.Subscriber;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface SubscriberRepository extends JpaRepository<Subscriber, String> {
    List<Subscriber> findByAuthorizedTrueAndActiveTrue();

    List<Subscriber> findByUserIdInAndActiveTrue(Collection<String> userIds);
}
