package com.keywordalert.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "group_subscriptions", indexes = {
        @Index(name = "idx_group_subscriptions_group", columnList = "group_id"),
        @Index(name = "idx_group_subscriptions_identity", columnList = "group_id,user_id", unique = true)
})
public class GroupSubscription extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "group_id", nullable = false)
    private String groupId;

    @Column(name = "user_id", nullable = false)
    private String userId;
}
