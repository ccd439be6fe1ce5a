package com.keywordalert.domain.model;

import com.keywordalert.domain.enums.KeywordMatchMode;
import com.keywordalert.domain.enums.KeywordScope;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "keywords", indexes = {
        @Index(name = "idx_keywords_scope_owner", columnList = "scope,owner_user_id"),
        @Index(name = "idx_keywords_identity", columnList = "scope,owner_user_id,normalized_text", unique = true)
})
public class KeywordEntity extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String text;

    @Column(name = "normalized_text", nullable = false)
    private String normalizedText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private KeywordScope scope;

    @Column(name = "owner_user_id")
    private String ownerUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_mode", nullable = false)
    private KeywordMatchMode matchMode = KeywordMatchMode.FUZZY;

    @Column(name = "fuzzy_budget")
    private Integer fuzzyBudget;

    @Column(nullable = false)
    private Boolean enabled = true;
}
