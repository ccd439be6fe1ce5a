package com.keywordalert.domain.model;

import com.keywordalert.detection.MatchType;
import com.keywordalert.domain.enums.ReminderStatus;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "active_reminders", indexes = {
        @Index(name = "idx_active_reminders_status", columnList = "status")
})
public class ActiveReminder extends BaseEntity {

    @Id
    @Column(name = "user_id")
    private String userId;

    @Column(nullable = false)
    private String keyword;

    @Column(columnDefinition = "text")
    private String message;

    private String sender;

    @Column(name = "group_name")
    private String group;

    @Column(name = "attachment_summary")
    private String attachmentSummary;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_type")
    private MatchType matchType;

    @Column(name = "matched_token")
    private String matchedToken;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ReminderStatus status = ReminderStatus.ACTIVE;

    @Column(name = "first_detected_at", nullable = false)
    private OffsetDateTime firstDetectedAt;

    @Column(name = "next_fire_at")
    private OffsetDateTime nextFireAt;

    @Column(name = "fire_count", nullable = false)
    private Integer fireCount = 0;
}
