package com.keywordalert.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "subscribers", indexes = {
        @Index(name = "idx_subscribers_authorized", columnList = "authorized,active")
})
public class Subscriber extends BaseEntity {

    @Id
    @Column(name = "user_id")
    private String userId;

    @Column(name = "display_name")
    private String displayName;

    @Column(name = "telegram_chat_id")
    private String telegramChatId;

    private String email;

    @Column(name = "telegram_enabled", nullable = false)
    private Boolean telegramEnabled = true;

    @Column(name = "email_enabled", nullable = false)
    private Boolean emailEnabled = false;

    /**
     * Receives global keyword alerts.
     */
    @Column(nullable = false)
    private Boolean authorized = false;

    @Column(nullable = false)
    private Boolean active = true;
}
