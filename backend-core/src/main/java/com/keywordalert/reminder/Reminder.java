package com.keywordalert.reminder;

import com.keywordalert.domain.enums.ReminderStatus;

import java.time.Instant;

/**
 * The single escalating reminder a user can have. {@code nextFireAt} is {@code null} once the
 * reminder is terminal.
 */
public record Reminder(
        String userId,
        String keyword,
        ReminderPayload payload,
        ReminderStatus status,
        Instant firstDetectedAt,
        Instant nextFireAt,
        int fireCount
) {

    public static Reminder start(String userId, String keyword, ReminderPayload payload, Instant detectedAt) {
        return new Reminder(userId, keyword, payload, ReminderStatus.ACTIVE, detectedAt, detectedAt, 0);
    }

    public boolean isActive() {
        return status == ReminderStatus.ACTIVE;
    }

    public Reminder fired(int newFireCount, Instant next) {
        ReminderStatus nextStatus = next == null ? ReminderStatus.EXPIRED : ReminderStatus.ACTIVE;
        return new Reminder(userId, keyword, payload, nextStatus, firstDetectedAt, next, Math.max(fireCount, newFireCount));
    }
}
