package com.keywordalert.dispatch;

import com.keywordalert.detection.MatchType;

import java.time.Duration;
import java.util.List;

/**
 * Channel-neutral content of one alert. Channels render it with {@link AlertMessageFormatter}.
 * {@code reminderNumber} and {@code elapsed} are only set for personal reminders.
 */
public record AlertNotification(
        AlertKind kind,
        List<String> keywords,
        MatchType matchType,
        String matchedToken,
        String message,
        String sender,
        String group,
        String attachmentSummary,
        int reminderNumber,
        Duration elapsed
) {

    public AlertNotification {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean isReminder() {
        return kind == AlertKind.PERSONAL_REMINDER;
    }
}
