package com.keywordalert.reminder;

import com.keywordalert.detection.MatchType;

/**
 * What a reminder repeats to its user: the triggering message and how the keyword matched.
 */
public record ReminderPayload(
        String message,
        String sender,
        String group,
        String attachmentSummary,
        MatchType matchType,
        String matchedToken
) {
}
