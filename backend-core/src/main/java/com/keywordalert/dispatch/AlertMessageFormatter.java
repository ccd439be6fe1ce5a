package com.keywordalert.dispatch;

import com.keywordalert.detection.MatchType;
import org.apache.commons.text.StringEscapeUtils;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Renders {@link AlertNotification}s as Telegram HTML and as plain-text e-mail.
 */
@Component
public class AlertMessageFormatter {

    static final int TELEGRAM_MESSAGE_LIMIT = 200;
    static final int EMAIL_MESSAGE_LIMIT = 500;

    public String telegramHtml(AlertNotification notification) {
        StringBuilder text = new StringBuilder();
        if (notification.isReminder()) {
            text.append("⏰ <b>Reminder #").append(notification.reminderNumber()).append("</b>");
            if (notification.reminderNumber() > 1) {
                text.append(" (").append(describe(notification.elapsed())).append(" since detection)");
            }
            text.append('\n');
        } else {
            text.append("🚨 <b>Keyword Alert!</b>\n");
        }
        text.append("\n🔍 <b>Keyword:</b> ").append(html(String.join(", ", notification.keywords())));
        String matchInfo = matchInfo(notification);
        if (matchInfo != null) {
            text.append("\n<b>Match:</b> ").append(html(matchInfo));
        }
        text.append("\n👤 <b>Sender:</b> ").append(html(orUnknown(notification.sender())));
        text.append("\n👥 <b>Group:</b> ").append(html(orUnknown(notification.group())));
        if (notBlank(notification.attachmentSummary())) {
            text.append("\n📎 <b>Attachment:</b> ").append(html(notification.attachmentSummary()));
        }
        text.append("\n\n💬 <b>Message:</b>\n").append(html(truncate(notification.message(), TELEGRAM_MESSAGE_LIMIT)));
        return text.toString();
    }

    public String emailSubject(AlertNotification notification, String prefix) {
        String keywords = String.join(", ", notification.keywords());
        String subject = notification.isReminder()
                ? "Reminder #" + notification.reminderNumber() + ": " + keywords
                : "Keyword Alert: " + keywords;
        return notBlank(prefix) ? prefix.trim() + " " + subject : subject;
    }

    public String emailText(AlertNotification notification) {
        StringBuilder text = new StringBuilder();
        text.append(notification.isReminder() ? "Personal keyword reminder" : "Keyword alert").append("\n\n");
        text.append("Keyword: ").append(String.join(", ", notification.keywords())).append('\n');
        String matchInfo = matchInfo(notification);
        if (matchInfo != null) {
            text.append("Match: ").append(matchInfo).append('\n');
        }
        text.append("Sender: ").append(orUnknown(notification.sender())).append('\n');
        text.append("Group: ").append(orUnknown(notification.group())).append('\n');
        if (notBlank(notification.attachmentSummary())) {
            text.append("Attachment: ").append(notification.attachmentSummary()).append('\n');
        }
        if (notification.isReminder()) {
            text.append("Reminder: #").append(notification.reminderNumber())
                    .append(", ").append(describe(notification.elapsed())).append(" since detection\n");
        }
        text.append("\nMessage:\n").append(truncate(notification.message(), EMAIL_MESSAGE_LIMIT)).append('\n');
        return text.toString();
    }

    private static String matchInfo(AlertNotification notification) {
        MatchType type = notification.matchType();
        if (type == null || type == MatchType.NONE) {
            return null;
        }
        if (type == MatchType.EXACT) {
            return "exact";
        }
        String kind = type == MatchType.FUZZY ? "fuzzy" : "partial";
        return notBlank(notification.matchedToken()) ? kind + " \"" + notification.matchedToken() + "\"" : kind;
    }

    static String describe(Duration elapsed) {
        if (elapsed == null || elapsed.isNegative()) {
            return "0 min";
        }
        long minutes = elapsed.toMinutes();
        if (minutes < 60) {
            return minutes + " min";
        }
        long rest = minutes % 60;
        return rest == 0 ? (minutes / 60) + " h" : (minutes / 60) + " h " + rest + " min";
    }

    // limit counts code points so an emoji is never split into a lone surrogate
    static String truncate(String value, int limit) {
        if (value == null) {
            return "";
        }
        if (value.codePointCount(0, value.length()) <= limit) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, limit)) + "...";
    }

    private static String html(String value) {
        return StringEscapeUtils.escapeHtml4(value);
    }

    private static String orUnknown(String value) {
        return notBlank(value) ? value : "Unknown";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
