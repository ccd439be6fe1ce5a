package com.keywordalert.dispatch;

import com.keywordalert.detection.MatchType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AlertMessageFormatterTest {

    private final AlertMessageFormatter formatter = new AlertMessageFormatter();

    private static AlertNotification reminder(String message, int number, Duration elapsed) {
        return new AlertNotification(AlertKind.PERSONAL_REMINDER, List.of("cake"), MatchType.FUZZY, "bake",
                message, "bob", "family", "photo.jpg", number, elapsed);
    }

    @Test
    void escapesHtmlInTelegramMessage() {
        AlertNotification alert = new AlertNotification(AlertKind.GLOBAL_ALERT, List.of("urgent"), MatchType.EXACT,
                "urgent", "<b>urgent</b> & now", "Tom & Jerry", null, null, 0, null);

        String html = formatter.telegramHtml(alert);

        assertTrue(html.contains("&lt;b&gt;urgent&lt;/b&gt; &amp; now"));
        assertTrue(html.contains("Tom &amp; Jerry"));
        assertTrue(html.contains("Unknown"));
        assertTrue(html.startsWith("🚨 <b>Keyword Alert!</b>"));
    }

    @Test
    void telegramMessageIsTruncated() {
        String html = formatter.telegramHtml(reminder("x".repeat(300), 1, Duration.ZERO));

        assertTrue(html.contains("x".repeat(200) + "..."));
        assertFalse(html.contains("x".repeat(201)));
    }

    @Test
    void truncationKeepsEmojiAtTheLimitWhole() {
        String html = formatter.telegramHtml(reminder("a".repeat(199) + "\uD83D\uDE80 rocket", 1, Duration.ZERO));

        assertTrue(html.contains("a".repeat(199) + "\uD83D\uDE80..."));
        for (int i = 0; i < html.length(); i++) {
            char c = html.charAt(i);
            if (Character.isHighSurrogate(c)) {
                assertTrue(i + 1 < html.length() && Character.isLowSurrogate(html.charAt(i + 1)), "lone surrogate at " + i);
            }
        }
    }

    @Test
    void truncateCountsCodePoints() {
        assertEquals("ab...", AlertMessageFormatter.truncate("abc", 2));
        assertEquals("\uD83D\uDE80\uD83D\uDE80...", AlertMessageFormatter.truncate("\uD83D\uDE80\uD83D\uDE80\uD83D\uDE80", 2));
        assertEquals("abc", AlertMessageFormatter.truncate("abc", 3));
        assertEquals("", AlertMessageFormatter.truncate(null, 3));
    }

    @Test
    void reminderShowsNumberAndElapsedTime() {
        String html = formatter.telegramHtml(reminder("cake?", 3, Duration.ofMinutes(2)));

        assertTrue(html.contains("Reminder #3"));
        assertTrue(html.contains("2 min since detection"));
        assertTrue(html.contains("fuzzy &quot;bake&quot;"));
        assertTrue(html.contains("photo.jpg"));
    }

    @Test
    void emailUsesPrefixAndPlainText() {
        AlertNotification alert = reminder("<cake> at 5", 5, Duration.ofMinutes(60));

        assertEquals("[Alert] Reminder #5: cake", formatter.emailSubject(alert, "[Alert]"));
        String text = formatter.emailText(alert);
        assertTrue(text.contains("<cake> at 5"));
        assertTrue(text.contains("Reminder: #5, 1 h since detection"));
    }

    @Test
    void describesElapsedTime() {
        assertEquals("0 min", AlertMessageFormatter.describe(Duration.ZERO));
        assertEquals("15 min", AlertMessageFormatter.describe(Duration.ofMinutes(15)));
        assertEquals("1 h 5 min", AlertMessageFormatter.describe(Duration.ofMinutes(65)));
    }
}
