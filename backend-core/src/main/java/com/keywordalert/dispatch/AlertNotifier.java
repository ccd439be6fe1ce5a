package com.keywordalert.dispatch;

import com.keywordalert.detection.Match;
import com.keywordalert.detection.MatchType;
import com.keywordalert.dto.InboundMessage;
import com.keywordalert.reminder.Reminder;
import com.keywordalert.reminder.ReminderNotifier;
import com.keywordalert.reminder.ReminderPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Builds alert notifications and hands them to the {@link NotificationDispatcher}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertNotifier implements ReminderNotifier {

    private final RecipientResolver recipientResolver;
    private final NotificationDispatcher dispatcher;

    @Override
    public void notifyReminder(Reminder reminder, int reminderNumber, Duration elapsed) {
        Optional<Recipient> recipient = recipientResolver.resolve(reminder.userId()).filter(Recipient::hasChannels);
        if (recipient.isEmpty()) {
            log.warn("Reminder has no reachable recipient. userId={}, keyword={}", reminder.userId(), reminder.keyword());
            return;
        }
        ReminderPayload payload = reminder.payload();
        AlertNotification notification = new AlertNotification(AlertKind.PERSONAL_REMINDER,
                List.of(reminder.keyword()), payload.matchType(), payload.matchedToken(), payload.message(),
                payload.sender(), payload.group(), payload.attachmentSummary(), reminderNumber, elapsed);
        dispatcher.send(notification, List.of(recipient.get()))
                .thenAccept(report -> logReport("reminder", reminder.userId(), report));
    }

    /**
     * One alert per inbound message listing every global keyword found in it.
     */
    public CompletableFuture<DispatchReport> notifyGlobal(List<Match> matches, InboundMessage message) {
        if (matches.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }
        List<Recipient> recipients = recipientResolver.authorizedRecipients().stream()
                .filter(Recipient::hasChannels)
                .toList();
        if (recipients.isEmpty()) {
            log.warn("Global keyword matched but no authorized recipients. keywords={}", keywordsOf(matches));
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }
        Match strongest = matches.get(0);
        for (Match match : matches) {
            if (match.matchType().isStrongerThan(strongest.matchType())) {
                strongest = match;
            }
        }
        MatchType reportedType = matches.size() == 1 ? strongest.matchType() : null;
        AlertNotification notification = new AlertNotification(AlertKind.GLOBAL_ALERT, keywordsOf(matches),
                reportedType, strongest.matchedToken(), message.text(), message.senderId(), message.groupId(),
                message.attachmentSummary(), 0, null);
        return dispatcher.send(notification, recipients)
                .whenComplete((report, error) -> logReport("global", message.groupId(), report));
    }

    private static List<String> keywordsOf(List<Match> matches) {
        return matches.stream().map(match -> match.keyword().text()).toList();
    }

    private static void logReport(String kind, String subject, DispatchReport report) {
        if (report == null) {
            return;
        }
        if (report.allDelivered()) {
            log.info("Alert dispatched. kind={}, subject={}, delivered={}", kind, subject, report.deliveredCount());
        } else {
            log.warn("Alert partially failed. kind={}, subject={}, delivered={}, failures={}",
                    kind, subject, report.deliveredCount(), report.failures());
        }
    }
}
