package com.keywordalert.dispatch;

import com.keywordalert.detection.Keyword;
import com.keywordalert.detection.Match;
import com.keywordalert.detection.MatchType;
import com.keywordalert.detection.SourceField;
import com.keywordalert.domain.enums.ChannelType;
import com.keywordalert.dto.InboundMessage;
import com.keywordalert.reminder.Reminder;
import com.keywordalert.reminder.ReminderPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AlertNotifierTest {

    private RecipientResolver resolver;
    private NotificationDispatcher dispatcher;
    private AlertNotifier notifier;

    @BeforeEach
    void setUp() {
        resolver = mock(RecipientResolver.class);
        dispatcher = mock(NotificationDispatcher.class);
        when(dispatcher.send(any(), any())).thenReturn(CompletableFuture.completedFuture(DispatchReport.empty()));
        notifier = new AlertNotifier(resolver, dispatcher);
    }

    @Test
    @SuppressWarnings("unchecked")
    void globalAlertGoesOnceToAllAuthorizedRecipients() {
        Recipient alice = new Recipient("alice", Map.of(ChannelType.TELEGRAM, "1"));
        Recipient bob = new Recipient("bob", Map.of(ChannelType.EMAIL, "bob@example.com"));
        Recipient silent = new Recipient("carol", Map.of());
        when(resolver.authorizedRecipients()).thenReturn(List.of(alice, bob, silent));
        List<Match> matches = List.of(
                new Match(Keyword.global("urgent", "urgent"), "urgent", MatchType.EXACT, SourceField.BODY, null),
                new Match(Keyword.global("fire", "fire"), "fir", MatchType.FUZZY, SourceField.BODY, null));

        notifier.notifyGlobal(matches, new InboundMessage("urgent, fir!", null, "dave", "ops", null, null)).join();

        ArgumentCaptor<AlertNotification> notification = ArgumentCaptor.forClass(AlertNotification.class);
        ArgumentCaptor<List<Recipient>> recipients = ArgumentCaptor.forClass(List.class);
        verify(dispatcher, times(1)).send(notification.capture(), recipients.capture());
        assertEquals(List.of("urgent", "fire"), notification.getValue().keywords());
        assertEquals(AlertKind.GLOBAL_ALERT, notification.getValue().kind());
        assertEquals(List.of(alice, bob), recipients.getValue());
    }

    @Test
    void reminderGoesToItsUser() {
        Recipient alice = new Recipient("alice", Map.of(ChannelType.TELEGRAM, "1"));
        when(resolver.resolve("alice")).thenReturn(Optional.of(alice));
        Reminder reminder = Reminder.start("alice", "cake",
                new ReminderPayload("cake at 5", "bob", "family", null, MatchType.EXACT, "cake"), Instant.EPOCH);

        notifier.notifyReminder(reminder, 2, Duration.ofMinutes(1));

        ArgumentCaptor<AlertNotification> notification = ArgumentCaptor.forClass(AlertNotification.class);
        verify(dispatcher).send(notification.capture(), eq(List.of(alice)));
        assertEquals(2, notification.getValue().reminderNumber());
        assertEquals("cake at 5", notification.getValue().message());
    }

    @Test
    void unknownUserIsSkipped() {
        when(resolver.resolve("ghost")).thenReturn(Optional.empty());
        Reminder reminder = Reminder.start("ghost", "cake",
                new ReminderPayload("cake", null, null, null, MatchType.EXACT, "cake"), Instant.EPOCH);

        notifier.notifyReminder(reminder, 1, Duration.ZERO);

        verify(dispatcher, never()).send(any(), any());
    }
}
