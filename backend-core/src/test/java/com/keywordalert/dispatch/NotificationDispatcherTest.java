package com.keywordalert.dispatch;

import com.keywordalert.config.DispatchProperties;
import com.keywordalert.domain.enums.ChannelType;
import com.keywordalert.exception.DeliveryException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class NotificationDispatcherTest {

    private final AlertNotification notification = new AlertNotification(AlertKind.GLOBAL_ALERT, List.of("urgent"),
            null, null, "urgent: call back", "bob", "family", null, 0, null);

    private ExecutorService executor;
    private NotificationChannel telegram;
    private NotificationChannel email;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        telegram = mock(NotificationChannel.class);
        when(telegram.type()).thenReturn(ChannelType.TELEGRAM);
        email = mock(NotificationChannel.class);
        when(email.type()).thenReturn(ChannelType.EMAIL);
        dispatcher = new NotificationDispatcher(List.of(telegram, email), executor,
                new DispatchProperties(3, Duration.ZERO, 4, 100));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    private static Recipient both(String userId) {
        return new Recipient(userId, Map.of(ChannelType.TELEGRAM, "100", ChannelType.EMAIL, userId + "@example.com"));
    }

    @Test
    void failingChannelDoesNotBlockOtherChannel() {
        doThrow(new DeliveryException("smtp down")).when(email).send(any(), any());

        DispatchReport report = dispatcher.send(notification, List.of(both("alice"))).join();

        DeliveryOutcome chat = report.outcome("alice", ChannelType.TELEGRAM).orElseThrow();
        DeliveryOutcome mail = report.outcome("alice", ChannelType.EMAIL).orElseThrow();
        assertTrue(chat.delivered());
        assertEquals(1, chat.attempts());
        assertFalse(mail.delivered());
        assertEquals(3, mail.attempts());
        assertEquals("smtp down", mail.error());
        verify(email, times(3)).send(any(), any());
        assertFalse(report.allDelivered());
    }

    @Test
    void failedChannelCanBeRetriedLater() {
        doThrow(new DeliveryException("smtp down")).when(email).send(any(), any());
        dispatcher.send(notification, List.of(both("alice"))).join();

        doNothing().when(email).send(any(), any());
        DispatchReport retry = dispatcher.send(notification,
                List.of(new Recipient("alice", Map.of(ChannelType.EMAIL, "alice@example.com")))).join();

        assertTrue(retry.allDelivered());
    }

    @Test
    void transientFailureIsRetried() {
        doThrow(new DeliveryException("timeout")).doNothing().when(telegram).send(any(), any());

        DispatchReport report = dispatcher.send(notification,
                List.of(new Recipient("alice", Map.of(ChannelType.TELEGRAM, "100")))).join();

        DeliveryOutcome outcome = report.outcome("alice", ChannelType.TELEGRAM).orElseThrow();
        assertTrue(outcome.delivered());
        assertEquals(2, outcome.attempts());
    }

    @Test
    void recipientsAreIndependent() {
        doThrow(new DeliveryException("blocked")).when(telegram).send(eq("100"), any());

        DispatchReport report = dispatcher.send(notification, List.of(
                new Recipient("alice", Map.of(ChannelType.TELEGRAM, "100")),
                new Recipient("bob", Map.of(ChannelType.TELEGRAM, "200")))).join();

        assertFalse(report.outcome("alice", ChannelType.TELEGRAM).orElseThrow().delivered());
        assertTrue(report.outcome("bob", ChannelType.TELEGRAM).orElseThrow().delivered());
        assertEquals(1, report.deliveredCount());
        assertEquals(1, report.failures().size());
    }

    @Test
    void unknownChannelIsReportedAsFailure() {
        NotificationDispatcher telegramOnly = new NotificationDispatcher(List.of(telegram), executor,
                DispatchProperties.defaults());

        DispatchReport report = telegramOnly.send(notification, List.of(both("alice"))).join();

        DeliveryOutcome mail = report.outcome("alice", ChannelType.EMAIL).orElseThrow();
        assertFalse(mail.delivered());
        assertEquals(0, mail.attempts());
        assertTrue(report.outcome("alice", ChannelType.TELEGRAM).orElseThrow().delivered());
    }

    @Test
    void noRecipientsGivesEmptyReport() {
        DispatchReport report = dispatcher.send(notification, List.of()).join();

        assertTrue(report.outcomes().isEmpty());
        verify(telegram, never()).send(any(), any());
        verify(email, never()).send(any(), any());
    }
}
