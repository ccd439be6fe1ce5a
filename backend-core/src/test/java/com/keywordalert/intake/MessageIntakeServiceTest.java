package com.keywordalert.intake;

import com.keywordalert.detection.DetectionEngine;
import com.keywordalert.detection.Keyword;
import com.keywordalert.detection.Match;
import com.keywordalert.detection.MatchType;
import com.keywordalert.detection.SourceField;
import com.keywordalert.dispatch.AlertNotifier;
import com.keywordalert.dto.InboundMessage;
import com.keywordalert.dto.IntakeResult;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.reminder.EscalationScheduler;
import com.keywordalert.reminder.ReminderPayload;
import com.keywordalert.reminder.TriggerResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class MessageIntakeServiceTest {

    private DetectionEngine detectionEngine;
    private AlertNotifier alertNotifier;
    private EscalationScheduler escalationScheduler;
    private GroupSubscriberDirectory directory;
    private MessageIntakeService service;

    @BeforeEach
    void setUp() {
        detectionEngine = mock(DetectionEngine.class);
        alertNotifier = mock(AlertNotifier.class);
        escalationScheduler = mock(EscalationScheduler.class);
        directory = mock(GroupSubscriberDirectory.class);
        service = new MessageIntakeService(detectionEngine, alertNotifier, escalationScheduler, directory);
    }

    private static Match global(String word) {
        return new Match(Keyword.global(word, word), word, MatchType.EXACT, SourceField.BODY, null);
    }

    private static Match personal(String userId, String word, MatchType type) {
        return new Match(Keyword.personal(userId, word, word), word, type, SourceField.BODY, userId);
    }

    @Test
    void globalMatchAlertsOnceAndPersonalMatchStartsReminder() {
        InboundMessage message = new InboundMessage("urgent: help with cake", null, "bob", "family", null, null);
        when(directory.subscribersOf("family")).thenReturn(Set.of("alice"));
        when(detectionEngine.detect(eq(message.text()), isNull(), isNull())).thenReturn(List.of(global("urgent")));
        when(detectionEngine.detect(message.text(), null, "alice")).thenReturn(List.of(
                global("urgent"),
                personal("alice", "cake", MatchType.FUZZY),
                personal("alice", "help", MatchType.EXACT)));
        when(escalationScheduler.trigger(eq("alice"), eq("help"), any())).thenReturn(TriggerResult.STARTED);

        IntakeResult result = service.process(message);

        verify(alertNotifier, times(1)).notifyGlobal(anyList(), eq(message));
        ArgumentCaptor<ReminderPayload> payload = ArgumentCaptor.forClass(ReminderPayload.class);
        verify(escalationScheduler).trigger(eq("alice"), eq("help"), payload.capture());
        assertEquals("bob", payload.getValue().sender());
        assertEquals(MatchType.EXACT, payload.getValue().matchType());
        assertEquals(1, result.globalMatches().size());
        assertEquals(TriggerResult.STARTED, result.reminders().get("alice"));
    }

    @Test
    void explicitUsersTakePrecedenceOverGroupSubscribers() {
        InboundMessage message = new InboundMessage("cake", null, "bob", "family", null, Set.of("carol"));
        when(detectionEngine.detect("cake", null, "carol")).thenReturn(List.of(personal("carol", "cake", MatchType.EXACT)));
        when(escalationScheduler.trigger(any(), any(), any())).thenReturn(TriggerResult.STARTED);

        IntakeResult result = service.process(message);

        verify(directory, never()).subscribersOf(any());
        assertEquals(Set.of("carol"), result.reminders().keySet());
        verify(alertNotifier, never()).notifyGlobal(anyList(), any());
    }

    @Test
    void persistenceFailureForOneUserDoesNotStopOthers() {
        InboundMessage message = new InboundMessage("cake", null, "bob", "family", null, Set.of("alice", "carol"));
        when(detectionEngine.detect("cake", null, "alice")).thenReturn(List.of(personal("alice", "cake", MatchType.EXACT)));
        when(detectionEngine.detect("cake", null, "carol")).thenReturn(List.of(personal("carol", "cake", MatchType.EXACT)));
        when(escalationScheduler.trigger(eq("alice"), any(), any()))
                .thenThrow(new PersistenceFailureException("down", new IllegalStateException()));
        when(escalationScheduler.trigger(eq("carol"), any(), any())).thenReturn(TriggerResult.RESTARTED);

        IntakeResult result = service.process(message);

        assertEquals(Set.of("alice"), result.failedUsers());
        assertEquals(TriggerResult.RESTARTED, result.reminders().get("carol"));
    }

    @Test
    void blankMessageIsIgnored() {
        IntakeResult result = service.process(new InboundMessage("  ", null, "bob", "family", null, null));

        assertFalse(result.hasMatches());
        verifyNoInteractions(detectionEngine);
    }
}
