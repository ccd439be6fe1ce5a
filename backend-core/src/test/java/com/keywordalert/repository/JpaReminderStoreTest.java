package com.keywordalert.repository;

import com.keywordalert.detection.MatchType;
import com.keywordalert.domain.enums.ReminderStatus;
import com.keywordalert.domain.model.ActiveReminder;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.reminder.Reminder;
import com.keywordalert.reminder.ReminderPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class JpaReminderStoreTest {

    private static final Instant DETECTED = Instant.parse("2026-03-01T10:00:00Z");

    private ActiveReminderRepository repository;
    private JpaReminderStore store;

    @BeforeEach
    void setUp() {
        repository = mock(ActiveReminderRepository.class);
        when(repository.save(any())).thenAnswer(invocation -> invocation.getArgument(0));
        store = new JpaReminderStore(repository);
    }

    private static Reminder reminder(Instant nextFireAt, int fireCount) {
        ReminderPayload payload = new ReminderPayload("cake at 5", "bob", "family", "photo.jpg", MatchType.FUZZY, "bake");
        return new Reminder("alice", "cake", payload, ReminderStatus.ACTIVE, DETECTED, nextFireAt, fireCount);
    }

    @Test
    void instantsAreStoredAsUtcOffsets() {
        store.save(reminder(DETECTED.plusSeconds(60), 1));

        ArgumentCaptor<ActiveReminder> entity = ArgumentCaptor.forClass(ActiveReminder.class);
        verify(repository).save(entity.capture());
        assertEquals(OffsetDateTime.of(2026, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC), entity.getValue().getFirstDetectedAt());
        assertEquals(ZoneOffset.UTC, entity.getValue().getNextFireAt().getOffset());
        assertEquals("family", entity.getValue().getGroup());
        assertEquals("alice", entity.getValue().getUserId());
    }

    @Test
    void rowWithOtherOffsetMapsBackToSameInstant() {
        ActiveReminder row = new ActiveReminder();
        row.setUserId("alice");
        row.setKeyword("cake");
        row.setStatus(ReminderStatus.ACTIVE);
        row.setFirstDetectedAt(OffsetDateTime.of(2026, 3, 1, 12, 0, 0, 0, ZoneOffset.ofHours(2)));
        row.setNextFireAt(null);
        row.setFireCount(4);
        row.setMatchType(MatchType.EXACT);
        when(repository.findById("alice")).thenReturn(Optional.of(row));

        Reminder loaded = store.find("alice").orElseThrow();

        assertEquals(DETECTED, loaded.firstDetectedAt());
        assertNull(loaded.nextFireAt());
        assertEquals(4, loaded.fireCount());
        assertEquals(MatchType.EXACT, loaded.payload().matchType());
    }

    @Test
    void savedReminderReadsBackUnchanged() {
        Reminder original = reminder(DETECTED.plusSeconds(900), 3);

        assertEquals(original, store.save(original));
    }

    @Test
    void saveReusesTheUsersRow() {
        ActiveReminder existing = new ActiveReminder();
        existing.setUserId("alice");
        when(repository.findById("alice")).thenReturn(Optional.of(existing));

        store.save(reminder(DETECTED, 0));

        verify(repository).save(same(existing));
        assertEquals("cake", existing.getKeyword());
    }

    @Test
    void findAllActiveAsksForActiveRowsOnly() {
        when(repository.findByStatusOrderByNextFireAtAsc(ReminderStatus.ACTIVE)).thenReturn(List.of());

        assertTrue(store.findAllActive().isEmpty());
        verify(repository).findByStatusOrderByNextFireAtAsc(ReminderStatus.ACTIVE);
    }

    @Test
    void deleteReportsWhetherARowExisted() {
        when(repository.existsById("alice")).thenReturn(true);

        assertTrue(store.delete("alice"));
        assertFalse(store.delete("bob"));
        verify(repository).deleteById("alice");
        verify(repository, never()).deleteById("bob");
    }

    @Test
    void dataAccessFailureBecomesPersistenceFailure() {
        when(repository.findById("alice")).thenThrow(new DataAccessResourceFailureException("down"));

        assertThrows(PersistenceFailureException.class, () -> store.find("alice"));
    }
}
