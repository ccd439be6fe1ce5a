package com.keywordalert.repository;

import com.keywordalert.domain.enums.ReminderStatus;
import com.keywordalert.domain.model.ActiveReminder;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.reminder.Reminder;
import com.keywordalert.reminder.ReminderPayload;
import com.keywordalert.reminder.ReminderStore;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * {@link ReminderStore} over the {@code active_reminders} table, one row per user.
 */
@RequiredArgsConstructor
public class JpaReminderStore implements ReminderStore {

    private final ActiveReminderRepository activeReminderRepository;

    @Override
    public Optional<Reminder> find(String userId) {
        try {
            return activeReminderRepository.findById(userId).map(JpaReminderStore::toReminder);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load reminder of user " + userId, e);
        }
    }

    @Override
    public List<Reminder> findAllActive() {
        try {
            return activeReminderRepository.findByStatusOrderByNextFireAtAsc(ReminderStatus.ACTIVE).stream()
                    .map(JpaReminderStore::toReminder)
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load active reminders", e);
        }
    }

    @Override
    public Reminder save(Reminder reminder) {
        try {
            ActiveReminder entity = activeReminderRepository.findById(reminder.userId()).orElseGet(() -> {
                ActiveReminder created = new ActiveReminder();
                created.setUserId(reminder.userId());
                return created;
            });
            ReminderPayload payload = reminder.payload();
            entity.setKeyword(reminder.keyword());
            entity.setMessage(payload == null ? null : payload.message());
            entity.setSender(payload == null ? null : payload.sender());
            entity.setGroup(payload == null ? null : payload.group());
            entity.setAttachmentSummary(payload == null ? null : payload.attachmentSummary());
            entity.setMatchType(payload == null ? null : payload.matchType());
            entity.setMatchedToken(payload == null ? null : payload.matchedToken());
            entity.setStatus(reminder.status());
            entity.setFirstDetectedAt(toOffset(reminder.firstDetectedAt()));
            entity.setNextFireAt(toOffset(reminder.nextFireAt()));
            entity.setFireCount(reminder.fireCount());
            return toReminder(activeReminderRepository.save(entity));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to save reminder of user " + reminder.userId(), e);
        }
    }

    @Override
    public boolean delete(String userId) {
        try {
            if (!activeReminderRepository.existsById(userId)) {
                return false;
            }
            activeReminderRepository.deleteById(userId);
            return true;
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to delete reminder of user " + userId, e);
        }
    }

    private static Reminder toReminder(ActiveReminder entity) {
        ReminderPayload payload = new ReminderPayload(entity.getMessage(), entity.getSender(), entity.getGroup(),
                entity.getAttachmentSummary(), entity.getMatchType(), entity.getMatchedToken());
        return new Reminder(entity.getUserId(), entity.getKeyword(), payload, entity.getStatus(),
                toInstant(entity.getFirstDetectedAt()), toInstant(entity.getNextFireAt()),
                entity.getFireCount() == null ? 0 : entity.getFireCount());
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
