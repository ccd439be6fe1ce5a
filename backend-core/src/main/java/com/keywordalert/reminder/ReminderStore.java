package com.keywordalert.reminder;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of active reminders, at most one per user. Implementations throw
 * {@link com.keywordalert.exception.PersistenceFailureException} when the backing store fails.
 */
public interface ReminderStore {

    Optional<Reminder> find(String userId);

    List<Reminder> findAllActive();

    /**
     * Inserts or replaces the reminder of {@code reminder.userId()}.
     */
    Reminder save(Reminder reminder);

    boolean delete(String userId);
}
