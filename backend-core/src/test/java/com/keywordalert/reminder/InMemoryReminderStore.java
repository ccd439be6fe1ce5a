package com.keywordalert.reminder;

import com.keywordalert.exception.PersistenceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

final class InMemoryReminderStore implements ReminderStore {

    private final Map<String, Reminder> reminders = new ConcurrentHashMap<>();
    volatile boolean failWrites;

    @Override
    public Optional<Reminder> find(String userId) {
        return Optional.ofNullable(reminders.get(userId));
    }

    @Override
    public List<Reminder> findAllActive() {
        return reminders.values().stream().filter(Reminder::isActive).toList();
    }

    @Override
    public Reminder save(Reminder reminder) {
        failIfRequested();
        reminders.put(reminder.userId(), reminder);
        return reminder;
    }

    @Override
    public boolean delete(String userId) {
        failIfRequested();
        return reminders.remove(userId) != null;
    }

    int size() {
        return reminders.size();
    }

    private void failIfRequested() {
        if (failWrites) {
            throw new PersistenceFailureException("store unavailable", new IllegalStateException("down"));
        }
    }
}
