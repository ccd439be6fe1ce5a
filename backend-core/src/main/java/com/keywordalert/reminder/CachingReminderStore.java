package com.keywordalert.reminder;

import com.keywordalert.exception.PersistenceFailureException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Read-through, write-through cache in front of a durable {@link ReminderStore}. Writes reach
 * the cache only after the durable store accepted them.
 */
@Slf4j
public class CachingReminderStore implements ReminderStore {

    private final ReminderStore delegate;
    private final ConcurrentMap<String, Reminder> cache = new ConcurrentHashMap<>();

    public CachingReminderStore(ReminderStore delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<Reminder> find(String userId) {
        Reminder cached = cache.get(userId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<Reminder> loaded = delegate.find(userId);
        loaded.ifPresent(reminder -> cache.put(userId, reminder));
        return loaded;
    }

    @Override
    public List<Reminder> findAllActive() {
        try {
            List<Reminder> active = delegate.findAllActive();
            active.forEach(reminder -> cache.put(reminder.userId(), reminder));
            return active;
        } catch (PersistenceFailureException e) {
            log.warn("Durable reminder store unavailable, serving cached reminders. cached={}, error={}",
                    cache.size(), e.getMessage());
            return cache.values().stream().filter(Reminder::isActive).toList();
        }
    }

    @Override
    public Reminder save(Reminder reminder) {
        Reminder saved = delegate.save(reminder);
        cache.put(saved.userId(), saved);
        return saved;
    }

    @Override
    public boolean delete(String userId) {
        boolean deleted = delegate.delete(userId);
        cache.remove(userId);
        return deleted;
    }
}
