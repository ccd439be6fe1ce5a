package com.keywordalert.reminder;

import com.keywordalert.config.ReminderProperties;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.util.KeyedLocks;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives each user's reminder through the escalation schedule.
 * <p>
 * The {@link ReminderStore} is the source of truth; the armed timers are derived from it and
 * can be rebuilt with {@link #recoverActiveReminders()}. Every transition for a user runs under
 * that user's lock, and a timer only acts when its generation is still the one armed for the
 * user, so a cancelled or replaced timer never fires.
 */
@Slf4j
@Service
public class EscalationScheduler {

    private final ReminderStore reminderStore;
    private final ReminderNotifier notifier;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final EscalationSchedule schedule;
    private final Duration lateFireGrace;
    private final Duration acknowledgeCooldown;
    private final Duration persistenceRetryDelay;

    private final KeyedLocks locks = new KeyedLocks();
    private final ConcurrentMap<String, ArmedTimer> timers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Instant> acknowledgedAt = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    public EscalationScheduler(ReminderStore reminderStore,
                               ReminderNotifier notifier,
                               @Qualifier("reminderTaskScheduler") TaskScheduler taskScheduler,
                               Clock clock,
                               ReminderProperties properties) {
        this.reminderStore = reminderStore;
        this.notifier = notifier;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.schedule = properties.escalationSchedule();
        this.lateFireGrace = properties.lateFireGrace();
        this.acknowledgeCooldown = properties.acknowledgeCooldown();
        this.persistenceRetryDelay = properties.persistenceRetryDelay();
    }

    /**
     * Starts the user's reminder, or restarts it from the first slot when one is already active.
     *
     * @throws PersistenceFailureException when the reminder could not be stored; the previous
     *                                     reminder, if any, keeps running unchanged
     */
    public TriggerResult trigger(String userId, String keyword, ReminderPayload payload) {
        return locks.withLock(userId, () -> {
            Instant now = clock.instant();
            Instant acknowledged = acknowledgedAt.get(userId);
            if (acknowledged != null) {
                if (now.isBefore(acknowledged.plus(acknowledgeCooldown))) {
                    log.info("Reminder suppressed by acknowledge cooldown. userId={}, keyword={}", userId, keyword);
                    return TriggerResult.SUPPRESSED;
                }
                acknowledgedAt.remove(userId);
            }

            boolean restart = timers.containsKey(userId) || reminderStore.find(userId).filter(Reminder::isActive).isPresent();
            Reminder reminder = reminderStore.save(Reminder.start(userId, keyword, payload, now));
            arm(userId, reminder.nextFireAt());
            log.info("Reminder {}. userId={}, keyword={}, firstDetectedAt={}",
                    restart ? "restarted" : "armed", userId, keyword, now);
            return restart ? TriggerResult.RESTARTED : TriggerResult.STARTED;
        });
    }

    /**
     * Stops the user's reminder.
     *
     * @throws PersistenceFailureException when the reminder could not be removed; it stays active
     */
    public AcknowledgeResult acknowledge(String userId) {
        return locks.withLock(userId, () -> {
            Optional<Reminder> active = reminderStore.find(userId).filter(Reminder::isActive);
            if (active.isEmpty()) {
                disarm(userId);
                log.info("Nothing to acknowledge. userId={}", userId);
                return AcknowledgeResult.NOTHING_TO_ACKNOWLEDGE;
            }
            reminderStore.delete(userId);
            disarm(userId);
            acknowledgedAt.put(userId, clock.instant());
            log.info("Reminder acknowledged. userId={}, keyword={}, fireCount={}",
                    userId, active.get().keyword(), active.get().fireCount());
            return AcknowledgeResult.ACKNOWLEDGED;
        });
    }

    public Optional<Reminder> activeReminder(String userId) {
        return reminderStore.find(userId).filter(Reminder::isActive);
    }

    /**
     * Arms a timer for every active reminder in the store. Reminders that are already overdue
     * fire right away and catch up by elapsed time.
     */
    public int recoverActiveReminders() {
        List<Reminder> active;
        try {
            active = reminderStore.findAllActive();
        } catch (PersistenceFailureException e) {
            log.error("Failed to load active reminders for recovery. error={}", e.getMessage(), e);
            return 0;
        }
        int recovered = 0;
        for (Reminder reminder : active) {
            boolean armed = locks.withLock(reminder.userId(), () -> {
                if (timers.containsKey(reminder.userId())) {
                    return false;
                }
                arm(reminder.userId(), reminder.nextFireAt() != null ? reminder.nextFireAt() : clock.instant());
                return true;
            });
            if (armed) {
                recovered++;
                log.info("Reminder recovered. userId={}, keyword={}, fireCount={}, nextFireAt={}",
                        reminder.userId(), reminder.keyword(), reminder.fireCount(), reminder.nextFireAt());
            }
        }
        return recovered;
    }

    public boolean hasArmedTimer(String userId) {
        return timers.containsKey(userId);
    }

    boolean inAcknowledgeCooldown(String userId) {
        return acknowledgedAt.containsKey(userId);
    }

    @PreDestroy
    public void shutdown() {
        timers.forEach((userId, timer) -> timer.future().cancel(false));
        timers.clear();
        log.info("Escalation scheduler stopped, reminders stay in the store for recovery");
    }

    void fire(String userId, long generation) {
        locks.withLock(userId, () -> {
            ArmedTimer armed = timers.get(userId);
            if (armed == null || armed.generation() != generation) {
                log.debug("Ignoring stale reminder timer. userId={}, generation={}", userId, generation);
                return;
            }
            timers.remove(userId);

            Instant now = clock.instant();
            Optional<Reminder> stored;
            try {
                stored = reminderStore.find(userId);
            } catch (PersistenceFailureException e) {
                log.error("Failed to load reminder, retrying. userId={}, error={}", userId, e.getMessage());
                arm(userId, now.plus(persistenceRetryDelay));
                return;
            }
            if (stored.isEmpty() || !stored.get().isActive()) {
                log.debug("No active reminder for timer. userId={}", userId);
                return;
            }

            Reminder reminder = stored.get();
            if (reminder.nextFireAt() != null && now.isBefore(reminder.nextFireAt())) {
                arm(userId, reminder.nextFireAt());
                return;
            }
            Duration elapsed = Duration.between(reminder.firstDetectedAt(), now);
            int slot = schedule.latestDueSlot(elapsed, reminder.fireCount());
            if (slot < 0 || elapsed.compareTo(schedule.last().plus(lateFireGrace)) > 0) {
                expire(reminder, now);
                return;
            }

            int fireCount = slot + 1;
            boolean finalSlot = fireCount >= schedule.size();
            Reminder fired = reminder.fired(fireCount, finalSlot ? null : schedule.dueAt(reminder.firstDetectedAt(), fireCount));
            try {
                if (finalSlot) {
                    reminderStore.delete(userId);
                } else {
                    reminderStore.save(fired);
                }
            } catch (PersistenceFailureException e) {
                log.error("Failed to persist reminder fire, retrying. userId={}, slot={}, error={}",
                        userId, slot, e.getMessage());
                arm(userId, now.plus(persistenceRetryDelay));
                return;
            }

            try {
                notifier.notifyReminder(fired, fireCount, elapsed);
            } catch (RuntimeException e) {
                log.error("Failed to hand off reminder notification. userId={}, slot={}, error={}",
                        userId, slot, e.getMessage(), e);
            }

            if (finalSlot) {
                log.info("Reminder expired after final fire. userId={}, keyword={}, fireCount={}",
                        userId, reminder.keyword(), fireCount);
            } else {
                arm(userId, fired.nextFireAt());
                log.info("Reminder fired. userId={}, keyword={}, fireCount={}, elapsed={}, nextFireAt={}",
                        userId, reminder.keyword(), fireCount, elapsed, fired.nextFireAt());
            }
        });
    }

    private void expire(Reminder reminder, Instant now) {
        try {
            reminderStore.delete(reminder.userId());
            log.info("Reminder expired without firing. userId={}, keyword={}, fireCount={}, firstDetectedAt={}",
                    reminder.userId(), reminder.keyword(), reminder.fireCount(), reminder.firstDetectedAt());
        } catch (PersistenceFailureException e) {
            log.error("Failed to remove expired reminder, retrying. userId={}, error={}",
                    reminder.userId(), e.getMessage());
            arm(reminder.userId(), now.plus(persistenceRetryDelay));
        }
    }

    // caller holds the user's lock
    private void arm(String userId, Instant at) {
        long generation = generations.incrementAndGet();
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(userId, generation), at);
        ArmedTimer previous = timers.put(userId, new ArmedTimer(generation, future));
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    private void disarm(String userId) {
        ArmedTimer previous = timers.remove(userId);
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    private record ArmedTimer(long generation, ScheduledFuture<?> future) {
    }
}
