package com.keywordalert.config;

import com.keywordalert.reminder.EscalationSchedule;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "app.reminders")
public record ReminderProperties(
        List<Duration> schedule,
        Duration lateFireGrace,
        Duration acknowledgeCooldown,
        Duration persistenceRetryDelay,
        Integer schedulerPoolSize
) {
    public ReminderProperties {
        if (schedule == null || schedule.isEmpty()) {
            schedule = List.of(Duration.ZERO, Duration.ofMinutes(1), Duration.ofMinutes(2),
                    Duration.ofMinutes(15), Duration.ofMinutes(60));
        }
        if (lateFireGrace == null || lateFireGrace.isNegative()) {
            lateFireGrace = Duration.ofMinutes(5);
        }
        if (acknowledgeCooldown == null || acknowledgeCooldown.isNegative()) {
            acknowledgeCooldown = Duration.ofSeconds(2);
        }
        if (persistenceRetryDelay == null || persistenceRetryDelay.isNegative() || persistenceRetryDelay.isZero()) {
            persistenceRetryDelay = Duration.ofSeconds(30);
        }
        if (schedulerPoolSize == null || schedulerPoolSize < 1) {
            schedulerPoolSize = 2;
        }
    }

    public static ReminderProperties defaults() {
        return new ReminderProperties(null, null, null, null, null);
    }

    public EscalationSchedule escalationSchedule() {
        return new EscalationSchedule(schedule);
    }
}
