package com.keywordalert.config;

import com.keywordalert.reminder.CachingReminderStore;
import com.keywordalert.reminder.ReminderStore;
import com.keywordalert.repository.ActiveReminderRepository;
import com.keywordalert.repository.JpaReminderStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class ReminderConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "reminderTaskScheduler")
    public ThreadPoolTaskScheduler reminderTaskScheduler(ReminderProperties properties, Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.schedulerPoolSize());
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setThreadNamePrefix("reminder-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public ReminderStore reminderStore(ActiveReminderRepository activeReminderRepository) {
        return new CachingReminderStore(new JpaReminderStore(activeReminderRepository));
    }
}
