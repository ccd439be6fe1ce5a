package com.keywordalert.service;

import com.keywordalert.config.DetectionProperties;
import com.keywordalert.detection.KeywordIndex;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.reminder.EscalationScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads keywords and re-arms persisted reminders once the context is up.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEngineBootstrap implements ApplicationRunner {

    private final KeywordIndex keywordIndex;
    private final EscalationScheduler escalationScheduler;
    private final DetectionProperties detectionProperties;

    @Override
    public void run(ApplicationArguments args) {
        boolean loaded = keywordIndex.reload();
        if (loaded) {
            try {
                keywordIndex.seedGlobal(detectionProperties.seedKeywords());
            } catch (PersistenceFailureException e) {
                log.error("Failed to seed global keywords. error={}", e.getMessage(), e);
            }
        }
        int recovered = escalationScheduler.recoverActiveReminders();
        log.info("Alert engine started. keywordsLoaded={}, globalKeywords={}, remindersRecovered={}",
                loaded, keywordIndex.listGlobal().size(), recovered);
    }
}
