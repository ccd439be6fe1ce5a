package com.keywordalert.intake;

import com.keywordalert.detection.DetectionEngine;
import com.keywordalert.detection.Match;
import com.keywordalert.dispatch.AlertNotifier;
import com.keywordalert.dto.InboundMessage;
import com.keywordalert.dto.IntakeResult;
import com.keywordalert.exception.PersistenceFailureException;
import com.keywordalert.reminder.EscalationScheduler;
import com.keywordalert.reminder.ReminderPayload;
import com.keywordalert.reminder.TriggerResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point for inbound group messages. Global keywords produce one alert per message;
 * for each addressed user the strongest personal match starts or restarts their reminder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageIntakeService {

    private final DetectionEngine detectionEngine;
    private final AlertNotifier alertNotifier;
    private final EscalationScheduler escalationScheduler;
    private final GroupSubscriberDirectory groupSubscriberDirectory;

    public IntakeResult process(InboundMessage message) {
        if (message == null || (isBlank(message.text()) && isBlank(message.filename()))) {
            return IntakeResult.empty();
        }

        List<Match> globalMatches = detectionEngine.detect(message.text(), message.filename(), null);
        if (!globalMatches.isEmpty()) {
            log.info("Global keywords matched. groupId={}, senderId={}, keywords={}", message.groupId(), message.senderId(),
                    globalMatches.stream().map(match -> match.keyword().text()).toList());
            alertNotifier.notifyGlobal(globalMatches, message);
        }

        Map<String, TriggerResult> reminders = new LinkedHashMap<>();
        Set<String> failedUsers = new LinkedHashSet<>();
        for (String userId : addressedUsers(message)) {
            Match strongest = strongestPersonal(detectionEngine.detect(message.text(), message.filename(), userId));
            if (strongest == null) {
                continue;
            }
            ReminderPayload payload = new ReminderPayload(message.text(), message.senderId(), message.groupId(),
                    message.attachmentSummary(), strongest.matchType(), strongest.matchedToken());
            try {
                reminders.put(userId, escalationScheduler.trigger(userId, strongest.keyword().text(), payload));
            } catch (PersistenceFailureException e) {
                failedUsers.add(userId);
                log.error("Failed to start reminder. userId={}, keyword={}, error={}",
                        userId, strongest.keyword().text(), e.getMessage(), e);
            }
        }
        return new IntakeResult(globalMatches, reminders, failedUsers);
    }

    private Set<String> addressedUsers(InboundMessage message) {
        if (!message.forUsers().isEmpty()) {
            return message.forUsers();
        }
        return groupSubscriberDirectory.subscribersOf(message.groupId());
    }

    private static Match strongestPersonal(List<Match> matches) {
        Match strongest = null;
        for (Match match : matches) {
            if (match.isPersonal() && (strongest == null || match.matchType().isStrongerThan(strongest.matchType()))) {
                strongest = match;
            }
        }
        return strongest;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
