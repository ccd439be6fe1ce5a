package com.keywordalert.dto;

import com.keywordalert.detection.Match;
import com.keywordalert.reminder.TriggerResult;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record IntakeResult(
        List<Match> globalMatches,
        Map<String, TriggerResult> reminders,
        Set<String> failedUsers
) {
    public static IntakeResult empty() {
        return new IntakeResult(List.of(), Map.of(), Set.of());
    }

    public boolean hasMatches() {
        return !globalMatches.isEmpty() || !reminders.isEmpty();
    }
}
