package com.keywordalert.reminder;

public enum TriggerResult {
    STARTED,
    RESTARTED,
    SUPPRESSED
}
