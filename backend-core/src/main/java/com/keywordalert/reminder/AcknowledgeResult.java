package com.keywordalert.reminder;

public enum AcknowledgeResult {
    ACKNOWLEDGED,
    NOTHING_TO_ACKNOWLEDGE
}
