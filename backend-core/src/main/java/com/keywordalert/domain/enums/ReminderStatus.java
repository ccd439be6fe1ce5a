package com.keywordalert.domain.enums;

public enum ReminderStatus {
    ACTIVE,
    EXPIRED
}
