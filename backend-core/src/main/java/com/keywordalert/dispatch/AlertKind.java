package com.keywordalert.dispatch;

public enum AlertKind {
    GLOBAL_ALERT,
    PERSONAL_REMINDER
}
