package com.keywordalert.detection;

public enum KeywordChange {
    ADDED,
    ALREADY_PRESENT,
    REMOVED,
    NOT_FOUND,
    UPDATED,
    INVALID;

    public boolean isSuccess() {
        return this != NOT_FOUND && this != INVALID;
    }
}
