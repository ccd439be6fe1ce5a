package com.keywordalert.domain.enums;

public enum KeywordScope {
    GLOBAL,
    PERSONAL
}
