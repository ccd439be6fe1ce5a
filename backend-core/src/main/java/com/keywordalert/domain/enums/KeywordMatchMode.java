package com.keywordalert.domain.enums;

public enum KeywordMatchMode {
    EXACT,
    FUZZY
}
