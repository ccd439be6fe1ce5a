package com.keywordalert.domain.enums;

public enum ChannelType {
    TELEGRAM,
    EMAIL
}
