package com.keywordalert.dispatch;

import com.keywordalert.domain.enums.ChannelType;

import java.util.Map;

/**
 * A user and the address to use on each of their enabled channels.
 */
public record Recipient(String userId, Map<ChannelType, String> addresses) {

    public Recipient {
        addresses = addresses == null ? Map.of() : Map.copyOf(addresses);
    }

    public boolean hasChannels() {
        return !addresses.isEmpty();
    }
}
