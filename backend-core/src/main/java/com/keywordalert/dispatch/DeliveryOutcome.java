package com.keywordalert.dispatch;

import com.keywordalert.domain.enums.ChannelType;

public record DeliveryOutcome(ChannelType channel, boolean delivered, int attempts, String error) {

    public static DeliveryOutcome delivered(ChannelType channel, int attempts) {
        return new DeliveryOutcome(channel, true, attempts, null);
    }

    public static DeliveryOutcome failed(ChannelType channel, int attempts, String error) {
        return new DeliveryOutcome(channel, false, attempts, error);
    }
}
