package com.keywordalert.dispatch;

import com.keywordalert.domain.enums.ChannelType;

/**
 * Outbound transport for one channel type.
 */
public interface NotificationChannel {

    ChannelType type();

    /**
     * @throws com.keywordalert.exception.DeliveryException when the transport rejected the message
     */
    void send(String address, AlertNotification notification);
}
