package com.keywordalert.telegram.service;

import com.keywordalert.dispatch.AlertMessageFormatter;
import com.keywordalert.dispatch.AlertNotification;
import com.keywordalert.dispatch.NotificationChannel;
import com.keywordalert.domain.enums.ChannelType;
import com.keywordalert.exception.DeliveryException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

@Component
@RequiredArgsConstructor
public class TelegramNotificationChannel implements NotificationChannel {

    private final TelegramBotService telegramBotService;
    private final AlertMessageFormatter formatter;

    @Override
    public ChannelType type() {
        return ChannelType.TELEGRAM;
    }

    @Override
    public void send(String chatId, AlertNotification notification) {
        try {
            telegramBotService.sendMessage(chatId, formatter.telegramHtml(notification));
        } catch (RestClientException e) {
            throw new DeliveryException("Telegram delivery to " + chatId + " failed: " + e.getMessage(), e);
        }
    }
}
