package com.keywordalert.telegram.service;

import com.keywordalert.telegram.config.TelegramProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.HashMap;
import java.util.Map;

/**
 * Outbound side of the Telegram Bot API.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramBotService {

    private final RestClient telegramRestClient;
    private final TelegramProperties properties;

    public void sendMessage(String chatId, String html) {
        log.info("Send Telegram message. chatId={}, length={}", chatId, html.length());
        Map<String, Object> payload = new HashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", html);
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", true);

        try {
            telegramRestClient.post()
                    .uri("/bot{token}/sendMessage", properties.botToken())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Telegram message sent. chatId={}", chatId);
        } catch (RestClientException e) {
            log.error("Failed to send Telegram message. chatId={}, error={}", chatId, e.getMessage());
            throw e;
        }
    }
}
