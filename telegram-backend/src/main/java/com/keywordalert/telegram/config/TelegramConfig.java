package com.keywordalert.telegram.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class TelegramConfig {

    /**
     * Client for alert delivery. A request that hangs past the read timeout fails the attempt
     * so the dispatcher can retry instead of holding a dispatch thread.
     */
    @Bean
    RestClient telegramRestClient(TelegramProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.connectTimeout());
        requestFactory.setReadTimeout(properties.readTimeout());
        return RestClient.builder()
                .baseUrl(properties.apiBase())
                .requestFactory(requestFactory)
                .build();
    }
}
