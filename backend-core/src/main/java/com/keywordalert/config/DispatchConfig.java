package com.keywordalert.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class DispatchConfig {

    @Bean(name = "dispatchExecutor")
    public Executor dispatchExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.threads());
        executor.setMaxPoolSize(properties.threads());
        executor.setQueueCapacity(Math.max(50, properties.queueCapacity()));
        executor.setThreadNamePrefix("alert-dispatch-");
        executor.initialize();
        return executor;
    }
}
