package com.keywordalert.dispatch;

import com.keywordalert.config.DispatchProperties;
import com.keywordalert.domain.enums.ChannelType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Sends one notification to many recipients. Every (recipient, channel) pair is attempted
 * independently on the dispatch executor with a fixed number of attempts; the returned report
 * holds one outcome per pair and the future never completes exceptionally.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final Map<ChannelType, NotificationChannel> channels = new EnumMap<>(ChannelType.class);
    private final Executor dispatchExecutor;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public NotificationDispatcher(List<NotificationChannel> channels,
                                  @Qualifier("dispatchExecutor") Executor dispatchExecutor,
                                  DispatchProperties properties) {
        channels.forEach(channel -> this.channels.put(channel.type(), channel));
        this.dispatchExecutor = dispatchExecutor;
        this.maxAttempts = properties.maxAttempts();
        this.retryBackoff = properties.retryBackoff();
        log.info("Notification channels registered. channels={}", this.channels.keySet());
    }

    public CompletableFuture<DispatchReport> send(AlertNotification notification, Collection<Recipient> recipients) {
        if (recipients == null || recipients.isEmpty()) {
            return CompletableFuture.completedFuture(DispatchReport.empty());
        }
        List<CompletableFuture<Delivery>> deliveries = new ArrayList<>();
        for (Recipient recipient : recipients) {
            recipient.addresses().forEach((type, address) ->
                    deliveries.add(submit(recipient.userId(), type, address, notification)));
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> collect(deliveries));
    }

    private CompletableFuture<Delivery> submit(String userId, ChannelType type, String address,
                                               AlertNotification notification) {
        NotificationChannel channel = channels.get(type);
        if (channel == null) {
            return CompletableFuture.completedFuture(
                    new Delivery(userId, DeliveryOutcome.failed(type, 0, "channel not configured")));
        }
        try {
            return CompletableFuture
                    .supplyAsync(() -> new Delivery(userId, deliver(channel, userId, address, notification)), dispatchExecutor)
                    .exceptionally(e -> new Delivery(userId, DeliveryOutcome.failed(type, 0, e.getMessage())));
        } catch (RejectedExecutionException e) {
            log.error("Dispatch queue full. userId={}, channel={}", userId, type);
            return CompletableFuture.completedFuture(
                    new Delivery(userId, DeliveryOutcome.failed(type, 0, "dispatch queue full")));
        }
    }

    private DeliveryOutcome deliver(NotificationChannel channel, String userId, String address,
                                    AlertNotification notification) {
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                channel.send(address, notification);
                log.info("Notification delivered. userId={}, channel={}, attempt={}", userId, channel.type(), attempt);
                return DeliveryOutcome.delivered(channel.type(), attempt);
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("Delivery attempt failed. userId={}, channel={}, attempt={}/{}, error={}",
                        userId, channel.type(), attempt, maxAttempts, e.getMessage());
            }
            if (attempt < maxAttempts && !pause()) {
                return DeliveryOutcome.failed(channel.type(), attempt, "interrupted");
            }
        }
        log.error("Delivery failed. userId={}, channel={}, attempts={}, error={}",
                userId, channel.type(), maxAttempts, lastError);
        return DeliveryOutcome.failed(channel.type(), maxAttempts, lastError);
    }

    private boolean pause() {
        if (retryBackoff.isZero()) {
            return true;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static DispatchReport collect(List<CompletableFuture<Delivery>> deliveries) {
        Map<String, Map<ChannelType, DeliveryOutcome>> outcomes = new LinkedHashMap<>();
        for (CompletableFuture<Delivery> future : deliveries) {
            Delivery delivery = future.join();
            outcomes.computeIfAbsent(delivery.userId(), ignored -> new EnumMap<>(ChannelType.class))
                    .put(delivery.outcome().channel(), delivery.outcome());
        }
        return new DispatchReport(outcomes);
    }

    private record Delivery(String userId, DeliveryOutcome outcome) {
    }
}
