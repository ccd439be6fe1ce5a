package com.keywordalert.dispatch;

import com.keywordalert.domain.enums.ChannelType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per recipient, per channel result of one {@link NotificationDispatcher#send} call.
 */
public final class DispatchReport {

    private static final DispatchReport EMPTY = new DispatchReport(Map.of());

    private final Map<String, Map<ChannelType, DeliveryOutcome>> outcomes;

    public DispatchReport(Map<String, Map<ChannelType, DeliveryOutcome>> outcomes) {
        Map<String, Map<ChannelType, DeliveryOutcome>> copy = new LinkedHashMap<>();
        outcomes.forEach((userId, byChannel) -> copy.put(userId, Collections.unmodifiableMap(new LinkedHashMap<>(byChannel))));
        this.outcomes = Collections.unmodifiableMap(copy);
    }

    public static DispatchReport empty() {
        return EMPTY;
    }

    public Map<String, Map<ChannelType, DeliveryOutcome>> outcomes() {
        return outcomes;
    }

    public Map<ChannelType, DeliveryOutcome> outcomesFor(String userId) {
        return outcomes.getOrDefault(userId, Map.of());
    }

    public Optional<DeliveryOutcome> outcome(String userId, ChannelType channel) {
        return Optional.ofNullable(outcomesFor(userId).get(channel));
    }

    public List<DeliveryOutcome> failures() {
        List<DeliveryOutcome> failed = new ArrayList<>();
        outcomes.values().forEach(byChannel -> byChannel.values().stream()
                .filter(outcome -> !outcome.delivered())
                .forEach(failed::add));
        return failed;
    }

    public boolean allDelivered() {
        return failures().isEmpty();
    }

    public int deliveredCount() {
        return (int) outcomes.values().stream()
                .flatMap(byChannel -> byChannel.values().stream())
                .filter(DeliveryOutcome::delivered)
                .count();
    }

    @Override
    public String toString() {
        return "DispatchReport" + outcomes;
    }
}
