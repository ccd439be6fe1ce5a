package com.keywordalert.repository;

import com.keywordalert.dispatch.Recipient;
import com.keywordalert.dispatch.RecipientResolver;
import com.keywordalert.domain.enums.ChannelType;
import com.keywordalert.domain.model.GroupSubscription;
import com.keywordalert.domain.model.Subscriber;
import com.keywordalert.intake.GroupSubscriberDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaSubscriberDirectory implements RecipientResolver, GroupSubscriberDirectory {

    private final SubscriberRepository subscriberRepository;
    private final GroupSubscriptionRepository groupSubscriptionRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Recipient> resolve(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return subscriberRepository.findById(userId)
                .filter(subscriber -> Boolean.TRUE.equals(subscriber.getActive()))
                .map(JpaSubscriberDirectory::toRecipient);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Recipient> authorizedRecipients() {
        return subscriberRepository.findByAuthorizedTrueAndActiveTrue().stream()
                .map(JpaSubscriberDirectory::toRecipient)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> subscribersOf(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            return Set.of();
        }
        Set<String> userIds = new LinkedHashSet<>();
        for (GroupSubscription subscription : groupSubscriptionRepository.findByGroupId(groupId)) {
            userIds.add(subscription.getUserId());
        }
        if (userIds.isEmpty()) {
            return Set.of();
        }
        Set<String> active = new LinkedHashSet<>();
        subscriberRepository.findByUserIdInAndActiveTrue(userIds).forEach(subscriber -> active.add(subscriber.getUserId()));
        log.debug("Resolved group subscribers. groupId={}, subscribers={}", groupId, active.size());
        return active;
    }

    private static Recipient toRecipient(Subscriber subscriber) {
        Map<ChannelType, String> addresses = new EnumMap<>(ChannelType.class);
        if (Boolean.TRUE.equals(subscriber.getTelegramEnabled()) && notBlank(subscriber.getTelegramChatId())) {
            addresses.put(ChannelType.TELEGRAM, subscriber.getTelegramChatId());
        }
        if (Boolean.TRUE.equals(subscriber.getEmailEnabled()) && notBlank(subscriber.getEmail())) {
            addresses.put(ChannelType.EMAIL, subscriber.getEmail());
        }
        return new Recipient(subscriber.getUserId(), addresses);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
