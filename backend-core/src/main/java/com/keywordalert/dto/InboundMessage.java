package com.keywordalert.dto;

import java.util.Set;

/**
 * One message received from a group. When {@code forUsers} is empty the personal keywords of
 * the group's subscribers are evaluated.
 */
public record InboundMessage(
        String text,
        String filename,
        String senderId,
        String groupId,
        String attachmentSummary,
        Set<String> forUsers
) {
    public InboundMessage {
        forUsers = forUsers == null ? Set.of() : Set.copyOf(forUsers);
    }
}
