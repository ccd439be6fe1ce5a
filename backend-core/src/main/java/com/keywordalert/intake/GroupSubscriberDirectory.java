package com.keywordalert.intake;

import java.util.Set;

public interface GroupSubscriberDirectory {

    /**
     * Users whose personal keywords apply to messages from {@code groupId}.
     */
    Set<String> subscribersOf(String groupId);
}
