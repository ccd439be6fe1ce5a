package com.keywordalert.dispatch;

import java.util.List;
import java.util.Optional;

public interface RecipientResolver {

    /**
     * Enabled channels of one user, empty when the user is unknown.
     */
    Optional<Recipient> resolve(String userId);

    /**
     * Everyone who receives global keyword alerts.
     */
    List<Recipient> authorizedRecipients();
}
