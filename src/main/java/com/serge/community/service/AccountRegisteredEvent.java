package com.serge.community.service;

import java.util.UUID;

/**
 * Published inside the registering transaction; mail goes out only once it commits.
 */
public record AccountRegisteredEvent(UUID accountId, String username, String email,
                                     String confirmationCode) {
}
