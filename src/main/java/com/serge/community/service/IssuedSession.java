package com.serge.community.service;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A freshly opened session and the bearer token that carries it.
 */
public record IssuedSession(UUID sessionId, UUID accountId, String accessToken, OffsetDateTime expiresAt) {
}
