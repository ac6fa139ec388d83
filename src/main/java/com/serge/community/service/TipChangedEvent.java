package com.serge.community.service;

import java.util.UUID;

/**
 * Published when a tip is created or edited; the cached feed is dropped once the change commits.
 */
public record TipChangedEvent(UUID tipId) {
}
