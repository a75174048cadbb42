package com.deliverydispatch.dispatch.queue;

import java.time.Instant;
import java.util.Map;

/**
 * An event held for a user who had no live socket when it was sent.
 */
public record QueuedMessage(
        String messageId,
        long userId,
        String type,
        Map<String, Object> payload,
        Instant enqueuedAt,
        Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
