package com.deliverydispatch.dispatch.presence;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared presence bookkeeping: which instances hold sockets for a user, and the reconnect
 * tokens handed out on authentication. All writes are idempotent.
 */
public interface PresenceStore {

    void markOnline(long userId, String instanceId);

    void markOffline(long userId, String instanceId);

    /** True if some instance other than {@code instanceId} holds a socket for the user. */
    boolean isOnlineElsewhere(long userId, String instanceId);

    void storeReconnectGrant(String token, ReconnectGrant grant, Duration ttl);

    Optional<ReconnectGrant> findReconnectGrant(String token);

    /**
     * Drops reconnect grants past their TTL from process memory. Returns how many were removed.
     */
    int evictExpiredGrants();
}
