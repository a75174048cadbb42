package com.deliverydispatch.dispatch.presence;

import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@RequiredArgsConstructor
public class InMemoryPresenceStore implements PresenceStore {

    private final Clock clock;

    private final Map<Long, Set<String>> markers = new ConcurrentHashMap<>();
    private final Map<String, ExpiringGrant> grants = new ConcurrentHashMap<>();

    @Override
    public void markOnline(long userId, String instanceId) {
        markers.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(instanceId);
    }

    @Override
    public void markOffline(long userId, String instanceId) {
        markers.computeIfPresent(userId, (k, instances) -> {
            instances.remove(instanceId);
            return instances.isEmpty() ? null : instances;
        });
    }

    @Override
    public boolean isOnlineElsewhere(long userId, String instanceId) {
        Set<String> instances = markers.getOrDefault(userId, Set.of());
        return instances.stream().anyMatch(id -> !id.equals(instanceId));
    }

    @Override
    public void storeReconnectGrant(String token, ReconnectGrant grant, Duration ttl) {
        grants.put(token, new ExpiringGrant(grant, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<ReconnectGrant> findReconnectGrant(String token) {
        ExpiringGrant stored = grants.get(token);
        if (stored == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(stored.expiresAt())) {
            grants.remove(token, stored);
            return Optional.empty();
        }
        return Optional.of(stored.grant());
    }

    @Override
    public int evictExpiredGrants() {
        Instant now = clock.instant();
        int before = grants.size();
        grants.values().removeIf(stored -> !now.isBefore(stored.expiresAt()));
        return before - grants.size();
    }

    int grantCount() {
        return grants.size();
    }

    private record ExpiringGrant(ReconnectGrant grant, Instant expiresAt) {
    }
}
