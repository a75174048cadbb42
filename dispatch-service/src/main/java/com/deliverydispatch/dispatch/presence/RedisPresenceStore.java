package com.deliverydispatch.dispatch.presence;

import com.deliverydispatch.dispatch.cache.CacheFallback;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Redis-backed presence markers and reconnect tokens.
 *
 * Key pattern:
 *   presence:user:{userId}  → set of instance ids, expires after marker-ttl unless refreshed
 *   session:{token}         → JSON reconnect grant, expires after reconnect-token-ttl
 */
@Slf4j
@RequiredArgsConstructor
public class RedisPresenceStore implements PresenceStore {

    private static final String PRESENCE_KEY_PREFIX = "presence:user:";
    private static final String SESSION_KEY_PREFIX = "session:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration markerTtl;
    private final InMemoryPresenceStore fallback;
    private final CacheFallback cacheFallback;

    @Override
    public void markOnline(long userId, String instanceId) {
        String key = PRESENCE_KEY_PREFIX + userId;
        cacheFallback.run("presence.markOnline", () -> {
            redisTemplate.opsForSet().add(key, instanceId);
            redisTemplate.expire(key, markerTtl);
        }, () -> fallback.markOnline(userId, instanceId));
    }

    @Override
    public void markOffline(long userId, String instanceId) {
        fallback.markOffline(userId, instanceId);
        cacheFallback.run("presence.markOffline",
                () -> redisTemplate.opsForSet().remove(PRESENCE_KEY_PREFIX + userId, instanceId),
                () -> { });
    }

    @Override
    public boolean isOnlineElsewhere(long userId, String instanceId) {
        return cacheFallback.call("presence.isOnlineElsewhere", () -> {
            Set<String> instances = redisTemplate.opsForSet().members(PRESENCE_KEY_PREFIX + userId);
            return instances != null && instances.stream().anyMatch(id -> !id.equals(instanceId));
        }, () -> fallback.isOnlineElsewhere(userId, instanceId));
    }

    @Override
    public void storeReconnectGrant(String token, ReconnectGrant grant, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(grant);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Reconnect grant is not serialisable", e);
        }
        cacheFallback.run("presence.storeReconnectGrant",
                () -> redisTemplate.opsForValue().set(SESSION_KEY_PREFIX + token, json, ttl),
                () -> fallback.storeReconnectGrant(token, grant, ttl));
    }

    @Override
    public Optional<ReconnectGrant> findReconnectGrant(String token) {
        Optional<String> json = cacheFallback.call("presence.findReconnectGrant",
                () -> Optional.ofNullable(redisTemplate.opsForValue().get(SESSION_KEY_PREFIX + token)),
                Optional::empty);
        if (json.isEmpty()) {
            return fallback.findReconnectGrant(token);
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), ReconnectGrant.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable reconnect grant: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Redis expires its own keys; only grants written to the fallback during an outage need evicting.
     */
    @Override
    public int evictExpiredGrants() {
        return fallback.evictExpiredGrants();
    }
}
