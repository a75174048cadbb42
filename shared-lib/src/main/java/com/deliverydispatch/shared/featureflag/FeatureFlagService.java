package com.deliverydispatch.shared.featureflag;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;

/**
 * Feature flag service backed by Redis hashes.
 *
 * Key pattern:  feature-flags:{scope}
 * Field:        {flagName}
 * Value:        "true" | "false"
 *
 * Registered via FeatureFlagAutoConfiguration (Spring Boot auto-config).
 * Set a flag via Redis CLI:
 *   HSET feature-flags:dispatch dispatch_kill_switch true
 *   HSET feature-flags:dispatch presence_public_sharing false
 *
 * When Redis cannot be reached every lookup answers with the caller's default.
 */
@Slf4j
@RequiredArgsConstructor
public class FeatureFlagService {

    private static final String FLAG_KEY_PREFIX = "feature-flags:";
    private static final String GLOBAL_SCOPE    = "global";
    public static final String DEFAULT_SCOPE    = "dispatch";

    public static final String DISPATCH_KILL_SWITCH     = "dispatch_kill_switch";
    public static final String PRESENCE_PUBLIC_SHARING  = "presence_public_sharing";
    public static final String OFFLINE_QUEUE_ENABLED    = "offline_queue_enabled";

    private final RedisTemplate<String, String> redisTemplate;

    /**
     * Returns true if the flag is enabled for the given scope.
     * Falls back to the global scope, then to the provided default value.
     */
    public boolean isEnabled(String scope, String flagName, boolean defaultValue) {
        try {
            Object scopedVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + scope, flagName);
            if (scopedVal != null) {
                return Boolean.parseBoolean(scopedVal.toString());
            }

            Object globalVal = redisTemplate.opsForHash().get(FLAG_KEY_PREFIX + GLOBAL_SCOPE, flagName);
            if (globalVal != null) {
                return Boolean.parseBoolean(globalVal.toString());
            }
        } catch (DataAccessException e) {
            log.warn("Feature flag '{}' unreadable ({}), using default={}", flagName, e.getMessage(), defaultValue);
            return defaultValue;
        }

        log.debug("Feature flag '{}' not found for scope='{}', using default={}", flagName, scope, defaultValue);
        return defaultValue;
    }

    public boolean isEnabled(String flagName, boolean defaultValue) {
        return isEnabled(DEFAULT_SCOPE, flagName, defaultValue);
    }

    public void setFlag(String scope, String flagName, boolean value) {
        redisTemplate.opsForHash().put(FLAG_KEY_PREFIX + scope, flagName, String.valueOf(value));
        log.info("Feature flag set: scope={} flag={} value={}", scope, flagName, value);
    }

    /**
     * Initialise default flags if they are not yet set (called at startup).
     */
    public void initDefaults(String scope) {
        String key = FLAG_KEY_PREFIX + scope;
        setIfAbsent(key, DISPATCH_KILL_SWITCH,    "false");
        setIfAbsent(key, PRESENCE_PUBLIC_SHARING, "true");
        setIfAbsent(key, OFFLINE_QUEUE_ENABLED,   "true");
        redisTemplate.expire(key, Duration.ofDays(365));
    }

    private void setIfAbsent(String key, String field, String value) {
        redisTemplate.opsForHash().putIfAbsent(key, field, value);
    }
}
