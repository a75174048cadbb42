package com.deliverydispatch.dispatch.config;

import com.deliverydispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;

/**
 * Seeds default dispatch flags on startup. Flags already set in Redis are not overwritten.
 *
 * Runtime toggle:
 *   redis-cli HSET feature-flags:dispatch dispatch_kill_switch true
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FeatureFlagInitializer {

    private final FeatureFlagService featureFlagService;

    @Bean
    public ApplicationRunner seedFeatureFlags() {
        return args -> {
            try {
                featureFlagService.initDefaults(FeatureFlagService.DEFAULT_SCOPE);
                log.info("Feature flags initialised for scope={}", FeatureFlagService.DEFAULT_SCOPE);
            } catch (DataAccessException e) {
                log.warn("Feature flags not seeded, Redis unavailable; built-in defaults apply: {}", e.getMessage());
            }
        };
    }
}
