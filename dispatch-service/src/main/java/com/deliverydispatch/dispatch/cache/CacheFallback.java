package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.exception.DegradedCacheException;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs a shared-cache operation and, if Redis cannot serve it, the in-process equivalent.
 * Degradation is logged and counted, never surfaced to callers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CacheFallback {

    private final DispatchMetrics metrics;

    public <T> T call(String operation, Supplier<T> primary, Supplier<T> fallback) {
        try {
            return primary.get();
        } catch (DataAccessException e) {
            degraded(new DegradedCacheException(operation, e));
            return fallback.get();
        }
    }

    public void run(String operation, Runnable primary, Runnable fallback) {
        call(operation, () -> {
            primary.run();
            return null;
        }, () -> {
            fallback.run();
            return null;
        });
    }

    private void degraded(DegradedCacheException e) {
        log.warn("{}; using in-process state", e.getMessage());
        log.debug("Cache failure detail for {}", e.getOperation(), e);
        metrics.recordCacheFallback(e.getOperation());
    }
}
