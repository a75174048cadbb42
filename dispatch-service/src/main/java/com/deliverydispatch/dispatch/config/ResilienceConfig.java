package com.deliverydispatch.dispatch.config;

import com.deliverydispatch.dispatch.exception.TransientStorageException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exponential-backoff retry applied to storage calls made by the assignment engine.
 * Only {@link TransientStorageException} is retried; anything else fails fast.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String STORAGE_RETRY = "dispatch-storage";

    @Bean
    public Retry storageRetry(DispatchProperties properties) {
        DispatchProperties.Assignment assignment = properties.getAssignment();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(assignment.getStorageRetryAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(assignment.getStorageRetryBackoff(), 2.0))
                .retryExceptions(TransientStorageException.class)
                .build();

        Retry retry = Retry.of(STORAGE_RETRY, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Storage call failed, retry {} of {}: {}", event.getNumberOfRetryAttempts(),
                        assignment.getStorageRetryAttempts() - 1,
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
