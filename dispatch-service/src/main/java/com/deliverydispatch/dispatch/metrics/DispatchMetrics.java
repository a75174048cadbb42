package com.deliverydispatch.dispatch.metrics;

import com.deliverydispatch.dispatch.model.UnmatchedReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Custom Micrometer metrics for the dispatch core.
 *
 * Metrics exposed at /actuator/prometheus:
 *
 *   dispatch_assignments_total{outcome="assigned|no_candidates|claim_conflict|..."}
 *   dispatch_assignment_latency_seconds{quantile="0.5|0.95|0.99"}
 *   dispatch_claim_conflicts_total
 *   dispatch_cache_fallbacks_total{operation="..."}
 *   dispatch_offline_messages_total{action="queued|flushed|expired"}
 *   dispatch_connections_closed_total{reason="idle|client"}
 */
@Component
public class DispatchMetrics {

    private final MeterRegistry registry;
    private final Counter assignedCounter;
    private final Map<UnmatchedReason, Counter> unmatchedCounters = new EnumMap<>(UnmatchedReason.class);
    private final Counter claimConflictCounter;
    private final Counter messagesQueuedCounter;
    private final Counter messagesFlushedCounter;
    private final Counter messagesExpiredCounter;
    private final Counter idleCloseCounter;
    private final Counter authFailureCounter;
    private final Timer   assignmentLatencyTimer;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.assignedCounter = Counter.builder("dispatch.assignments")
                .tag("outcome", "assigned")
                .description("Delivery requests matched to a driver")
                .register(registry);

        for (UnmatchedReason reason : UnmatchedReason.values()) {
            unmatchedCounters.put(reason, Counter.builder("dispatch.assignments")
                    .tag("outcome", reason.name().toLowerCase())
                    .description("Delivery requests left without a driver")
                    .register(registry));
        }

        this.claimConflictCounter = Counter.builder("dispatch.claim_conflicts")
                .description("Claims lost to a concurrent assignment")
                .register(registry);

        this.messagesQueuedCounter = Counter.builder("dispatch.offline_messages")
                .tag("action", "queued")
                .register(registry);

        this.messagesFlushedCounter = Counter.builder("dispatch.offline_messages")
                .tag("action", "flushed")
                .register(registry);

        this.messagesExpiredCounter = Counter.builder("dispatch.offline_messages")
                .tag("action", "expired")
                .register(registry);

        this.idleCloseCounter = Counter.builder("dispatch.connections_closed")
                .tag("reason", "idle")
                .description("Connections force-closed by the liveness sweep")
                .register(registry);

        this.authFailureCounter = Counter.builder("dispatch.auth_failures")
                .register(registry);

        this.assignmentLatencyTimer = Timer.builder("dispatch.assignment.latency")
                .description("Time to score candidates and settle a claim")
                .publishPercentiles(0.5, 0.95, 0.99)
                .publishPercentileHistogram(true)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofSeconds(5))
                .register(registry);
    }

    public void recordAssigned()                        { assignedCounter.increment(); }
    public void recordUnmatched(UnmatchedReason reason) { unmatchedCounters.get(reason).increment(); }
    public void recordClaimConflict()                   { claimConflictCounter.increment(); }
    public void recordMessageQueued()                   { messagesQueuedCounter.increment(); }
    public void recordMessagesFlushed(int count)        { messagesFlushedCounter.increment(count); }
    public void recordMessagesExpired(int count)        { messagesExpiredCounter.increment(count); }
    public void recordIdleClose()                       { idleCloseCounter.increment(); }
    public void recordAuthFailure()                     { authFailureCounter.increment(); }
    public Timer getAssignmentLatencyTimer()            { return assignmentLatencyTimer; }

    public void recordCacheFallback(String operation) {
        registry.counter("dispatch.cache_fallbacks", "operation", operation).increment();
    }
}
