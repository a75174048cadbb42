package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.exception.TransientStorageException;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.AssignmentResult;
import com.deliverydispatch.dispatch.model.DeliveryRequestView;
import com.deliverydispatch.dispatch.model.DriverCandidate;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.dispatch.model.ScoredCandidate;
import com.deliverydispatch.dispatch.model.UnmatchedReason;
import com.deliverydispatch.dispatch.storage.ClaimOutcome;
import com.deliverydispatch.dispatch.storage.DispatchStorage;
import com.deliverydispatch.shared.enums.ClaimStatus;
import com.deliverydispatch.shared.enums.UserRole;
import com.deliverydispatch.shared.events.DeliveryAssignedEvent;
import com.deliverydispatch.shared.events.DeliveryClaimChangedEvent;
import com.deliverydispatch.shared.events.DeliveryUnmatchedEvent;
import com.deliverydispatch.shared.featureflag.FeatureFlagService;
import com.deliverydispatch.shared.model.GeoPoint;
import com.deliverydispatch.shared.util.GeoUtil;
import com.deliverydispatch.shared.util.KafkaTopics;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Matches a delivery request to the best available driver.
 *
 * Assignment flow:
 *  1. Kill switch → give up without touching storage
 *  2. Fetch online, available, verified drivers
 *  3. Score and rank; drop ineligible and already-tried drivers
 *  4. Conditional claim of the best driver (driver reserved and attached atomically)
 *  5. Driver taken by a concurrent assignment → exclude it and go again, up to the attempt bound
 *  6. On success notify driver, requester and admins; publish delivery.assigned
 *
 * Transient storage failures are retried with backoff; when retries run out the request is
 * reported unmatched with {@code degraded=true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssignmentEngine {

    private final DispatchStorage storage;
    private final DriverScorer scorer;
    private final NotificationRouter notificationRouter;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final FeatureFlagService featureFlagService;
    private final DispatchMetrics metrics;
    private final Retry storageRetry;
    private final DispatchProperties properties;
    private final Clock clock;

    public AssignmentResult assign(long requestId, GeoPoint requestLocation) {
        return assign(requestId, requestLocation, Set.of());
    }

    public AssignmentResult assign(long requestId, GeoPoint requestLocation, Set<Long> excludedDriverIds) {
        long startNanos = System.nanoTime();
        Attempt attempt = new Attempt();
        AssignmentResult result;
        try {
            result = runAssignment(requestId, requestLocation, excludedDriverIds, attempt);
        } catch (TransientStorageException e) {
            log.error("Assignment of request {} abandoned after storage retries: {}", requestId, e.getMessage());
            result = AssignmentResult.unmatched(requestId, UnmatchedReason.STORAGE_UNAVAILABLE, attempt.number);
        }
        metrics.getAssignmentLatencyTimer().record(Duration.ofNanos(System.nanoTime() - startNanos));

        if (result.isAssigned()) {
            metrics.recordAssigned();
        } else {
            metrics.recordUnmatched(result.getReason());
            onUnmatched(result, attempt.candidatesConsidered);
        }
        return result;
    }

    /**
     * Driver confirms a claim it holds. Returns false if the claim is not (or no longer) theirs.
     */
    public boolean accept(long requestId, long driverId) {
        boolean confirmed = withRetry(() -> storage.confirmClaim(requestId, driverId));
        if (!confirmed) {
            log.info("Driver {} tried to accept request {} without holding the claim", driverId, requestId);
            return false;
        }
        log.info("Request {} accepted by driver {}", requestId, driverId);
        publishClaimChanged(requestId, driverId, ClaimStatus.ACCEPTED, null);
        notifyRequester(requestId, driverId, ClaimStatus.ACCEPTED, null);
        return true;
    }

    /**
     * Driver turns down a claim it holds: the claim is released, the driver becomes available
     * again and the request is re-assigned without them. Empty if the driver held no claim.
     */
    public Optional<AssignmentResult> decline(long requestId, long driverId) {
        Optional<DeliveryRequestView> request = withRetry(() -> storage.findRequest(requestId));
        if (request.isEmpty()
                || !releaseHeldClaim(requestId, driverId, "DECLINED", () -> storage.releaseClaim(requestId, driverId))) {
            return Optional.empty();
        }
        log.info("Request {} declined by driver {}, reassigning", requestId, driverId);
        return Optional.of(assign(requestId, request.get().pickup(), Set.of(driverId)));
    }

    /**
     * Returns a claimed or accepted request to the pool (cancellation, offer timeout) and frees its driver.
     */
    public boolean release(long requestId, long driverId) {
        return releaseHeldClaim(requestId, driverId, "RELEASED", () -> storage.releaseAssignment(requestId, driverId));
    }

    /**
     * Finds work for a driver who has just become free: among the newest unassigned requests, the
     * one whose pickup is nearest to the driver and within the next-request radius. That request
     * then goes through normal assignment, so another driver may still win it on score.
     * Empty if the driver is unknown, offline, has no location or nothing is close enough.
     */
    public Optional<AssignmentResult> assignNextFor(long driverId) {
        Optional<DriverCandidate> driver = withRetry(() -> storage.findDriver(driverId));
        if (driver.isEmpty() || !driver.get().isOnline() || driver.get().getLocation() == null) {
            log.debug("Driver {} is not in a position to take a next request", driverId);
            return Optional.empty();
        }
        GeoPoint from = driver.get().getLocation();
        DispatchProperties.Assignment config = properties.getAssignment();

        List<DeliveryRequestView> pending = withRetry(() -> storage.findRecentUnassigned(config.getNextRequestCandidates()));
        Optional<DeliveryRequestView> nearest = pending.stream()
                .filter(r -> GeoUtil.distanceKm(from, r.pickup()) <= config.getNextRequestRadiusKm())
                .min(Comparator.comparingDouble(r -> GeoUtil.distanceKm(from, r.pickup())));
        if (nearest.isEmpty()) {
            log.info("No unassigned request within {} km of driver {} ({} pending checked)",
                    config.getNextRequestRadiusKm(), driverId, pending.size());
            return Optional.empty();
        }
        DeliveryRequestView request = nearest.get();
        log.info("Driver {} freed up, assigning nearest pending request {}", driverId, request.requestId());
        return Optional.of(assign(request.requestId(), request.pickup()));
    }

    public Optional<DeliveryRequestView> status(long requestId) {
        return withRetry(() -> storage.findRequest(requestId));
    }

    // --- helpers ---

    private AssignmentResult runAssignment(long requestId, GeoPoint location, Set<Long> excluded, Attempt attempt) {
        if (featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)) {
            log.warn("Dispatch kill switch active, request {} not assigned", requestId);
            return AssignmentResult.unmatched(requestId, UnmatchedReason.DISPATCH_DISABLED, 0);
        }

        Set<Long> tried = new HashSet<>(excluded);
        int maxAttempts = properties.getAssignment().getMaxClaimAttempts();

        for (attempt.number = 1; attempt.number <= maxAttempts; attempt.number++) {
            List<DriverCandidate> candidates = withRetry(storage::fetchEligibleDrivers);
            attempt.candidatesConsidered = candidates.size();

            Optional<ScoredCandidate> best = scorer.rank(candidates, location).stream()
                    .filter(c -> !tried.contains(c.driverId()))
                    .findFirst();
            if (best.isEmpty()) {
                UnmatchedReason reason = attempt.number == 1 ? UnmatchedReason.NO_CANDIDATES : UnmatchedReason.CLAIM_CONFLICT;
                log.info("No eligible driver for request {} among {} candidates (attempt {}/{})",
                        requestId, candidates.size(), attempt.number, maxAttempts);
                return AssignmentResult.unmatched(requestId, reason, attempt.number);
            }

            ScoredCandidate winner = best.get();
            ClaimOutcome outcome = withRetry(() -> storage.conditionalClaim(requestId, winner.driverId()));
            switch (outcome) {
                case CLAIMED -> {
                    return onClaimed(requestId, winner, attempt.number);
                }
                case DRIVER_UNAVAILABLE -> {
                    metrics.recordClaimConflict();
                    tried.add(winner.driverId());
                    log.info("Driver {} was taken concurrently, retrying request {} (attempt {}/{})",
                            winner.driverId(), requestId, attempt.number, maxAttempts);
                }
                case REQUEST_ALREADY_CLAIMED -> {
                    metrics.recordClaimConflict();
                    log.info("Request {} already claimed by another assignment", requestId);
                    return AssignmentResult.unmatched(requestId, UnmatchedReason.ALREADY_ASSIGNED, attempt.number);
                }
                case REQUEST_NOT_FOUND -> {
                    return AssignmentResult.unmatched(requestId, UnmatchedReason.REQUEST_NOT_FOUND, attempt.number);
                }
            }
        }

        log.warn("Gave up on request {} after {} claim conflicts", requestId, maxAttempts);
        attempt.number = maxAttempts;
        return AssignmentResult.unmatched(requestId, UnmatchedReason.CLAIM_CONFLICT, maxAttempts);
    }

    private AssignmentResult onClaimed(long requestId, ScoredCandidate winner, int attempt) {
        Instant now = clock.instant();
        Instant eta = GeoUtil.estimatedArrival(winner.distanceKm(), now);
        DeliveryRequestView request = lookupAfterClaim(requestId);
        Long requesterId = request != null ? request.requesterId() : null;

        AssignmentResult result = AssignmentResult.assigned(requestId, requesterId, winner, eta, attempt);
        log.info("Request {} assigned to driver {} (score {}, {} km, attempt {})",
                requestId, winner.driverId(), winner.score(), String.format("%.2f", winner.distanceKm()), attempt);

        try {
            notifyAssignment(result, request);
        } catch (RuntimeException e) {
            log.warn("Notifications for assigned request {} incomplete: {}", requestId, e.getMessage());
        }

        publish(KafkaTopics.DELIVERY_ASSIGNED, requestId, DeliveryAssignedEvent.builder()
                .requestId(requestId)
                .requesterId(requesterId)
                .driverId(winner.driverId())
                .score(winner.score())
                .distanceKm(winner.distanceKm())
                .attempt(attempt)
                .estimatedArrival(eta)
                .assignedAt(now)
                .build());
        return result;
    }

    private void notifyAssignment(AssignmentResult result, DeliveryRequestView request) {
        long requestId = result.getRequestId();
        String eta = result.getEstimatedArrival().toString();

        OutboundEvent.Builder toDriver = OutboundEvent.builder(EventTypes.ASSIGNMENT_RESULT)
                .put("requestId", requestId)
                .put("driverId", result.getDriverId())
                .put("role", UserRole.DRIVER.name())
                .put("score", result.getScore())
                .put("distanceKm", result.getDistanceKm())
                .put("estimatedArrival", eta);
        if (request != null) {
            toDriver.put("pickup", coordinates(request.pickup()))
                    .put("dropoff", coordinates(request.dropoff()));
        }
        notificationRouter.toUser(result.getDriverId(), toDriver.build());

        if (result.getRequesterId() != null) {
            notificationRouter.toUser(result.getRequesterId(), OutboundEvent.builder(EventTypes.ASSIGNMENT_RESULT)
                    .put("requestId", requestId)
                    .put("driverId", result.getDriverId())
                    .put("distanceKm", result.getDistanceKm())
                    .put("estimatedArrival", eta)
                    .build());
        }

        notificationRouter.toRole(UserRole.ADMIN, OutboundEvent.builder(EventTypes.ASSIGNMENT_RESULT)
                .put("requestId", requestId)
                .put("driverId", result.getDriverId())
                .putIfPresent("requesterId", result.getRequesterId())
                .put("score", result.getScore())
                .put("distanceKm", result.getDistanceKm())
                .put("attempts", result.getAttempts())
                .build());
    }

    private void onUnmatched(AssignmentResult result, int candidatesConsidered) {
        if (result.isDegraded()) {
            try {
                notificationRouter.toRole(UserRole.ADMIN, OutboundEvent.builder(EventTypes.ASSIGNMENT_RESULT)
                        .put("requestId", result.getRequestId())
                        .put("reason", result.getReason().name())
                        .put("degraded", true)
                        .build());
            } catch (RuntimeException e) {
                log.warn("Could not alert admins about degraded request {}: {}", result.getRequestId(), e.getMessage());
            }
        }
        publish(KafkaTopics.DELIVERY_UNMATCHED, result.getRequestId(), DeliveryUnmatchedEvent.builder()
                .requestId(result.getRequestId())
                .reason(result.getReason().name())
                .degraded(result.isDegraded())
                .candidatesConsidered(candidatesConsidered)
                .occurredAt(clock.instant())
                .build());
    }

    private boolean releaseHeldClaim(long requestId, long driverId, String reason, Supplier<Boolean> releaseCall) {
        boolean released = withRetry(releaseCall);
        if (!released) {
            log.info("Driver {} holds no claim on request {}, nothing to release", driverId, requestId);
            return false;
        }
        withRetry(() -> {
            storage.setDriverAvailability(driverId, true);
            return null;
        });
        publishClaimChanged(requestId, driverId, ClaimStatus.UNASSIGNED, reason);
        notifyRequester(requestId, driverId, ClaimStatus.UNASSIGNED, reason);
        return true;
    }

    private void notifyRequester(long requestId, long driverId, ClaimStatus status, String reason) {
        DeliveryRequestView request = lookupAfterClaim(requestId);
        if (request == null) {
            return;
        }
        notificationRouter.toUser(request.requesterId(), OutboundEvent.builder(EventTypes.ASSIGNMENT_UPDATE)
                .put("requestId", requestId)
                .put("driverId", driverId)
                .put("status", status.name())
                .putIfPresent("reason", reason)
                .build());
    }

    /**
     * Post-claim reads are best effort: the claim already happened and must not be reported
     * as a failure because a follow-up lookup did.
     */
    private DeliveryRequestView lookupAfterClaim(long requestId) {
        try {
            return withRetry(() -> storage.findRequest(requestId)).orElse(null);
        } catch (TransientStorageException e) {
            log.warn("Could not load request {} after claim change: {}", requestId, e.getMessage());
            return null;
        }
    }

    private void publishClaimChanged(long requestId, long driverId, ClaimStatus status, String reason) {
        publish(KafkaTopics.DELIVERY_CLAIM_CHANGED, requestId, DeliveryClaimChangedEvent.builder()
                .requestId(requestId)
                .driverId(driverId)
                .status(status)
                .reason(reason)
                .changedAt(clock.instant())
                .build());
    }

    private void publish(String topic, long requestId, Object event) {
        try {
            kafkaTemplate.send(topic, String.valueOf(requestId), event);
        } catch (RuntimeException e) {
            log.warn("Could not publish {} for request {}: {}", topic, requestId, e.getMessage());
        }
    }

    private <T> T withRetry(Supplier<T> call) {
        return storageRetry.executeSupplier(call);
    }

    private static Map<String, Double> coordinates(GeoPoint point) {
        return Map.of("lat", point.latitude(), "lon", point.longitude());
    }

    private static final class Attempt {
        int number;
        int candidatesConsidered;
    }
}
