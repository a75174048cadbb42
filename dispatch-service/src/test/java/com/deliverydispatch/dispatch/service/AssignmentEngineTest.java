package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.config.ResilienceConfig;
import com.deliverydispatch.dispatch.exception.TransientStorageException;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.AssignmentOutcome;
import com.deliverydispatch.dispatch.model.AssignmentResult;
import com.deliverydispatch.dispatch.model.DeliveryRequestView;
import com.deliverydispatch.dispatch.model.DriverCandidate;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.model.OutboundEvent;
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
import com.deliverydispatch.shared.util.KafkaTopics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.assertj.core.data.Offset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssignmentEngineTest {

    private static final double KM_PER_DEGREE = 6371.0 * Math.PI / 180.0;
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final GeoPoint PICKUP = GeoPoint.of(6.5244, 3.3792);
    private static final GeoPoint DROPOFF = GeoPoint.of(6.6018, 3.3515);
    private static final long REQUEST_ID = 100L;
    private static final long REQUESTER_ID = 7L;

    @Mock private DispatchStorage storage;
    @Mock private NotificationRouter notificationRouter;
    @Mock private KafkaTemplate<String, Object> kafkaTemplate;
    @Mock private FeatureFlagService featureFlagService;

    private SimpleMeterRegistry meterRegistry;
    private AssignmentEngine engine;

    @BeforeEach
    void setUp() {
        DispatchProperties properties = new DispatchProperties();
        properties.getAssignment().setStorageRetryBackoff(Duration.ofMillis(1));
        meterRegistry = new SimpleMeterRegistry();

        engine = new AssignmentEngine(
                storage,
                new DriverScorer(properties),
                notificationRouter,
                kafkaTemplate,
                featureFlagService,
                new DispatchMetrics(meterRegistry),
                new ResilienceConfig().storageRetry(properties),
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Empty candidate set yields no-eligible-driver without mutating storage")
    void noCandidatesNoMutation() {
        when(storage.fetchEligibleDrivers()).thenReturn(List.of());

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.getOutcome()).isEqualTo(AssignmentOutcome.NO_ELIGIBLE_DRIVER);
        assertThat(result.getReason()).isEqualTo(UnmatchedReason.NO_CANDIDATES);
        assertThat(result.isDegraded()).isFalse();
        verify(storage).fetchEligibleDrivers();
        verifyNoMoreInteractions(storage);
        verify(kafkaTemplate).send(eq(KafkaTopics.DELIVERY_UNMATCHED), eq("100"), isA(DeliveryUnmatchedEvent.class));
    }

    @Test
    @DisplayName("Best driver is claimed and driver, requester and admins are notified")
    void assignsBestDriverAndNotifies() {
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(
                candidate(2L, 1.0, 3.0, 5), candidate(1L, 2.0, 4.8, 50)));
        when(storage.conditionalClaim(REQUEST_ID, 1L)).thenReturn(ClaimOutcome.CLAIMED);
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.CLAIMED, 1L)));

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.isAssigned()).isTrue();
        assertThat(result.getDriverId()).isEqualTo(1L);
        assertThat(result.getRequesterId()).isEqualTo(REQUESTER_ID);
        assertThat(result.getScore()).isEqualTo(86);
        assertThat(result.getAttempts()).isEqualTo(1);
        // 2 km: 4.8 min travel at 25 km/h plus a 4 min buffer
        assertThat(result.getEstimatedArrival()).isEqualTo(NOW.plusSeconds(528));

        ArgumentCaptor<OutboundEvent> toDriver = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(notificationRouter).toUser(eq(1L), toDriver.capture());
        assertThat(toDriver.getValue().type()).isEqualTo(EventTypes.ASSIGNMENT_RESULT);
        assertThat(toDriver.getValue().data())
                .containsEntry("requestId", REQUEST_ID)
                .containsEntry("role", "DRIVER")
                .containsEntry("score", 86)
                .containsKey("pickup");

        ArgumentCaptor<OutboundEvent> toRequester = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(notificationRouter).toUser(eq(REQUESTER_ID), toRequester.capture());
        assertThat(toRequester.getValue().data())
                .containsEntry("driverId", 1L)
                .containsEntry("estimatedArrival", NOW.plusSeconds(528).toString());

        verify(notificationRouter).toRole(eq(UserRole.ADMIN), any(OutboundEvent.class));
        verify(kafkaTemplate).send(eq(KafkaTopics.DELIVERY_ASSIGNED), eq("100"), isA(DeliveryAssignedEvent.class));
        assertThat(meterRegistry.get("dispatch.assignments").tag("outcome", "assigned").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Driver taken concurrently is skipped and the next-best driver is claimed")
    void retriesWithNextDriverOnConflict() {
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(
                candidate(1L, 2.0, 4.8, 50), candidate(2L, 1.0, 3.0, 5)));
        when(storage.conditionalClaim(REQUEST_ID, 1L)).thenReturn(ClaimOutcome.DRIVER_UNAVAILABLE);
        when(storage.conditionalClaim(REQUEST_ID, 2L)).thenReturn(ClaimOutcome.CLAIMED);
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.empty());

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.getDriverId()).isEqualTo(2L);
        assertThat(result.getAttempts()).isEqualTo(2);
        verify(storage, times(2)).fetchEligibleDrivers();
        assertThat(meterRegistry.get("dispatch.claim_conflicts").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Conflicts on every attempt end as a claim conflict")
    void exhaustsClaimAttempts() {
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(
                candidate(1L, 2.0, 4.8, 50), candidate(2L, 1.0, 3.0, 5)));
        when(storage.conditionalClaim(eq(REQUEST_ID), anyLong())).thenReturn(ClaimOutcome.DRIVER_UNAVAILABLE);

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.getReason()).isEqualTo(UnmatchedReason.CLAIM_CONFLICT);
        assertThat(result.getAttempts()).isEqualTo(3);
        verify(storage, times(2)).conditionalClaim(eq(REQUEST_ID), anyLong());
        verify(notificationRouter, never()).toUser(anyLong(), any());
    }

    @Test
    @DisplayName("Request claimed by another assignment is reported as already assigned")
    void requestAlreadyClaimed() {
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(candidate(1L, 2.0, 4.8, 50)));
        when(storage.conditionalClaim(REQUEST_ID, 1L)).thenReturn(ClaimOutcome.REQUEST_ALREADY_CLAIMED);

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.getReason()).isEqualTo(UnmatchedReason.ALREADY_ASSIGNED);
        verify(storage).conditionalClaim(REQUEST_ID, 1L);
        verify(storage).fetchEligibleDrivers();
        verifyNoMoreInteractions(storage);
    }

    @Test
    @DisplayName("Transient storage failure is retried before succeeding")
    void transientFailureRetried() {
        when(storage.fetchEligibleDrivers())
                .thenThrow(new TransientStorageException("connection reset", null))
                .thenReturn(List.of(candidate(1L, 2.0, 4.8, 50)));
        when(storage.conditionalClaim(REQUEST_ID, 1L)).thenReturn(ClaimOutcome.CLAIMED);
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.CLAIMED, 1L)));

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.isAssigned()).isTrue();
        verify(storage, times(2)).fetchEligibleDrivers();
    }

    @Test
    @DisplayName("Storage that stays unavailable yields a degraded result and alerts admins")
    void persistentStorageFailureIsDegraded() {
        when(storage.fetchEligibleDrivers()).thenThrow(new TransientStorageException("timeout", null));

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.isAssigned()).isFalse();
        assertThat(result.getReason()).isEqualTo(UnmatchedReason.STORAGE_UNAVAILABLE);
        assertThat(result.isDegraded()).isTrue();
        verify(storage, times(3)).fetchEligibleDrivers();

        ArgumentCaptor<OutboundEvent> alert = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(notificationRouter).toRole(eq(UserRole.ADMIN), alert.capture());
        assertThat(alert.getValue().data()).containsEntry("degraded", true);
    }

    @Test
    @DisplayName("Kill switch stops assignment before storage is touched")
    void killSwitch() {
        when(featureFlagService.isEnabled(FeatureFlagService.DISPATCH_KILL_SWITCH, false)).thenReturn(true);

        AssignmentResult result = engine.assign(REQUEST_ID, PICKUP);

        assertThat(result.getReason()).isEqualTo(UnmatchedReason.DISPATCH_DISABLED);
        verifyNoInteractions(storage);
    }

    @Test
    @DisplayName("Accepting a held claim confirms it and tells the requester")
    void acceptHeldClaim() {
        when(storage.confirmClaim(REQUEST_ID, 1L)).thenReturn(true);
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.ACCEPTED, 1L)));

        assertThat(engine.accept(REQUEST_ID, 1L)).isTrue();

        ArgumentCaptor<OutboundEvent> update = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(notificationRouter).toUser(eq(REQUESTER_ID), update.capture());
        assertThat(update.getValue().type()).isEqualTo(EventTypes.ASSIGNMENT_UPDATE);
        assertThat(update.getValue().data()).containsEntry("status", "ACCEPTED");
        verify(kafkaTemplate).send(eq(KafkaTopics.DELIVERY_CLAIM_CHANGED), eq("100"), isA(DeliveryClaimChangedEvent.class));
    }

    @Test
    @DisplayName("Accepting a claim held by someone else changes nothing")
    void acceptWithoutClaim() {
        when(storage.confirmClaim(REQUEST_ID, 9L)).thenReturn(false);

        assertThat(engine.accept(REQUEST_ID, 9L)).isFalse();
        verifyNoInteractions(notificationRouter, kafkaTemplate);
    }

    @Test
    @DisplayName("Decline frees the driver and reassigns the request to someone else")
    void declineReassigns() {
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.CLAIMED, 1L)));
        when(storage.releaseClaim(REQUEST_ID, 1L)).thenReturn(true);
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(
                candidate(1L, 2.0, 4.8, 50), candidate(2L, 1.0, 3.0, 5)));
        when(storage.conditionalClaim(REQUEST_ID, 2L)).thenReturn(ClaimOutcome.CLAIMED);

        Optional<AssignmentResult> result = engine.decline(REQUEST_ID, 1L);

        assertThat(result).isPresent();
        assertThat(result.get().getDriverId()).isEqualTo(2L);
        verify(storage).setDriverAvailability(1L, true);
        verify(storage, never()).conditionalClaim(REQUEST_ID, 1L);
    }

    @Test
    @DisplayName("Decline without holding the claim is rejected and nothing is reassigned")
    void declineWithoutClaim() {
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.CLAIMED, 1L)));
        when(storage.releaseClaim(REQUEST_ID, 9L)).thenReturn(false);

        assertThat(engine.decline(REQUEST_ID, 9L)).isEmpty();
        verify(storage, never()).fetchEligibleDrivers();
        verify(storage, never()).setDriverAvailability(anyLong(), eq(true));
    }

    @Test
    @DisplayName("Releasing an accepted delivery frees the driver and tells the requester")
    void releaseAcceptedAssignment() {
        when(storage.releaseAssignment(REQUEST_ID, 1L)).thenReturn(true);
        when(storage.findRequest(REQUEST_ID)).thenReturn(Optional.of(request(ClaimStatus.UNASSIGNED, null)));

        assertThat(engine.release(REQUEST_ID, 1L)).isTrue();

        verify(storage).setDriverAvailability(1L, true);
        verify(storage, never()).releaseClaim(anyLong(), anyLong());
        ArgumentCaptor<OutboundEvent> update = ArgumentCaptor.forClass(OutboundEvent.class);
        verify(notificationRouter).toUser(eq(REQUESTER_ID), update.capture());
        assertThat(update.getValue().data())
                .containsEntry("status", "UNASSIGNED")
                .containsEntry("reason", "RELEASED");
    }

    @Test
    @DisplayName("A freed driver is assigned the nearest pending request within the next-request radius")
    void assignNextPicksNearestPending() {
        DriverCandidate freed = candidate(5L, 0.0, 4.5, 20);
        when(storage.findDriver(5L)).thenReturn(Optional.of(freed));
        when(storage.findRecentUnassigned(10)).thenReturn(List.of(
                pending(101L, 3.0), pending(102L, 1.0), pending(103L, 9.0)));
        when(storage.fetchEligibleDrivers()).thenReturn(List.of(freed));
        when(storage.conditionalClaim(102L, 5L)).thenReturn(ClaimOutcome.CLAIMED);
        when(storage.findRequest(102L)).thenReturn(Optional.of(new DeliveryRequestView(102L, REQUESTER_ID,
                north(1.0), DROPOFF, ClaimStatus.CLAIMED, 5L, NOW.minusSeconds(60), NOW)));

        Optional<AssignmentResult> result = engine.assignNextFor(5L);

        assertThat(result).isPresent();
        assertThat(result.get().getRequestId()).isEqualTo(102L);
        assertThat(result.get().getDriverId()).isEqualTo(5L);
        assertThat(result.get().getDistanceKm()).isCloseTo(1.0, Offset.offset(0.01));
        verify(storage, never()).conditionalClaim(eq(101L), anyLong());
    }

    @Test
    @DisplayName("No pending request within 8 km leaves the driver free and claims nothing")
    void assignNextNothingClose() {
        when(storage.findDriver(5L)).thenReturn(Optional.of(candidate(5L, 0.0, 4.5, 20)));
        when(storage.findRecentUnassigned(10)).thenReturn(List.of(pending(101L, 8.5), pending(102L, 12.0)));

        assertThat(engine.assignNextFor(5L)).isEmpty();

        verify(storage, never()).fetchEligibleDrivers();
        verify(storage, never()).conditionalClaim(anyLong(), anyLong());
        verifyNoInteractions(notificationRouter, kafkaTemplate);
    }

    @Test
    @DisplayName("An offline or unknown driver is not offered pending work")
    void assignNextSkipsOfflineDriver() {
        when(storage.findDriver(5L)).thenReturn(Optional.of(candidate(5L, 0.0, 4.5, 20).toBuilder().online(false).build()));
        when(storage.findDriver(6L)).thenReturn(Optional.empty());

        assertThat(engine.assignNextFor(5L)).isEmpty();
        assertThat(engine.assignNextFor(6L)).isEmpty();

        verify(storage, never()).findRecentUnassigned(anyInt());
    }

    private static GeoPoint north(double km) {
        return GeoPoint.of(PICKUP.latitude() + km / KM_PER_DEGREE, PICKUP.longitude());
    }

    private static DeliveryRequestView pending(long id, double kmNorth) {
        return new DeliveryRequestView(id, REQUESTER_ID, north(kmNorth), DROPOFF, ClaimStatus.UNASSIGNED, null,
                NOW.minusSeconds(id), null);
    }

    private static DriverCandidate candidate(long id, double kmNorth, double rating, int jobs) {
        return DriverCandidate.builder()
                .driverId(id)
                .location(GeoPoint.of(PICKUP.latitude() + kmNorth / KM_PER_DEGREE, PICKUP.longitude()))
                .rating(rating)
                .completedJobs(jobs)
                .online(true)
                .available(true)
                .verified(true)
                .build();
    }

    private static DeliveryRequestView request(ClaimStatus status, Long driverId) {
        return new DeliveryRequestView(REQUEST_ID, REQUESTER_ID, PICKUP, DROPOFF, status, driverId,
                NOW.minusSeconds(60), driverId != null ? NOW : null);
    }
}
