package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.connection.Connection;
import com.deliverydispatch.dispatch.connection.ConnectionChannel;
import com.deliverydispatch.dispatch.connection.ConnectionRegistry;
import com.deliverydispatch.dispatch.exception.AuthenticationException;
import com.deliverydispatch.dispatch.exception.DispatchErrorCode;
import com.deliverydispatch.dispatch.exception.DispatchException;
import com.deliverydispatch.dispatch.metrics.DispatchMetrics;
import com.deliverydispatch.dispatch.model.AssignmentResult;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.dispatch.presence.PresenceStore;
import com.deliverydispatch.dispatch.presence.ReconnectGrant;
import com.deliverydispatch.dispatch.queue.OfflineMessageQueue;
import com.deliverydispatch.dispatch.queue.QueuedMessage;
import com.deliverydispatch.dispatch.service.AssignmentEngine;
import com.deliverydispatch.dispatch.service.LocationService;
import com.deliverydispatch.shared.enums.ClaimStatus;
import com.deliverydispatch.shared.enums.UserRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Translates socket frames into dispatch calls and results back into frames.
 *
 * Every inbound frame is answered on the originating connection only; failures become
 * {@code error} (or {@code auth_error}) frames and never propagate to the transport.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DispatchGateway {

    private final ConnectionRegistry registry;
    private final TokenVerifier tokenVerifier;
    private final PresenceStore presenceStore;
    private final OfflineMessageQueue offlineMessageQueue;
    private final AssignmentEngine assignmentEngine;
    private final LocationService locationService;
    private final DispatchMetrics metrics;
    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Connection open(String connectionId, ConnectionChannel channel) {
        Connection connection = new Connection(connectionId, channel, clock.instant());
        registry.add(connection);
        connection.reply(OutboundEvent.builder(EventTypes.CONNECTED)
                .put("connectionId", connectionId)
                .put("serverTime", clock.instant().toString())
                .build());
        log.debug("Connection {} opened", connectionId);
        return connection;
    }

    public void handle(String connectionId, String payload) {
        Optional<Connection> found = registry.get(connectionId);
        if (found.isEmpty()) {
            log.debug("Frame for unknown connection {} ignored", connectionId);
            return;
        }
        Connection connection = found.get();
        registry.touch(connectionId);

        try {
            InboundFrame frame = InboundFrame.parse(objectMapper, payload);
            dispatch(connection, frame);
        } catch (AuthenticationException e) {
            metrics.recordAuthFailure();
            log.info("Authentication failed on connection {}: {}", connectionId, e.getMessage());
            connection.reply(OutboundEvent.builder(EventTypes.AUTH_ERROR)
                    .put("reason", e.getMessage())
                    .put("canRetry", e.isCanRetry())
                    .build());
        } catch (DispatchException e) {
            log.debug("Rejected frame on connection {}: {} {}", connectionId, e.getCode(), e.getMessage());
            connection.reply(error(e.getCode(), e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling frame on connection {}", connectionId, e);
            connection.reply(error(DispatchErrorCode.INTERNAL_ERROR.name(), "Internal error"));
        }
    }

    public void close(String connectionId) {
        registry.remove(connectionId);
    }

    // --- handlers ---

    private void dispatch(Connection connection, InboundFrame frame) {
        switch (frame.type()) {
            case EventTypes.AUTHENTICATE -> authenticate(connection, frame);
            case EventTypes.LOCATION_UPDATE -> locationUpdate(connection, frame);
            case EventTypes.ASSIGNMENT_REQUEST -> assignmentRequest(connection, frame);
            case EventTypes.ACCEPT -> accept(connection, frame);
            case EventTypes.DECLINE -> decline(connection, frame);
            case EventTypes.NEXT_REQUEST -> nextRequest(connection);
            case EventTypes.HEARTBEAT, EventTypes.PONG -> connection.reply(OutboundEvent.builder(EventTypes.HEARTBEAT_ACK)
                    .put("serverTime", clock.instant().toString())
                    .build());
            default -> throw new DispatchException(DispatchErrorCode.UNKNOWN_EVENT, "Unknown event type '" + frame.type() + "'");
        }
    }

    private void authenticate(Connection connection, InboundFrame frame) {
        String token = frame.optionalText("token");
        String reconnectToken = frame.optionalText("reconnectToken");

        AuthenticatedUser user;
        boolean resumed = false;
        if (token != null) {
            user = tokenVerifier.verify(token);
        } else if (reconnectToken != null) {
            user = presenceStore.findReconnectGrant(reconnectToken)
                    .map(grant -> new AuthenticatedUser(grant.userId(), grant.role()))
                    .orElseThrow(() -> new AuthenticationException("Reconnect token expired or unknown", false));
            resumed = true;
        } else {
            throw new AuthenticationException("Provide a token or a reconnectToken");
        }

        connection.holdLiveTraffic();
        try {
            try {
                registry.bindUser(connection.getConnectionId(), user.userId(), user.role());
            } catch (IllegalStateException e) {
                throw new AuthenticationException("Connection is already authenticated as another user", false);
            }

            List<QueuedMessage> queued = offlineMessageQueue.drainAndClear(user.userId());

            String issued = UUID.randomUUID().toString();
            presenceStore.storeReconnectGrant(issued, new ReconnectGrant(user.userId(), user.role()),
                    properties.getSocket().getReconnectTokenTtl());
            connection.recordReconnectToken(issued, resumed);

            connection.reply(OutboundEvent.builder(EventTypes.AUTHENTICATED)
                    .put("userId", user.userId())
                    .put("role", user.role().name())
                    .put("queuedCount", queued.size())
                    .put("reconnectToken", issued)
                    .put("resumed", resumed)
                    .build());
            if (!queued.isEmpty()) {
                connection.reply(OutboundEvent.builder(EventTypes.QUEUED_MESSAGE_FLUSH)
                        .put("events", queued.stream().map(DispatchGateway::flushEntry).toList())
                        .build());
            }
            log.info("Connection {} authenticated as user {} ({}), {} queued message(s) flushed{}",
                    connection.getConnectionId(), user.userId(), user.role(), queued.size(), resumed ? ", resumed" : "");
        } finally {
            connection.releaseLiveTraffic();
        }
    }

    private void locationUpdate(Connection connection, InboundFrame frame) {
        long driverId = requireRole(connection, UserRole.DRIVER);
        locationService.updateLocation(driverId, frame.requireLocation(),
                frame.optionalDouble("heading"), frame.optionalDouble("speed"));
    }

    private void assignmentRequest(Connection connection, InboundFrame frame) {
        long userId = requireAuthenticated(connection);
        long requestId = frame.requireLong("requestId");
        AssignmentResult result = assignmentEngine.assign(requestId, frame.requireLocation());

        // requester and driver already receive the result through the notification router
        boolean alreadyNotified = result.isAssigned()
                && (Long.valueOf(userId).equals(result.getRequesterId()) || Long.valueOf(userId).equals(result.getDriverId()));
        if (!alreadyNotified) {
            connection.reply(resultEvent(result));
        }
    }

    private void accept(Connection connection, InboundFrame frame) {
        long driverId = requireRole(connection, UserRole.DRIVER);
        long requestId = frame.requireLong("requestId");
        if (!assignmentEngine.accept(requestId, driverId)) {
            throw new DispatchException(DispatchErrorCode.CLAIM_NOT_HELD, "No claim held on request " + requestId);
        }
        connection.reply(claimUpdate(requestId, driverId, ClaimStatus.ACCEPTED));
    }

    private void decline(Connection connection, InboundFrame frame) {
        long driverId = requireRole(connection, UserRole.DRIVER);
        long requestId = frame.requireLong("requestId");
        if (assignmentEngine.decline(requestId, driverId).isEmpty()) {
            throw new DispatchException(DispatchErrorCode.CLAIM_NOT_HELD, "No claim held on request " + requestId);
        }
        connection.reply(claimUpdate(requestId, driverId, ClaimStatus.UNASSIGNED));
    }

    private void nextRequest(Connection connection) {
        long driverId = requireRole(connection, UserRole.DRIVER);
        Optional<AssignmentResult> result = assignmentEngine.assignNextFor(driverId);
        if (result.isEmpty()) {
            connection.reply(OutboundEvent.builder(EventTypes.NO_PENDING_REQUEST)
                    .put("driverId", driverId)
                    .build());
            return;
        }
        // a claim for this driver already reached them through the notification router
        if (!(result.get().isAssigned() && Long.valueOf(driverId).equals(result.get().getDriverId()))) {
            connection.reply(resultEvent(result.get()));
        }
    }

    // --- helpers ---

    private static long requireAuthenticated(Connection connection) {
        Long userId = connection.getUserId();
        if (userId == null) {
            throw new DispatchException(DispatchErrorCode.AUTH_REQUIRED, "Authenticate first");
        }
        return userId;
    }

    private static long requireRole(Connection connection, UserRole role) {
        long userId = requireAuthenticated(connection);
        if (connection.getRole() != role) {
            throw new DispatchException(DispatchErrorCode.DRIVER_ROLE_REQUIRED, "Only drivers may send this event");
        }
        return userId;
    }

    static OutboundEvent resultEvent(AssignmentResult result) {
        return OutboundEvent.builder(EventTypes.ASSIGNMENT_RESULT)
                .put("requestId", result.getRequestId())
                .putIfPresent("driverId", result.getDriverId())
                .putIfPresent("score", result.getScore())
                .putIfPresent("distanceKm", result.getDistanceKm())
                .putIfPresent("estimatedArrival", result.getEstimatedArrival() != null ? result.getEstimatedArrival().toString() : null)
                .putIfPresent("reason", result.getReason() != null ? result.getReason().name() : null)
                .putIfPresent("degraded", result.isDegraded() ? Boolean.TRUE : null)
                .build();
    }

    private static OutboundEvent claimUpdate(long requestId, long driverId, ClaimStatus status) {
        return OutboundEvent.builder(EventTypes.ASSIGNMENT_UPDATE)
                .put("requestId", requestId)
                .put("driverId", driverId)
                .put("status", status.name())
                .build();
    }

    private static OutboundEvent error(String code, String message) {
        return OutboundEvent.builder(EventTypes.ERROR)
                .put("code", code)
                .put("message", message)
                .build();
    }

    private static Map<String, Object> flushEntry(QueuedMessage message) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("messageId", message.messageId());
        entry.put("type", message.type());
        entry.put("data", message.payload());
        entry.put("queuedAt", message.enqueuedAt().toString());
        return entry;
    }
}
