package com.deliverydispatch.dispatch.presence;

import com.deliverydispatch.dispatch.cache.ClusterRelay;
import com.deliverydispatch.dispatch.cache.PresenceRelayMessage;
import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.connection.Connection;
import com.deliverydispatch.dispatch.connection.ConnectionAddedEvent;
import com.deliverydispatch.dispatch.connection.ConnectionRegistry;
import com.deliverydispatch.dispatch.connection.ConnectionRemovedEvent;
import com.deliverydispatch.dispatch.model.EventTypes;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.dispatch.service.NotificationRouter;
import com.deliverydispatch.shared.enums.PresenceStatus;
import com.deliverydispatch.shared.enums.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.IntStream;

/**
 * Emits {@code presence_update} when a user's aggregate presence flips.
 *
 * Going online is announced immediately. Going offline is re-checked after the grace window,
 * so a quick reconnect produces no events at all. The last emitted status is kept while a user
 * is online so that repeated evaluations never announce the same state twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PresenceBroadcaster {

    private static final int LOCK_STRIPES = 64;

    private final ConnectionRegistry connectionRegistry;
    private final PresenceStore presenceStore;
    private final PresenceSharingPolicy sharingPolicy;
    private final NotificationRouter notificationRouter;
    private final ClusterRelay clusterRelay;
    private final TaskScheduler taskScheduler;
    private final DispatchProperties properties;
    private final Clock clock;

    private final Map<Long, PresenceStatus> lastEmitted = new ConcurrentHashMap<>();
    private final Map<Long, UserRole> lastKnownRoles = new ConcurrentHashMap<>();
    private final Object[] userLocks = IntStream.range(0, LOCK_STRIPES).mapToObj(i -> new Object()).toArray();

    @EventListener
    public void onConnectionAdded(ConnectionAddedEvent event) {
        Connection connection = event.connection();
        long userId = connection.getUserId();
        synchronized (lockFor(userId)) {
            lastKnownRoles.put(userId, connection.getRole());
            presenceStore.markOnline(userId, properties.getInstanceId());
            evaluate(userId);
        }
    }

    @EventListener
    public void onConnectionRemoved(ConnectionRemovedEvent event) {
        long userId = event.connection().getUserId();
        if (connectionRegistry.isOnline(userId)) {
            return;
        }
        taskScheduler.schedule(() -> evaluate(userId),
                clock.instant().plus(properties.getPresence().getGraceWindow()));
    }

    /**
     * Recomputes the user's presence and emits only if it differs from the last emission.
     * Evaluations of one user are serialized; state for a user is dropped once they are announced offline.
     */
    public void evaluate(long userId) {
        synchronized (lockFor(userId)) {
            boolean localOnline = connectionRegistry.isOnline(userId);
            if (!localOnline) {
                presenceStore.markOffline(userId, properties.getInstanceId());
                // a socket registered while the marker was being cleared keeps the user online
                if (connectionRegistry.isOnline(userId)) {
                    presenceStore.markOnline(userId, properties.getInstanceId());
                    localOnline = true;
                }
            }
            boolean online = localOnline || presenceStore.isOnlineElsewhere(userId, properties.getInstanceId());
            PresenceStatus status = PresenceStatus.of(online);

            PresenceStatus previous = online ? lastEmitted.put(userId, status) : lastEmitted.remove(userId);
            if (previous == null) {
                previous = PresenceStatus.OFFLINE;
            }
            UserRole role = online ? lastKnownRoles.get(userId) : lastKnownRoles.remove(userId);
            if (previous == status) {
                return;
            }

            int delivered = emit(userId, role, status);
            clusterRelay.publishPresence(userId, role, status);
            log.info("User {} is now {} ({} local recipients)", userId, status.wireName(), delivered);
        }
    }

    /**
     * Re-emits a transition announced by a peer instance to this instance's audience.
     */
    public void onRemoteTransition(PresenceRelayMessage message) {
        emit(message.userId(), message.role(), message.status());
    }

    /**
     * Keeps this instance's markers alive while its users stay connected.
     */
    @Scheduled(fixedDelayString = "${dispatch.presence.marker-refresh-ms:60000}")
    public void refreshMarkers() {
        for (Long userId : connectionRegistry.onlineUsers()) {
            presenceStore.markOnline(userId, properties.getInstanceId());
        }
    }

    @Scheduled(fixedDelayString = "${dispatch.queue.purge-interval-ms:3600000}")
    public void evictExpiredGrants() {
        int evicted = presenceStore.evictExpiredGrants();
        if (evicted > 0) {
            log.info("Evicted {} expired reconnect grants", evicted);
        }
    }

    public PresenceStatus lastEmitted(long userId) {
        return lastEmitted.getOrDefault(userId, PresenceStatus.OFFLINE);
    }

    int trackedUserCount() {
        Set<Long> users = new HashSet<>(lastEmitted.keySet());
        users.addAll(lastKnownRoles.keySet());
        return users.size();
    }

    // --- helpers ---

    private Object lockFor(long userId) {
        return userLocks[Math.floorMod(userId, LOCK_STRIPES)];
    }

    private int emit(long userId, UserRole role, PresenceStatus status) {
        OutboundEvent update = OutboundEvent.builder(EventTypes.PRESENCE_UPDATE)
                .put("userId", userId)
                .put("status", status.wireName())
                .putIfPresent("role", role != null ? role.name() : null)
                .put("timestamp", clock.instant().toString())
                .build();

        Set<String> audience = new LinkedHashSet<>(connectionRegistry.connectionsFor(userId));
        audience.addAll(connectionRegistry.connectionsForRole(UserRole.ADMIN));
        if (sharingPolicy.sharesPublicly(role)) {
            connectionRegistry.authenticatedConnections().forEach(c -> audience.add(c.getConnectionId()));
        }
        return notificationRouter.pushLocal(audience, update);
    }
}
