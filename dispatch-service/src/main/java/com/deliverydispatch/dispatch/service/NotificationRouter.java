package com.deliverydispatch.dispatch.service;

import com.deliverydispatch.dispatch.cache.ClusterRelay;
import com.deliverydispatch.dispatch.cache.DeliveryRelayMessage;
import com.deliverydispatch.dispatch.config.DispatchProperties;
import com.deliverydispatch.dispatch.connection.ConnectionRegistry;
import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.dispatch.presence.PresenceStore;
import com.deliverydispatch.dispatch.queue.OfflineMessageQueue;
import com.deliverydispatch.shared.enums.UserRole;
import com.deliverydispatch.shared.featureflag.FeatureFlagService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Set;

/**
 * Delivers an event to a user through exactly one path: the user's local sockets, a peer
 * instance holding their socket, or the offline queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationRouter {

    public enum Route { PUSHED, RELAYED, QUEUED, DROPPED }

    private final ConnectionRegistry connectionRegistry;
    private final PresenceStore presenceStore;
    private final ClusterRelay clusterRelay;
    private final OfflineMessageQueue offlineMessageQueue;
    private final FeatureFlagService featureFlagService;
    private final DispatchProperties properties;

    public Route toUser(long userId, OutboundEvent event) {
        Set<String> local = connectionRegistry.connectionsFor(userId);
        if (!local.isEmpty() && pushLocal(local, event) > 0) {
            return Route.PUSHED;
        }
        if (presenceStore.isOnlineElsewhere(userId, properties.getInstanceId())) {
            clusterRelay.relayToUser(userId, event);
            return Route.RELAYED;
        }
        if (!featureFlagService.isEnabled(FeatureFlagService.OFFLINE_QUEUE_ENABLED, true)) {
            log.debug("Offline queue disabled, dropping {} for user {}", event.type(), userId);
            return Route.DROPPED;
        }
        offlineMessageQueue.enqueue(userId, event);
        return Route.QUEUED;
    }

    /**
     * Best-effort broadcast to every connection of a role, on this and peer instances.
     * Nothing is queued for roles.
     */
    public int toRole(UserRole role, OutboundEvent event) {
        int delivered = pushLocal(connectionRegistry.connectionsForRole(role), event);
        clusterRelay.relayToRole(role, event);
        return delivered;
    }

    /**
     * Pushes to each listed connection; one failing recipient never stops the rest.
     */
    public int pushLocal(Collection<String> connectionIds, OutboundEvent event) {
        int delivered = 0;
        for (String connectionId : connectionIds) {
            try {
                if (connectionRegistry.get(connectionId).map(c -> c.send(event)).orElse(false)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.warn("Push of {} to connection {} failed: {}", event.type(), connectionId, e.getMessage());
            }
        }
        return delivered;
    }

    /**
     * Handles a delivery a peer instance relayed here. Only local sockets are used; a user who
     * disconnected in the meantime simply misses it.
     */
    public void deliverRelayed(DeliveryRelayMessage message) {
        if (message.userId() != null) {
            pushLocal(connectionRegistry.connectionsFor(message.userId()), message.event());
        } else if (message.role() != null) {
            pushLocal(connectionRegistry.connectionsForRole(message.role()), message.event());
        }
    }
}
