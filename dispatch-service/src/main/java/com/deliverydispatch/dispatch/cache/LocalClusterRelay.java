package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.shared.enums.PresenceStatus;
import com.deliverydispatch.shared.enums.UserRole;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-process deployments have no peers; relayed traffic is discarded.
 */
@Slf4j
public class LocalClusterRelay implements ClusterRelay {

    @Override
    public void publishPresence(long userId, UserRole role, PresenceStatus status) {
        log.trace("No peers to notify of user {} going {}", userId, status);
    }

    @Override
    public void relayToUser(long userId, OutboundEvent event) {
        log.trace("No peers to relay {} for user {}", event.type(), userId);
    }

    @Override
    public void relayToRole(UserRole role, OutboundEvent event) {
        log.trace("No peers to relay {} for role {}", event.type(), role);
    }
}
