package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.shared.enums.PresenceStatus;
import com.deliverydispatch.shared.enums.UserRole;

/**
 * Fan-out to peer dispatch instances for users whose sockets live elsewhere.
 */
public interface ClusterRelay {

    void publishPresence(long userId, UserRole role, PresenceStatus status);

    void relayToUser(long userId, OutboundEvent event);

    void relayToRole(UserRole role, OutboundEvent event);
}
