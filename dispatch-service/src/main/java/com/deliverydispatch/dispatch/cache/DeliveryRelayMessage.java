package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.dispatch.model.OutboundEvent;
import com.deliverydispatch.shared.enums.UserRole;

/**
 * Targets either a single user or every connection of a role.
 */
public record DeliveryRelayMessage(String origin, Long userId, UserRole role, OutboundEvent event) {
}
