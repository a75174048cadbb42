package com.deliverydispatch.dispatch.cache;

import com.deliverydispatch.shared.enums.PresenceStatus;
import com.deliverydispatch.shared.enums.UserRole;

public record PresenceRelayMessage(String origin, long userId, UserRole role, PresenceStatus status) {
}
