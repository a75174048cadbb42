package com.deliverydispatch.dispatch.presence;

import com.deliverydispatch.shared.enums.UserRole;

/**
 * What a reconnect token resolves to.
 */
public record ReconnectGrant(long userId, UserRole role) {
}
