package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.shared.enums.UserRole;

public record AuthenticatedUser(long userId, UserRole role) {
}
