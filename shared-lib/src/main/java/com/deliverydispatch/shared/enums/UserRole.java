package com.deliverydispatch.shared.enums;

import java.util.Locale;

public enum UserRole {
    CONSUMER,
    DRIVER,
    MERCHANT,
    ADMIN;

    /**
     * Lenient parse for token claims ("driver", "Driver" and "DRIVER" are all accepted).
     */
    public static UserRole fromClaim(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Role claim is missing");
        }
        return UserRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
