package com.deliverydispatch.shared.enums;

/**
 * Lifecycle of a delivery request with respect to driver assignment.
 * UNASSIGNED → CLAIMED → ACCEPTED → (FULFILLED | CANCELLED), and CLAIMED → UNASSIGNED on
 * decline or release.
 */
public enum ClaimStatus {
    UNASSIGNED,
    CLAIMED,
    ACCEPTED,
    FULFILLED,
    CANCELLED
}
