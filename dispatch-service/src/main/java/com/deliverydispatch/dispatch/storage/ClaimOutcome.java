package com.deliverydispatch.dispatch.storage;

public enum ClaimOutcome {
    /** Driver reserved and attached to the request. */
    CLAIMED,
    /** The driver was taken by another request first; the request is untouched. */
    DRIVER_UNAVAILABLE,
    /** Another driver is already attached; nothing changed. */
    REQUEST_ALREADY_CLAIMED,
    REQUEST_NOT_FOUND
}
