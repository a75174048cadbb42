package com.deliverydispatch.dispatch.model;

public enum UnmatchedReason {
    NO_CANDIDATES,
    CLAIM_CONFLICT,
    ALREADY_ASSIGNED,
    REQUEST_NOT_FOUND,
    STORAGE_UNAVAILABLE,
    DISPATCH_DISABLED
}
