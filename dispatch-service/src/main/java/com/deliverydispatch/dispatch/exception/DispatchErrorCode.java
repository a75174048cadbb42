package com.deliverydispatch.dispatch.exception;

public enum DispatchErrorCode {
    AUTH_FAILED,
    AUTH_REQUIRED,
    DRIVER_ROLE_REQUIRED,
    INVALID_EVENT,
    UNKNOWN_EVENT,
    INVALID_LOCATION,
    REQUEST_NOT_FOUND,
    CLAIM_NOT_HELD,
    STORAGE_UNAVAILABLE,
    DEGRADED_CACHE,
    INTERNAL_ERROR
}
