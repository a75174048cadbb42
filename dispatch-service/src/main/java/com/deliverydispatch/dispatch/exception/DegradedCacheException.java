package com.deliverydispatch.dispatch.exception;

/**
 * The shared cache could not serve an operation and in-process state was used instead.
 * Raised and handled inside the cache adapters; never reaches clients.
 */
public class DegradedCacheException extends DispatchException {

    private final String operation;

    public DegradedCacheException(String operation, Throwable cause) {
        super(DispatchErrorCode.DEGRADED_CACHE,
                "Shared cache unavailable during " + operation + ": " + cause.getMessage(), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
