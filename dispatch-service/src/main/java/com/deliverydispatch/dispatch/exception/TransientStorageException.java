package com.deliverydispatch.dispatch.exception;

/**
 * A storage call failed in a way that may succeed if repeated (timeouts, lost connections,
 * lock contention).
 */
public class TransientStorageException extends DispatchException {

    public TransientStorageException(String message, Throwable cause) {
        super(DispatchErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
