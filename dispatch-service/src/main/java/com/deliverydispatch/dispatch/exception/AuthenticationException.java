package com.deliverydispatch.dispatch.exception;

/**
 * Credential rejected. The connection stays open and the client may try again.
 */
public class AuthenticationException extends DispatchException {

    private final boolean canRetry;

    public AuthenticationException(String message) {
        this(message, true);
    }

    public AuthenticationException(String message, boolean canRetry) {
        super(DispatchErrorCode.AUTH_FAILED, message);
        this.canRetry = canRetry;
    }

    public AuthenticationException(String message, Throwable cause) {
        super(DispatchErrorCode.AUTH_FAILED, message, cause);
        this.canRetry = true;
    }

    public boolean isCanRetry() {
        return canRetry;
    }
}
