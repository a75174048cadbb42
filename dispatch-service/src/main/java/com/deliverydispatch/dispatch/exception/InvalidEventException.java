package com.deliverydispatch.dispatch.exception;

/**
 * Malformed inbound frame, unknown event type or out-of-range payload value.
 */
public class InvalidEventException extends DispatchException {

    public InvalidEventException(DispatchErrorCode code, String message) {
        super(code, message);
    }

    public InvalidEventException(String message) {
        super(DispatchErrorCode.INVALID_EVENT, message);
    }
}
