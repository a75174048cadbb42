package com.deliverydispatch.dispatch.exception;

public class DispatchException extends RuntimeException {

    private final String code;

    public DispatchException(String code, String message) {
        super(message);
        this.code = code;
    }

    public DispatchException(DispatchErrorCode code, String message) {
        this(code.name(), message);
    }

    public DispatchException(DispatchErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code.name();
    }

    public String getCode() {
        return code;
    }
}
