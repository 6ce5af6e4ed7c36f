package com.edgegate.backend.exception;

public class EdgeGateException extends RuntimeException {
    public EdgeGateException(String message) {
        super(message);
    }

    public EdgeGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
