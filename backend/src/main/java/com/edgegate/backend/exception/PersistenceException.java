package com.edgegate.backend.exception;

public class PersistenceException extends EdgeGateException {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
