package com.edgegate.backend.exception;

public class NotFoundException extends EdgeGateException {
    public NotFoundException(String message) {
        super(message);
    }
}
