package com.edgegate.backend.exception;

public class InvalidKeyException extends EdgeGateException {
    public InvalidKeyException(String message) {
        super(message);
    }
}
