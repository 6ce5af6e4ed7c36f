package com.edgegate.backend.exception;

public class SimulationException extends EdgeGateException {
    public SimulationException(String message) {
        super(message);
    }
}
