package com.edgegate.backend.model;

public enum Direction {
    LONG,
    SHORT;

    /** +1 for long, -1 for short. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
