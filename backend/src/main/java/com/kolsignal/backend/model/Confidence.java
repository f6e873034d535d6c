package com.kolsignal.backend.model;

public enum Confidence {
    HIGH,
    MEDIUM,
    LOW;

    public Confidence atMost(Confidence cap) {
        return ordinal() < cap.ordinal() ? cap : this;
    }

    public Confidence upgrade() {
        return this == LOW ? MEDIUM : HIGH;
    }
}
