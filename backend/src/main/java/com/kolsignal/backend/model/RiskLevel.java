package com.kolsignal.backend.model;

public enum RiskLevel {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    public RiskLevel atLeast(RiskLevel floor) {
        return ordinal() < floor.ordinal() ? floor : this;
    }
}
