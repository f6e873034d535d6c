package com.kolsignal.backend.model;

public enum SignalType {
    BUY,
    DISCOVERY,
    KOL_VALIDATION
}
