package com.kolsignal.backend.model;

public enum ScoringProfile {
    KOL_VALIDATED,
    DISCOVERY
}
