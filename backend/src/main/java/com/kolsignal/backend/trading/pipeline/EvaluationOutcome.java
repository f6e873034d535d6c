package com.kolsignal.backend.trading.pipeline;

public enum EvaluationOutcome {
    SKIPPED_OPEN_POSITION,
    QUICK_SCREEN_FAILED,
    NO_METRICS,
    SCREENING_FAILED,
    SCAM_REJECTED,
    BELOW_THRESHOLD,
    BUY_SENT,
    DISCOVERY_SENT,
    KOL_VALIDATION_SENT,
    PUBLISH_FAILED,
    ERROR;

    public boolean signalSent() {
        return this == BUY_SENT || this == DISCOVERY_SENT || this == KOL_VALIDATION_SENT;
    }
}
