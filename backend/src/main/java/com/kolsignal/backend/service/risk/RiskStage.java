package com.kolsignal.backend.service.risk;

/**
 * One step of the risk cascade. Stages run in ascending {@link #order()}; a REJECT
 * verdict stops the cascade before later stages are evaluated or recorded.
 */
public interface RiskStage {

    String name();

    int order();

    StageVerdict evaluate(RiskFilterInput input);

    /**
     * Copies the analysis this stage inspected into the filter output.
     */
    default void record(RiskFilterInput input, FilterOutputDraft draft) {
    }
}
