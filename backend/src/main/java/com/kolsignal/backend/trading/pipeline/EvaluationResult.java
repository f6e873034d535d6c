package com.kolsignal.backend.trading.pipeline;

import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.model.TradeSignal;

import java.util.List;

/**
 * Outcome of evaluating one token. {@code filterOutput}, {@code score} and
 * {@code signal} are null when the pipeline stopped before producing them. For
 * {@link EvaluationOutcome#PUBLISH_FAILED} the signal is kept so it can be re-sent.
 */
public record EvaluationResult(
        String tokenAddress,
        EvaluationOutcome outcome,
        List<String> reasons,
        ScamFilterOutput filterOutput,
        TokenScore score,
        TradeSignal signal
) {

    public EvaluationResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static EvaluationResult stopped(String tokenAddress, EvaluationOutcome outcome, List<String> reasons) {
        return new EvaluationResult(tokenAddress, outcome, reasons, null, null, null);
    }

    public double compositeScore() {
        return score == null ? 0.0 : score.compositeScore();
    }
}
