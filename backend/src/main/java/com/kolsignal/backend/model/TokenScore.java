package com.kolsignal.backend.model;

import java.util.List;

/**
 * @param confidenceBand plus/minus points around {@code compositeScore}
 * @param filterResult   risk filter result the score was computed against
 */
public record TokenScore(
        String tokenAddress,
        double compositeScore,
        ScoreFactors factors,
        Confidence confidence,
        int confidenceBand,
        List<String> flags,
        RiskLevel riskLevel,
        ScoringProfile profile,
        FilterResult filterResult
) {

    public TokenScore {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public boolean hasFlag(String flag) {
        return flags.contains(flag);
    }
}
