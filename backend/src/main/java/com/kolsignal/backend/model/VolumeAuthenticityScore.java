package com.kolsignal.backend.model;

/**
 * @param score 0-100, higher means more organic volume
 */
public record VolumeAuthenticityScore(
        double score,
        double uniqueWalletRatio,
        double sizeDistributionScore,
        double temporalPatternScore,
        boolean washTradingSuspected
) {

    public static VolumeAuthenticityScore neutral() {
        return new VolumeAuthenticityScore(50.0, 0.0, 0.0, 0.0, false);
    }
}
