package com.kolsignal.backend.model;

import lombok.Builder;

/**
 * Point-in-time market and holder snapshot for a token. Produced by the on-chain
 * data provider and never mutated during an evaluation.
 *
 * @param top10Concentration percent of supply held by the ten largest holders
 * @param tokenAge           minutes since the pool was created
 * @param lpLockDuration     lock duration in days, null when unknown or unlocked
 */
@Builder
public record TokenMetrics(
        String address,
        String ticker,
        String name,
        double price,
        double marketCap,
        double volume24h,
        int holderCount,
        double holderChange1h,
        double top10Concentration,
        double liquidityPool,
        double tokenAge,
        boolean lpLocked,
        Integer lpLockDuration
) {

    public double volumeMarketCapRatio() {
        if (marketCap <= 0) {
            return 0.0;
        }
        return volume24h / marketCap;
    }
}
