package com.kolsignal.backend.model;

import lombok.Builder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Actionable signal handed to the delivery layer. {@code primaryKolActivity} is null
 * for discovery signals.
 */
@Builder
public record TradeSignal(
        String id,
        String tokenAddress,
        String tokenTicker,
        String tokenName,
        TokenScore score,
        TokenMetrics tokenMetrics,
        SocialMetrics socialMetrics,
        VolumeAuthenticityScore volumeAuthenticity,
        ScamFilterOutput scamFilter,
        KolWalletActivity primaryKolActivity,
        EntryZone entryZone,
        double positionSizePercent,
        PriceTarget stopLoss,
        PriceTarget takeProfit1,
        PriceTarget takeProfit2,
        Duration timeLimit,
        List<String> riskWarnings,
        Instant generatedAt,
        SignalType signalType
) {

    public TradeSignal {
        riskWarnings = riskWarnings == null ? List.of() : List.copyOf(riskWarnings);
    }

    public record EntryZone(double low, double high) {}

    /**
     * @param percent distance from the reference price, always positive
     */
    public record PriceTarget(double price, double percent) {}
}
