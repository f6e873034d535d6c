package com.kolsignal.backend.model;

import java.time.Instant;

/**
 * One observed buy by a tracked KOL wallet, together with the KOL's identity and
 * historical record at the time of observation.
 */
public record KolWalletActivity(
        Kol kol,
        KolWallet wallet,
        KolPerformance performance,
        KolTransaction transaction
) {

    public boolean isMainWallet() {
        return wallet != null && wallet.walletType() == WalletType.MAIN;
    }

    public boolean isSideWallet() {
        return wallet != null && wallet.walletType() == WalletType.SIDE;
    }

    public record Kol(String id, String handle, KolTier tier) {}

    public record KolWallet(String address, WalletType walletType, AttributionConfidence attributionConfidence) {}

    public record KolPerformance(int totalTrades, int wins, int losses, double winRate, double avgRoi) {}

    public record KolTransaction(
            String signature,
            double solAmount,
            double usdValue,
            double tokensAcquired,
            double supplyPercent,
            Instant timestamp
    ) {}

    public enum WalletType {
        MAIN,
        SIDE
    }

    public enum KolTier {
        TIER_1,
        TIER_2,
        TIER_3
    }

    public enum AttributionConfidence {
        HIGH,
        MEDIUM_HIGH,
        MEDIUM,
        LOW_MEDIUM,
        LOW
    }
}
