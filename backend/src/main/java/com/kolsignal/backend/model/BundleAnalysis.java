package com.kolsignal.backend.model;

public record BundleAnalysis(
        boolean bundleDetected,
        double bundledSupplyPercent,
        int clusteredWalletCount,
        boolean fundingOverlapDetected,
        boolean hasRugHistory,
        Severity riskLevel
) {

    public static BundleAnalysis neutral() {
        return new BundleAnalysis(false, 0.0, 0, false, false, Severity.LOW);
    }

    public enum Severity {
        LOW,
        MEDIUM,
        HIGH
    }
}
