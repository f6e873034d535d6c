package com.kolsignal.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "signal")
@Data
@Validated
public class SignalProperties {

    private Gate gate = new Gate();
    private Sizing sizing = new Sizing();
    private Targets targets = new Targets();
    private Screening screening = new Screening();

    @Data
    public static class Gate {
        private double minBuyScore = 45.0;
        private double minDiscoveryScore = 45.0;
    }

    @Data
    public static class Sizing {
        @Positive
        private double defaultPositionPercent = 2.0;
        private double highScore = 90.0;
        private double highScoreMultiplier = 1.5;
        private double elevatedScore = 80.0;
        private double elevatedScoreMultiplier = 1.25;
        private double lowLiquidityMultiplier = 0.5;
        private double newTokenMultiplier = 0.75;
        private double sideOnlyMultiplier = 0.75;
        @Positive
        private double maxPositionPercent = 3.0;
        private double discoveryFraction = 0.5;
        @Positive
        private double maxDiscoveryPositionPercent = 1.5;
    }

    @Data
    public static class Targets {
        private double entryBandPercent = 5.0;
        private double stopLossPercent = 30.0;
        private double takeProfit1Percent = 50.0;
        private double takeProfit2Percent = 150.0;
        @Positive
        private long timeLimitHours = 72;
    }

    @Data
    public static class Screening {
        private double minMarketCap = 50_000;
        private double maxMarketCap = 25_000_000;
        private double min24hVolume = 500;
        private double minVolumeMarketCapRatio = 0.01;
        private int minHolderCount = 5;
        private double maxTop10Concentration = 90.0;
        private double minLiquidityPool = 500;
        private double minTokenAgeMinutes = 1.0;
    }
}
