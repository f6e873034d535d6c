package com.kolsignal.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "scoring")
@Data
@Validated
public class ScoringProperties {

    @Valid
    private Weights weights = new Weights(0.25, 0.10, 0.25, 0.15, 0.25);
    @Valid
    private Weights discoveryWeights = new Weights(0.40, 0.15, 0.0, 0.0, 0.45);
    @Positive
    private double maxCompositeScore = 150.0;
    @Positive
    private double maxDiscoveryScore = 100.0;

    private OnChain onChain = new OnChain();
    private Social social = new Social();
    private Kol kol = new Kol();
    private ScamRisk scamRisk = new ScamRisk();
    @Valid
    private Narrative narrative = new Narrative();
    @Valid
    private Timing timing = new Timing();
    private Confidence confidence = new Confidence();
    private RiskBands riskBands = new RiskBands();
    private KolMultiplier kolMultiplier = new KolMultiplier();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Weights {
        @PositiveOrZero
        private double onChainHealth;
        @PositiveOrZero
        private double socialMomentum;
        @PositiveOrZero
        private double kolConvictionMain;
        @PositiveOrZero
        private double kolConvictionSide;
        @PositiveOrZero
        private double scamRiskInverse;
    }

    @Data
    public static class OnChain {
        private double idealVolumeMcapRatio = 0.3;
        private double idealHolderCount = 500;
        private double idealTop10Concentration = 30.0;
        private double volumeRatioPoints = 20.0;
        private double holderPoints = 40.0;
        private double concentrationPoints = 20.0;
        private double authenticityPoints = 20.0;
    }

    @Data
    public static class Social {
        private double idealMentionVelocity = 50.0;
        private double velocityPoints = 25.0;
        private double engagementPoints = 20.0;
        private double authenticityPoints = 20.0;
        private double sentimentPoints = 15.0;
        private double kolMentionBase = 10.0;
        private double kolMentionPerMention = 3.0;
        private double kolMentionCountCap = 10.0;
        private double highTierBonus = 5.0;
        private double kolMentionCap = 20.0;
    }

    @Data
    public static class Kol {
        private double buySizeNormalizationSol = 10.0;
        private double maxBuySizeFactor = 2.0;
        private double convictionScale = 50.0;
    }

    @Data
    public static class ScamRisk {
        private double flagPenalty = 7.0;
        private double rugHistoryPenalty = 25.0;
        private double highBundlePercent = 25.0;
        private double highBundlePenalty = 15.0;
        private double elevatedBundlePercent = 15.0;
        private double elevatedBundlePenalty = 8.0;
        private double devCexTransferPenalty = 35.0;
        private double flaggedCap = 75.0;
    }

    @Data
    public static class Narrative {
        private double strongBonus = 25.0;
        private double moderateBonus = 15.0;
        private double weakBonus = 5.0;
        @NotBlank
        private String themesVersion = "2025.1";
        private List<String> themes = new ArrayList<>(List.of(
                "AI", "agent", "political", "trump", "maga", "pepe", "doge", "cat", "dog",
                "meme revival", "solana native"));
    }

    @Data
    public static class Timing {
        @NotEmpty
        private List<Anchor> anchors = new ArrayList<>(List.of(
                new Anchor(0, 8),
                new Anchor(15, 10),
                new Anchor(30, 12),
                new Anchor(60, 15),
                new Anchor(180, 20),
                new Anchor(720, 20),
                new Anchor(1440, 17),
                new Anchor(4320, 10)));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Anchor {
        private double ageMinutes;
        private double bonus;
    }

    @Data
    public static class Confidence {
        private double veryNewTokenMinutes = 60.0;
        private double newTokenMinutes = 120.0;
        private double minLiquidity = 25_000.0;
        private int minKolCount = 2;
        private int minKolTrades = 10;
        private int minDiscoveryHolders = 100;
        private int baseBand = 5;
        private int discoveryBaseBand = 12;
    }

    @Data
    public static class RiskBands {
        private double veryLow = 85.0;
        private double low = 75.0;
        private double medium = 65.0;
        private double high = 55.0;
        private double discoveryShift = 5.0;
    }

    @Data
    public static class KolMultiplier {
        private double none = 1.0;
        private double singleSide = 1.15;
        private double singleMain = 1.25;
        private double multiSide = 1.30;
        private double mixed = 1.40;
        private double multiMain = 1.45;
        private double highConviction = 1.60;
        private int highConvictionMainCount = 3;
    }
}
