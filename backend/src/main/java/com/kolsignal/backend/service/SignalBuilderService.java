package com.kolsignal.backend.service;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.SignalType;
import com.kolsignal.backend.model.SocialMetrics;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.model.TradeSignal;
import com.kolsignal.backend.model.VolumeAuthenticityScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Turns an approved score into trade parameters: sizing, entry zone and exits.
 */
@Service
@RequiredArgsConstructor
public class SignalBuilderService {

    private final SignalProperties signalProperties;
    private final ScoringProperties scoringProperties;

    public TradeSignal buildBuySignal(TokenMetrics metrics,
                                      SocialMetrics social,
                                      VolumeAuthenticityScore volumeAuthenticity,
                                      ScamFilterOutput filter,
                                      TokenScore score,
                                      List<KolWalletActivity> activities) {
        return kolSignal(SignalType.BUY, "sig_", metrics, social, volumeAuthenticity, filter, score, activities);
    }

    public TradeSignal buildKolValidationSignal(TokenMetrics metrics,
                                                SocialMetrics social,
                                                VolumeAuthenticityScore volumeAuthenticity,
                                                ScamFilterOutput filter,
                                                TokenScore score,
                                                List<KolWalletActivity> activities) {
        return kolSignal(SignalType.KOL_VALIDATION, "kolv_", metrics, social, volumeAuthenticity, filter, score, activities);
    }

    public TradeSignal buildDiscoverySignal(TokenMetrics metrics,
                                            SocialMetrics social,
                                            VolumeAuthenticityScore volumeAuthenticity,
                                            ScamFilterOutput filter,
                                            TokenScore score) {
        SignalProperties.Sizing sizing = signalProperties.getSizing();
        double size = sizing.getDefaultPositionPercent() * sizing.getDiscoveryFraction();
        size = applyCautionMultipliers(size, score, false);
        size = Math.min(size, sizing.getMaxDiscoveryPositionPercent());

        List<String> warnings = new ArrayList<>();
        warnings.add("DISCOVERY_SIGNAL: No KOL validation yet - higher risk");
        if (metrics.tokenAge() < scoringProperties.getConfidence().getVeryNewTokenMinutes()) {
            warnings.add("Token is less than 1 hour old");
        }
        if (metrics.liquidityPool() < scoringProperties.getConfidence().getMinLiquidity()) {
            warnings.add(String.format(Locale.ROOT, "Low liquidity pool: $%.0f", metrics.liquidityPool()));
        }

        return baseSignal(SignalType.DISCOVERY, "disc_", metrics, social, volumeAuthenticity, filter, score)
                .positionSizePercent(roundToTenth(size))
                .riskWarnings(warnings)
                .build();
    }

    private TradeSignal kolSignal(SignalType type,
                                  String idPrefix,
                                  TokenMetrics metrics,
                                  SocialMetrics social,
                                  VolumeAuthenticityScore volumeAuthenticity,
                                  ScamFilterOutput filter,
                                  TokenScore score,
                                  List<KolWalletActivity> activities) {
        SignalProperties.Sizing sizing = signalProperties.getSizing();
        double size = sizing.getDefaultPositionPercent();
        if (score.compositeScore() >= sizing.getHighScore()) {
            size *= sizing.getHighScoreMultiplier();
        } else if (score.compositeScore() >= sizing.getElevatedScore()) {
            size *= sizing.getElevatedScoreMultiplier();
        }
        size = applyCautionMultipliers(size, score, true);
        size = Math.min(size, sizing.getMaxPositionPercent());

        KolWalletActivity primary = activities == null || activities.isEmpty() ? null : activities.get(0);
        return baseSignal(type, idPrefix, metrics, social, volumeAuthenticity, filter, score)
                .primaryKolActivity(primary)
                .positionSizePercent(roundToTenth(size))
                .riskWarnings(List.of())
                .build();
    }

    private double applyCautionMultipliers(double size, TokenScore score, boolean includeSideOnly) {
        SignalProperties.Sizing sizing = signalProperties.getSizing();
        double adjusted = size;
        if (score.hasFlag("LOW_LIQUIDITY")) {
            adjusted *= sizing.getLowLiquidityMultiplier();
        }
        if (score.hasFlag("NEW_TOKEN")) {
            adjusted *= sizing.getNewTokenMultiplier();
        }
        if (includeSideOnly && score.hasFlag("SIDE_ONLY")) {
            adjusted *= sizing.getSideOnlyMultiplier();
        }
        return adjusted;
    }

    private TradeSignal.TradeSignalBuilder baseSignal(SignalType type,
                                                      String idPrefix,
                                                      TokenMetrics metrics,
                                                      SocialMetrics social,
                                                      VolumeAuthenticityScore volumeAuthenticity,
                                                      ScamFilterOutput filter,
                                                      TokenScore score) {
        SignalProperties.Targets targets = signalProperties.getTargets();
        double price = metrics.price();
        double band = targets.getEntryBandPercent() / 100.0;
        return TradeSignal.builder()
                .id(idPrefix + UUID.randomUUID().toString().replace("-", "").substring(0, 16))
                .tokenAddress(metrics.address())
                .tokenTicker(metrics.ticker())
                .tokenName(metrics.name())
                .score(score)
                .tokenMetrics(metrics)
                .socialMetrics(social)
                .volumeAuthenticity(volumeAuthenticity)
                .scamFilter(filter)
                .entryZone(new TradeSignal.EntryZone(price * (1 - band), price * (1 + band)))
                .stopLoss(new TradeSignal.PriceTarget(price * (1 - targets.getStopLossPercent() / 100.0),
                        targets.getStopLossPercent()))
                .takeProfit1(new TradeSignal.PriceTarget(price * (1 + targets.getTakeProfit1Percent() / 100.0),
                        targets.getTakeProfit1Percent()))
                .takeProfit2(new TradeSignal.PriceTarget(price * (1 + targets.getTakeProfit2Percent() / 100.0),
                        targets.getTakeProfit2Percent()))
                .timeLimit(Duration.ofHours(targets.getTimeLimitHours()))
                .generatedAt(Instant.now())
                .signalType(type);
    }

    private static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
