package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.SocialMetrics;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.model.VolumeAuthenticityScore;
import com.kolsignal.backend.service.datasource.KolActivityProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Individual score factors. Each factor is 0..100 except the narrative and timing
 * bonuses, which are added on top of the weighted sum.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FactorCalculator {

    private final ScoringProperties scoringProperties;
    private final KolActivityProvider kolActivityProvider;
    private final MetaThemeCatalog metaThemeCatalog;
    private final TimingCurve timingCurve;

    public double onChainHealth(TokenMetrics metrics, VolumeAuthenticityScore volumeAuthenticity) {
        ScoringProperties.OnChain cfg = scoringProperties.getOnChain();
        double volumeTerm = clamp(metrics.volumeMarketCapRatio() / cfg.getIdealVolumeMcapRatio() * cfg.getVolumeRatioPoints(),
                cfg.getVolumeRatioPoints());
        double holderTerm = clamp(metrics.holderCount() / cfg.getIdealHolderCount() * cfg.getHolderPoints(),
                cfg.getHolderPoints());
        double concentrationTerm = clamp(cfg.getConcentrationPoints()
                - (metrics.top10Concentration() - cfg.getIdealTop10Concentration()) / 2.0, cfg.getConcentrationPoints());
        double authenticityTerm = clamp(volumeAuthenticity.score() / 100.0 * cfg.getAuthenticityPoints(),
                cfg.getAuthenticityPoints());
        return clamp(volumeTerm + holderTerm + concentrationTerm + authenticityTerm, 100.0);
    }

    public double socialMomentum(SocialMetrics social) {
        ScoringProperties.Social cfg = scoringProperties.getSocial();
        double score = clamp(social.mentionVelocity1h() / cfg.getIdealMentionVelocity() * cfg.getVelocityPoints(),
                cfg.getVelocityPoints());
        score += social.engagementQuality() * cfg.getEngagementPoints();
        score += social.accountAuthenticity() * cfg.getAuthenticityPoints();
        score += (social.sentimentPolarity() + 1.0) / 2.0 * cfg.getSentimentPoints();

        if (social.kolMentionDetected() && !social.kolMentions().isEmpty()) {
            double kolBonus = cfg.getKolMentionBase()
                    + Math.min(cfg.getKolMentionCountCap(), social.kolMentions().size() * cfg.getKolMentionPerMention());
            if (social.kolMentions().stream().anyMatch(SocialMetrics.KolMention::highTier)) {
                kolBonus += cfg.getHighTierBonus();
            }
            score += Math.min(cfg.getKolMentionCap(), kolBonus);
        }
        return clamp(score, 100.0);
    }

    public double kolConviction(List<KolWalletActivity> activities, KolWalletActivity.WalletType walletType) {
        ScoringProperties.Kol cfg = scoringProperties.getKol();
        double totalWeight = 0.0;
        for (KolWalletActivity activity : activities) {
            if (activity.wallet() == null || activity.wallet().walletType() != walletType) {
                continue;
            }
            double sizeFactor = Math.min(cfg.getMaxBuySizeFactor(),
                    activity.transaction().solAmount() / cfg.getBuySizeNormalizationSol());
            totalWeight += signalWeight(activity) * sizeFactor;
        }
        return clamp(totalWeight * cfg.getConvictionScale(), 100.0);
    }

    public double scamRiskInverse(ScamFilterOutput filter) {
        if (filter.rejected()) {
            return 0.0;
        }
        ScoringProperties.ScamRisk cfg = scoringProperties.getScamRisk();
        double score = 100.0 - filter.flags().size() * cfg.getFlagPenalty();
        if (filter.bundleAnalysis().hasRugHistory()) {
            score -= cfg.getRugHistoryPenalty();
        }
        double bundled = filter.bundleAnalysis().bundledSupplyPercent();
        if (bundled > cfg.getHighBundlePercent()) {
            score -= cfg.getHighBundlePenalty();
        } else if (bundled > cfg.getElevatedBundlePercent()) {
            score -= cfg.getElevatedBundlePenalty();
        }
        if (filter.devBehaviour() != null && filter.devBehaviour().transferredToCex()) {
            score -= cfg.getDevCexTransferPenalty();
        }
        if (filter.flagged()) {
            score = Math.min(score, cfg.getFlaggedCap());
        }
        return Math.max(0.0, score);
    }

    public double narrativeBonus(TokenMetrics metrics, SocialMetrics social) {
        if (social.narrativeFit() == null || social.narrativeFit().isBlank()) {
            return 0.0;
        }
        ScoringProperties.Narrative cfg = scoringProperties.getNarrative();
        if (metaThemeCatalog.matchesAny(social.narrativeFit(), metrics.name(), metrics.ticker())) {
            log.debug("Narrative '{}' of {} matches meta themes v{}", social.narrativeFit(), metrics.ticker(),
                    metaThemeCatalog.getVersion());
            return cfg.getStrongBonus();
        }
        if (!social.kolMentions().isEmpty()) {
            return cfg.getModerateBonus();
        }
        return cfg.getWeakBonus();
    }

    public double timingBonus(TokenMetrics metrics) {
        return timingCurve.bonus(metrics.tokenAge());
    }

    private double signalWeight(KolWalletActivity activity) {
        try {
            return kolActivityProvider.calculateSignalWeight(activity);
        } catch (RuntimeException e) {
            log.warn("Signal weight unavailable for KOL {}, using 0: {}",
                    activity.kol() != null ? activity.kol().handle() : "unknown", e.getMessage());
            return 0.0;
        }
    }

    private static double clamp(double value, double max) {
        return Math.max(0.0, Math.min(max, value));
    }
}
