package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.model.Confidence;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.RiskLevel;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.ScoreFactors;
import com.kolsignal.backend.model.ScoringProfile;
import com.kolsignal.backend.model.SocialMetrics;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.model.VolumeAuthenticityScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted composite scoring for KOL-validated and discovery signals. Output depends
 * only on the arguments and configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompositeScoringService {

    static final String DISCOVERY_SIGNAL = "DISCOVERY_SIGNAL";
    static final String KOL_VALIDATED = "KOL_VALIDATED";

    private final ScoringProperties scoringProperties;
    private final FactorCalculator factorCalculator;
    private final ConfidenceAssessor confidenceAssessor;
    private final RiskLevelClassifier riskLevelClassifier;
    private final KolMultiplierTable kolMultiplierTable;

    public TokenScore calculateScore(String tokenAddress,
                                     TokenMetrics metrics,
                                     SocialMetrics social,
                                     VolumeAuthenticityScore volumeAuthenticity,
                                     ScamFilterOutput filter,
                                     List<KolWalletActivity> activities) {
        List<KolWalletActivity> kolActivities = activities == null ? List.of() : activities;
        ScoreFactors factors = new ScoreFactors(
                factorCalculator.onChainHealth(metrics, volumeAuthenticity),
                factorCalculator.socialMomentum(social),
                factorCalculator.kolConviction(kolActivities, KolWalletActivity.WalletType.MAIN),
                factorCalculator.kolConviction(kolActivities, KolWalletActivity.WalletType.SIDE),
                factorCalculator.scamRiskInverse(filter),
                factorCalculator.narrativeBonus(metrics, social),
                factorCalculator.timingBonus(metrics));

        double composite = composite(factors, scoringProperties.getWeights(), scoringProperties.getMaxCompositeScore());
        ConfidenceAssessor.Assessment assessment = confidenceAssessor.assessValidated(metrics, kolActivities, filter);
        boolean hasMain = kolActivities.stream().anyMatch(KolWalletActivity::isMainWallet);
        RiskLevel risk = riskLevelClassifier.validated(composite, filter.result(), hasMain);

        log.debug("Score {} = {} factors={}", tokenAddress, composite, factors);
        return new TokenScore(tokenAddress, composite, factors, assessment.confidence(), assessment.band(),
                assessment.flags(), risk, ScoringProfile.KOL_VALIDATED, filter.result());
    }

    public TokenScore calculateDiscoveryScore(String tokenAddress,
                                              TokenMetrics metrics,
                                              SocialMetrics social,
                                              VolumeAuthenticityScore volumeAuthenticity,
                                              ScamFilterOutput filter) {
        ScoreFactors factors = new ScoreFactors(
                factorCalculator.onChainHealth(metrics, volumeAuthenticity),
                factorCalculator.socialMomentum(social),
                0.0,
                0.0,
                factorCalculator.scamRiskInverse(filter),
                factorCalculator.narrativeBonus(metrics, social),
                factorCalculator.timingBonus(metrics));

        double composite = composite(factors, scoringProperties.getDiscoveryWeights(),
                scoringProperties.getMaxDiscoveryScore());
        ConfidenceAssessor.Assessment assessment = confidenceAssessor.assessDiscovery(metrics, filter);
        List<String> flags = new ArrayList<>(assessment.flags());
        flags.add(DISCOVERY_SIGNAL);
        RiskLevel risk = riskLevelClassifier.discovery(composite, filter.result());

        log.debug("Discovery score {} = {} factors={}", tokenAddress, composite, factors);
        return new TokenScore(tokenAddress, composite, factors, assessment.confidence(), assessment.band(),
                flags, risk, ScoringProfile.DISCOVERY, filter.result());
    }

    public double calculateKolMultiplier(List<KolWalletActivity> activities) {
        return kolMultiplierTable.multiplierFor(activities);
    }

    /**
     * Re-scores a discovery score once KOL wallets have bought the token.
     */
    public TokenScore applyKolMultiplier(TokenScore discoveryScore, List<KolWalletActivity> activities) {
        List<KolWalletActivity> kolActivities = activities == null ? List.of() : activities;
        double multiplier = calculateKolMultiplier(kolActivities);
        double boosted = Math.round(Math.min(scoringProperties.getMaxCompositeScore(),
                discoveryScore.compositeScore() * multiplier));

        ScoreFactors factors = discoveryScore.factors().withKolConviction(
                factorCalculator.kolConviction(kolActivities, KolWalletActivity.WalletType.MAIN),
                factorCalculator.kolConviction(kolActivities, KolWalletActivity.WalletType.SIDE));

        List<String> flags = new ArrayList<>(discoveryScore.flags());
        flags.remove(DISCOVERY_SIGNAL);
        flags.add(KOL_VALIDATED);

        boolean hasMain = kolActivities.stream().anyMatch(KolWalletActivity::isMainWallet);
        Confidence confidence = hasMain ? discoveryScore.confidence().upgrade() : discoveryScore.confidence();
        RiskLevel risk = riskLevelClassifier.validated(boosted, discoveryScore.filterResult(), hasMain);

        log.debug("KOL multiplier {} on {}: {} -> {}", multiplier, discoveryScore.tokenAddress(),
                discoveryScore.compositeScore(), boosted);
        return new TokenScore(discoveryScore.tokenAddress(), boosted, factors, confidence,
                discoveryScore.confidenceBand(), flags, risk, ScoringProfile.KOL_VALIDATED,
                discoveryScore.filterResult());
    }

    private double composite(ScoreFactors factors, ScoringProperties.Weights weights, double max) {
        double base = factors.onChainHealth() * weights.getOnChainHealth()
                + factors.socialMomentum() * weights.getSocialMomentum()
                + factors.kolConvictionMain() * weights.getKolConvictionMain()
                + factors.kolConvictionSide() * weights.getKolConvictionSide()
                + factors.scamRiskInverse() * weights.getScamRiskInverse();
        double total = base + factors.narrativeBonus() + factors.timingBonus();
        return Math.round(Math.max(0.0, Math.min(max, total)));
    }
}
