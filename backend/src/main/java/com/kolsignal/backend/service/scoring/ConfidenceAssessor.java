package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.model.Confidence;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.TokenMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class ConfidenceAssessor {

    static final String NEW_TOKEN = "NEW_TOKEN";
    static final String VERY_NEW_TOKEN = "VERY_NEW_TOKEN";
    static final String LOW_LIQUIDITY = "LOW_LIQUIDITY";
    static final String SINGLE_KOL = "SINGLE_KOL";
    static final String SIDE_ONLY = "SIDE_ONLY";
    static final String LOW_SAMPLE_KOL = "LOW_SAMPLE_KOL";
    static final String LOW_HOLDER_COUNT = "LOW_HOLDER_COUNT";

    private final ScoringProperties scoringProperties;

    public Assessment assessValidated(TokenMetrics metrics, List<KolWalletActivity> activities, ScamFilterOutput filter) {
        ScoringProperties.Confidence cfg = scoringProperties.getConfidence();
        List<String> flags = new ArrayList<>();
        Confidence confidence = Confidence.HIGH;
        int band = cfg.getBaseBand();

        if (metrics.tokenAge() < cfg.getVeryNewTokenMinutes()) {
            flags.add(NEW_TOKEN);
            confidence = Confidence.LOW;
            band = 15;
        } else if (metrics.tokenAge() < cfg.getNewTokenMinutes()) {
            flags.add(NEW_TOKEN);
            confidence = Confidence.MEDIUM;
            band = 15;
        }

        if (metrics.liquidityPool() < cfg.getMinLiquidity()) {
            flags.add(LOW_LIQUIDITY);
            confidence = confidence.atMost(Confidence.MEDIUM);
            band = Math.max(band, 10);
        }

        long mainCount = activities.stream().filter(KolWalletActivity::isMainWallet).count();
        long sideCount = activities.stream().filter(KolWalletActivity::isSideWallet).count();
        if (!activities.isEmpty() && activities.size() < cfg.getMinKolCount()) {
            flags.add(SINGLE_KOL);
            band = Math.max(band, 10);
        }
        if (mainCount == 0 && sideCount > 0) {
            flags.add(SIDE_ONLY);
            confidence = confidence.atMost(Confidence.MEDIUM);
        }
        boolean lowSample = activities.stream()
                .anyMatch(a -> a.performance() != null && a.performance().totalTrades() < cfg.getMinKolTrades());
        if (lowSample) {
            flags.add(LOW_SAMPLE_KOL);
            band = Math.max(band, 10);
        }

        if (filter.flagged()) {
            flags.addAll(filter.flags());
        }
        return new Assessment(confidence, band, flags);
    }

    public Assessment assessDiscovery(TokenMetrics metrics, ScamFilterOutput filter) {
        ScoringProperties.Confidence cfg = scoringProperties.getConfidence();
        List<String> flags = new ArrayList<>();
        Confidence confidence = Confidence.MEDIUM;
        int band = cfg.getDiscoveryBaseBand();

        if (metrics.tokenAge() < cfg.getVeryNewTokenMinutes()) {
            flags.add(VERY_NEW_TOKEN);
            flags.add(NEW_TOKEN);
            confidence = Confidence.LOW;
            band = 20;
        } else if (metrics.tokenAge() < cfg.getNewTokenMinutes()) {
            flags.add(NEW_TOKEN);
            band = 15;
        }

        if (metrics.liquidityPool() < cfg.getMinLiquidity()) {
            flags.add(LOW_LIQUIDITY);
            band = Math.max(band, 15);
        }
        if (metrics.holderCount() < cfg.getMinDiscoveryHolders()) {
            flags.add(LOW_HOLDER_COUNT);
        }

        if (filter.flagged()) {
            flags.addAll(filter.flags());
        }
        return new Assessment(confidence, band, flags);
    }

    public record Assessment(Confidence confidence, int band, List<String> flags) {

        public Assessment {
            flags = List.copyOf(flags);
        }
    }
}
