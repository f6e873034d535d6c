package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.model.FilterResult;
import com.kolsignal.backend.model.RiskLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RiskLevelClassifier {

    private final ScoringProperties scoringProperties;

    public RiskLevel validated(double score, FilterResult filterResult, boolean hasMainWallet) {
        ScoringProperties.RiskBands bands = scoringProperties.getRiskBands();
        RiskLevel risk = band(score, bands.getVeryLow(), bands.getLow(), bands.getMedium(), bands.getHigh());
        if (filterResult == FilterResult.FLAG) {
            risk = risk.atLeast(RiskLevel.MEDIUM);
        }
        if (!hasMainWallet) {
            risk = risk.atLeast(RiskLevel.MEDIUM);
        }
        return risk;
    }

    /**
     * Discovery bands are widened by the configured shift: harder to reach the two
     * lowest levels, easier to stay out of VERY_HIGH.
     */
    public RiskLevel discovery(double score, FilterResult filterResult) {
        ScoringProperties.RiskBands bands = scoringProperties.getRiskBands();
        double shift = bands.getDiscoveryShift();
        RiskLevel risk = band(score, bands.getVeryLow() + shift, bands.getLow() + shift,
                bands.getMedium(), bands.getHigh() - shift);
        risk = risk.atLeast(RiskLevel.MEDIUM);
        if (filterResult == FilterResult.FLAG) {
            risk = risk.atLeast(RiskLevel.HIGH);
        }
        return risk;
    }

    private static RiskLevel band(double score, double veryLow, double low, double medium, double high) {
        if (score >= veryLow) {
            return RiskLevel.VERY_LOW;
        }
        if (score >= low) {
            return RiskLevel.LOW;
        }
        if (score >= medium) {
            return RiskLevel.MEDIUM;
        }
        if (score >= high) {
            return RiskLevel.HIGH;
        }
        return RiskLevel.VERY_HIGH;
    }
}
