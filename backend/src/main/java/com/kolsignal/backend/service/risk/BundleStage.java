package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.config.RiskFilterProperties;
import com.kolsignal.backend.model.BundleAnalysis;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class BundleStage implements RiskStage {

    private final RiskFilterProperties riskFilterProperties;

    @Override
    public String name() {
        return "bundle";
    }

    @Override
    public int order() {
        return 30;
    }

    @Override
    public StageVerdict evaluate(RiskFilterInput input) {
        BundleAnalysis analysis = input.bundleAnalysis().orElseGet(BundleAnalysis::neutral);
        RiskFilterProperties.Bundle cfg = riskFilterProperties.getBundle();
        double bundled = analysis.bundledSupplyPercent();

        if (analysis.riskLevel() == BundleAnalysis.Severity.HIGH && analysis.hasRugHistory()) {
            return StageVerdict.reject(String.format(Locale.ROOT,
                    "BUNDLE_RUG: %.1f%% bundled supply with rug history wallets", bundled));
        }
        if (bundled >= cfg.getHighRiskSupplyPercent()) {
            return StageVerdict.flag(String.format(Locale.ROOT,
                    "BUNDLE_HIGH: %.1f%% supply in bundled wallets", bundled));
        }
        if (bundled >= cfg.getMediumRiskSupplyPercent() || analysis.fundingOverlapDetected()) {
            return StageVerdict.flag(String.format(Locale.ROOT,
                    "BUNDLE_MEDIUM: %.1f%% bundled, funding overlap: %s", bundled, analysis.fundingOverlapDetected()));
        }
        return StageVerdict.proceed();
    }

    @Override
    public void record(RiskFilterInput input, FilterOutputDraft draft) {
        draft.bundleAnalysis(input.bundleAnalysis().orElseGet(BundleAnalysis::neutral));
    }
}
