package com.kolsignal.backend.service.scoring;

import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.model.KolWalletActivity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Boost applied to a discovery score once KOL wallets buy in. More main wallets
 * always means an equal or larger multiplier.
 */
@Component
@RequiredArgsConstructor
public class KolMultiplierTable {

    private final ScoringProperties scoringProperties;

    public double multiplierFor(List<KolWalletActivity> activities) {
        ScoringProperties.KolMultiplier cfg = scoringProperties.getKolMultiplier();
        if (activities == null || activities.isEmpty()) {
            return cfg.getNone();
        }
        long main = activities.stream().filter(KolWalletActivity::isMainWallet).count();
        long side = activities.stream().filter(KolWalletActivity::isSideWallet).count();

        if (main >= cfg.getHighConvictionMainCount()) {
            return cfg.getHighConviction();
        }
        if (main >= 2) {
            return cfg.getMultiMain();
        }
        if (main > 0 && side > 0) {
            return cfg.getMixed();
        }
        if (side >= 2) {
            return cfg.getMultiSide();
        }
        if (main == 1) {
            return cfg.getSingleMain();
        }
        return cfg.getSingleSide();
    }
}
