package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.config.RiskFilterProperties;
import com.kolsignal.backend.model.DevWalletBehaviour;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class DevWalletStage implements RiskStage {

    private final RiskFilterProperties riskFilterProperties;

    @Override
    public String name() {
        return "dev-wallet";
    }

    @Override
    public int order() {
        return 40;
    }

    @Override
    public StageVerdict evaluate(RiskFilterInput input) {
        DevWalletBehaviour behaviour = input.devBehaviour().orElse(null);
        if (behaviour == null || !behaviour.deployerKnown()) {
            return StageVerdict.proceed();
        }
        RiskFilterProperties.DevWallet cfg = riskFilterProperties.getDevWallet();
        double sold = behaviour.soldPercent48h();

        if (behaviour.transferredToCex() && sold >= cfg.getHighSellPercent()) {
            return StageVerdict.reject(String.format(Locale.ROOT,
                    "DEV_RUG_PATTERN: Dev sold %.1f%% AND transferred to CEX", sold));
        }
        if (behaviour.transferredToCex()) {
            return StageVerdict.flag("DEV_CEX_TRANSFER: Dev wallet transferred to CEX");
        }
        if (sold >= cfg.getHardDumpPercent()) {
            return StageVerdict.reject(String.format(Locale.ROOT,
                    "DEV_DUMP_HARD: Dev sold %.1f%% within 48h - likely rug", sold));
        }
        if (sold >= cfg.getHighSellPercent()) {
            return StageVerdict.flag(String.format(Locale.ROOT, "DEV_DUMP: Dev sold %.1f%% within 48h", sold));
        }
        if (sold >= cfg.getFlagSellPercent()) {
            return StageVerdict.flag(String.format(Locale.ROOT, "DEV_SELLING: Dev sold %.1f%% within 48h", sold));
        }
        if (behaviour.bridgeActivity()) {
            return StageVerdict.flag("DEV_BRIDGE: Dev wallet has bridge activity");
        }
        return StageVerdict.proceed();
    }

    @Override
    public void record(RiskFilterInput input, FilterOutputDraft draft) {
        draft.devBehaviour(input.devBehaviour().orElse(null));
    }
}
