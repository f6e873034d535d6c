package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.config.RiskFilterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RugHistoryStage implements RiskStage {

    private final RiskFilterProperties riskFilterProperties;

    @Override
    public String name() {
        return "rug-history";
    }

    @Override
    public int order() {
        return 50;
    }

    @Override
    public StageVerdict evaluate(RiskFilterInput input) {
        RiskFilterProperties.RugHistory cfg = riskFilterProperties.getRugHistory();
        int count = input.rugHistoryWalletCount();
        if (count >= cfg.getRejectCount()) {
            return StageVerdict.reject("RUG_HISTORY_HIGH: " + count + " wallets with prior rug involvement");
        }
        if (count >= cfg.getFlagCount()) {
            return StageVerdict.flag("RUG_HISTORY: " + count + " wallet(s) with prior rug involvement");
        }
        return StageVerdict.proceed();
    }

    @Override
    public void record(RiskFilterInput input, FilterOutputDraft draft) {
        draft.rugHistoryWalletCount(input.rugHistoryWalletCount());
    }
}
