package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.DevWalletBehaviour;
import com.kolsignal.backend.model.FilterResult;
import com.kolsignal.backend.model.ScamFilterOutput;

import java.util.ArrayList;
import java.util.List;

/**
 * Working state of one filter run. Fields of stages that never ran keep their safe
 * defaults.
 */
public class FilterOutputDraft {

    private FilterResult result = FilterResult.PASS;
    private final List<String> flags = new ArrayList<>();
    private ContractAnalysis contractAnalysis = ContractAnalysis.conservativeDefault();
    private BundleAnalysis bundleAnalysis = BundleAnalysis.neutral();
    private DevWalletBehaviour devBehaviour;
    private int rugHistoryWalletCount;

    void apply(StageVerdict verdict) {
        flags.addAll(verdict.flags());
        result = result.escalate(verdict.toFilterResult());
    }

    public void contractAnalysis(ContractAnalysis contractAnalysis) {
        this.contractAnalysis = contractAnalysis;
    }

    public void bundleAnalysis(BundleAnalysis bundleAnalysis) {
        this.bundleAnalysis = bundleAnalysis;
    }

    public void devBehaviour(DevWalletBehaviour devBehaviour) {
        this.devBehaviour = devBehaviour;
    }

    public void rugHistoryWalletCount(int rugHistoryWalletCount) {
        this.rugHistoryWalletCount = rugHistoryWalletCount;
    }

    ScamFilterOutput build() {
        return new ScamFilterOutput(result, flags, contractAnalysis, bundleAnalysis, devBehaviour, rugHistoryWalletCount);
    }
}
