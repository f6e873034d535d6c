package com.kolsignal.backend.model;

import java.util.List;

public record ScamFilterOutput(
        FilterResult result,
        List<String> flags,
        ContractAnalysis contractAnalysis,
        BundleAnalysis bundleAnalysis,
        DevWalletBehaviour devBehaviour,
        int rugHistoryWalletCount
) {

    public ScamFilterOutput {
        flags = flags == null ? List.of() : List.copyOf(flags);
        contractAnalysis = contractAnalysis == null ? ContractAnalysis.conservativeDefault() : contractAnalysis;
        bundleAnalysis = bundleAnalysis == null ? BundleAnalysis.neutral() : bundleAnalysis;
    }

    public boolean rejected() {
        return result == FilterResult.REJECT;
    }

    public boolean flagged() {
        return result == FilterResult.FLAG;
    }

    public boolean hasFlagPrefix(String prefix) {
        return flags.stream().anyMatch(flag -> flag.startsWith(prefix));
    }
}
