package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.DevWalletBehaviour;
import lombok.Builder;

import java.util.Optional;

/**
 * Everything the risk stages look at, fetched up front. An empty optional means the
 * upstream call failed or timed out; each stage decides what that means for it.
 *
 * @param tokenAgeMinutes null when token metrics were unavailable
 */
@Builder
public record RiskFilterInput(
        String tokenAddress,
        Double tokenAgeMinutes,
        Optional<Boolean> honeypot,
        Optional<ContractAnalysis> contractAnalysis,
        Optional<BundleAnalysis> bundleAnalysis,
        Optional<DevWalletBehaviour> devBehaviour,
        int rugHistoryWalletCount
) {

    public RiskFilterInput {
        honeypot = honeypot == null ? Optional.empty() : honeypot;
        contractAnalysis = contractAnalysis == null ? Optional.empty() : contractAnalysis;
        bundleAnalysis = bundleAnalysis == null ? Optional.empty() : bundleAnalysis;
        devBehaviour = devBehaviour == null ? Optional.empty() : devBehaviour;
    }
}
