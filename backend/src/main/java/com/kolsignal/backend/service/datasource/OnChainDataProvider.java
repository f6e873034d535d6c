package com.kolsignal.backend.service.datasource;

import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.DevWalletBehaviour;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.model.VolumeAuthenticityScore;

import java.util.List;

/**
 * Market, contract and holder data for a token. Implementations talk to external
 * APIs and may block, time out or throw; callers go through
 * {@link com.kolsignal.backend.service.DataFetchService}.
 */
public interface OnChainDataProvider {

    /**
     * @return current metrics, or null when the token is unknown to the provider
     */
    TokenMetrics getTokenMetrics(String tokenAddress);

    ContractAnalysis analyzeContract(String tokenAddress);

    BundleAnalysis analyzeBundles(String tokenAddress);

    /**
     * @return dev wallet behaviour, or null when the deployer cannot be identified
     */
    DevWalletBehaviour analyzeDevWallet(String tokenAddress);

    VolumeAuthenticityScore getVolumeAuthenticity(String tokenAddress);

    /**
     * @return true only when a sell has been confirmed impossible
     */
    boolean isHoneypot(String tokenAddress);

    List<String> getTopHolders(String tokenAddress, int limit);
}
