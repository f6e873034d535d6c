package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.config.RiskFilterProperties;
import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.DevWalletBehaviour;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.service.DataFetchService;
import com.kolsignal.backend.service.datasource.OnChainDataProvider;
import com.kolsignal.backend.service.datasource.RugWalletRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Gathers the risk stage inputs concurrently, each call under its own time limit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RiskFilterDataCollector {

    private final DataFetchService dataFetchService;
    private final OnChainDataProvider onChainDataProvider;
    private final RugWalletRegistry rugWalletRegistry;
    private final RiskFilterProperties riskFilterProperties;

    /**
     * @param knownMetrics metrics already fetched by the caller, or null to fetch them
     *                     here for the token age
     */
    public CompletableFuture<RiskFilterInput> collect(String tokenAddress, TokenMetrics knownMetrics) {
        CompletableFuture<Optional<TokenMetrics>> metricsFuture = knownMetrics != null
                ? CompletableFuture.completedFuture(Optional.of(knownMetrics))
                : dataFetchService.fetchAsync("token-metrics", tokenAddress,
                        () -> onChainDataProvider.getTokenMetrics(tokenAddress));
        CompletableFuture<Optional<Boolean>> honeypotFuture = dataFetchService.fetchAsync("honeypot", tokenAddress,
                () -> onChainDataProvider.isHoneypot(tokenAddress));
        CompletableFuture<Optional<ContractAnalysis>> contractFuture = dataFetchService.fetchAsync("contract", tokenAddress,
                () -> onChainDataProvider.analyzeContract(tokenAddress));
        CompletableFuture<Optional<BundleAnalysis>> bundleFuture = dataFetchService.fetchAsync("bundle", tokenAddress,
                () -> onChainDataProvider.analyzeBundles(tokenAddress));
        CompletableFuture<Optional<DevWalletBehaviour>> devFuture = dataFetchService.fetchAsync("dev-wallet", tokenAddress,
                () -> onChainDataProvider.analyzeDevWallet(tokenAddress));
        CompletableFuture<Optional<Integer>> rugFuture = dataFetchService.fetchAsync("rug-history", tokenAddress,
                () -> countRugWallets(tokenAddress));

        return CompletableFuture.allOf(metricsFuture, honeypotFuture, contractFuture, bundleFuture, devFuture, rugFuture)
                .thenApply(ignored -> RiskFilterInput.builder()
                        .tokenAddress(tokenAddress)
                        .tokenAgeMinutes(metricsFuture.join().map(TokenMetrics::tokenAge).orElse(null))
                        .honeypot(honeypotFuture.join())
                        .contractAnalysis(contractFuture.join())
                        .bundleAnalysis(bundleFuture.join())
                        .devBehaviour(devFuture.join())
                        .rugHistoryWalletCount(rugFuture.join().orElse(0))
                        .build());
    }

    int countRugWallets(String tokenAddress) {
        List<String> holders = onChainDataProvider.getTopHolders(tokenAddress,
                riskFilterProperties.getRugHistory().getTopHolderLimit());
        if (holders == null || holders.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String holder : holders) {
            try {
                if (rugWalletRegistry.isRugWallet(holder)) {
                    count++;
                }
            } catch (RuntimeException e) {
                log.warn("Rug registry lookup failed for holder {} of {}, counting as clean: {}",
                        holder, tokenAddress, e.getMessage());
            }
        }
        return count;
    }
}
