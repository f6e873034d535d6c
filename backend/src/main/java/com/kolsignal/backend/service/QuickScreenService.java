package com.kolsignal.backend.service;

import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.service.datasource.OnChainDataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Cheap pre-filter run before any expensive fetch. Only a known scam template fails
 * the screen; unrevoked authorities are left to the full risk filter. Fails closed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QuickScreenService {

    static final String SCAM_TEMPLATE_REASON = "Known scam contract template";
    static final String CHECK_FAILED_REASON = "Check failed, treating as suspicious";

    private final DataFetchService dataFetchService;
    private final OnChainDataProvider onChainDataProvider;

    public QuickCheckResult quickCheck(String tokenAddress) {
        Optional<ContractAnalysis> analysis = dataFetchService.fetch("quick-contract", tokenAddress,
                () -> onChainDataProvider.analyzeContract(tokenAddress));
        if (analysis.isEmpty()) {
            log.warn("⚠️ Quick check unavailable for {}, failing closed", tokenAddress);
            return QuickCheckResult.fail(CHECK_FAILED_REASON);
        }

        ContractAnalysis contract = analysis.get();
        if (contract.knownScamTemplate()) {
            log.info("⛔ Quick check rejected {}: scam template", tokenAddress);
            return QuickCheckResult.fail(SCAM_TEMPLATE_REASON);
        }

        List<String> warnings = new ArrayList<>();
        if (!contract.mintAuthorityRevoked()) {
            warnings.add("Mint authority active");
        }
        if (!contract.freezeAuthorityRevoked()) {
            warnings.add("Freeze authority active");
        }
        if (!warnings.isEmpty()) {
            log.info("Quick check passed {} with warnings {}", tokenAddress, warnings);
        } else {
            log.debug("Quick check passed {}", tokenAddress);
        }
        return new QuickCheckResult(true, null, warnings);
    }

    public record QuickCheckResult(boolean pass, String reason, List<String> warnings) {

        public QuickCheckResult {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }

        static QuickCheckResult fail(String reason) {
            return new QuickCheckResult(false, reason, List.of());
        }
    }
}
