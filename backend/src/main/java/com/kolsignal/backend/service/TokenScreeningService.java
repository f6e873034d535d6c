package com.kolsignal.backend.service;

import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.model.TokenMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimum market criteria a token must meet before the risk filter is worth running.
 */
@Service
@RequiredArgsConstructor
public class TokenScreeningService {

    private final SignalProperties signalProperties;

    public ScreeningResult screen(TokenMetrics metrics) {
        List<String> failures = new ArrayList<>();
        if (metrics == null) {
            failures.add("NO_METRICS: token metrics unavailable");
            return new ScreeningResult(false, failures);
        }
        SignalProperties.Screening cfg = signalProperties.getScreening();

        if (metrics.marketCap() < cfg.getMinMarketCap()) {
            failures.add(format("MCAP_LOW: %.0f < %.0f", metrics.marketCap(), cfg.getMinMarketCap()));
        } else if (metrics.marketCap() > cfg.getMaxMarketCap()) {
            failures.add(format("MCAP_HIGH: %.0f > %.0f", metrics.marketCap(), cfg.getMaxMarketCap()));
        }
        if (metrics.volume24h() < cfg.getMin24hVolume()) {
            failures.add(format("VOLUME_LOW: %.0f < %.0f", metrics.volume24h(), cfg.getMin24hVolume()));
        }
        if (metrics.volumeMarketCapRatio() < cfg.getMinVolumeMarketCapRatio()) {
            failures.add(format("VOLUME_RATIO_LOW: %.4f < %.4f", metrics.volumeMarketCapRatio(), cfg.getMinVolumeMarketCapRatio()));
        }
        if (metrics.holderCount() < cfg.getMinHolderCount()) {
            failures.add("HOLDERS_LOW: " + metrics.holderCount() + " < " + cfg.getMinHolderCount());
        }
        if (metrics.top10Concentration() > cfg.getMaxTop10Concentration()) {
            failures.add(format("CONCENTRATION_HIGH: %.1f%% > %.1f%%", metrics.top10Concentration(), cfg.getMaxTop10Concentration()));
        }
        if (metrics.liquidityPool() < cfg.getMinLiquidityPool()) {
            failures.add(format("LIQUIDITY_LOW: %.0f < %.0f", metrics.liquidityPool(), cfg.getMinLiquidityPool()));
        }
        if (metrics.tokenAge() < cfg.getMinTokenAgeMinutes()) {
            failures.add(format("TOO_NEW: %.1f min", metrics.tokenAge()));
        }
        return new ScreeningResult(failures.isEmpty(), failures);
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    public record ScreeningResult(boolean passed, List<String> failures) {

        public ScreeningResult {
            failures = failures == null ? List.of() : List.copyOf(failures);
        }
    }
}
