package com.kolsignal.backend.service;

import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.util.TestTokenFactory;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenScreeningServiceTest {

    private final TokenScreeningService service = new TokenScreeningService(new SignalProperties());

    @Test
    void healthyTokenPasses() {
        TokenScreeningService.ScreeningResult result = service.screen(TestTokenFactory.healthyMetrics());

        assertThat(result.passed()).isTrue();
        assertThat(result.failures()).isEmpty();
    }

    @Test
    void reportsEveryFailedCriterion() {
        TokenScreeningService.ScreeningResult result = service.screen(TestTokenFactory.healthyMetricsBuilder()
                .marketCap(30_000_000)
                .volume24h(200)
                .holderCount(3)
                .top10Concentration(95)
                .liquidityPool(100)
                .tokenAge(0.5)
                .build());

        assertThat(result.passed()).isFalse();
        assertThat(result.failures().stream().map(f -> f.substring(0, f.indexOf(':'))).toList())
                .containsExactly("MCAP_HIGH", "VOLUME_LOW", "VOLUME_RATIO_LOW", "HOLDERS_LOW",
                        "CONCENTRATION_HIGH", "LIQUIDITY_LOW", "TOO_NEW");
    }

    @Test
    void smallCapFails() {
        TokenScreeningService.ScreeningResult result = service.screen(TestTokenFactory.healthyMetricsBuilder()
                .marketCap(20_000)
                .volume24h(5_000)
                .build());

        assertThat(result.failures()).singleElement().asString().startsWith("MCAP_LOW");
    }

    @Test
    void missingMetricsFail() {
        assertThat(service.screen(null).passed()).isFalse();
    }
}
