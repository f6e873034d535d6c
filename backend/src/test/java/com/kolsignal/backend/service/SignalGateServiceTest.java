package com.kolsignal.backend.service;

import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.Confidence;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.FilterResult;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.RiskLevel;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.ScoreFactors;
import com.kolsignal.backend.model.ScoringProfile;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.service.datasource.KolActivityProvider;
import com.kolsignal.backend.util.TestTokenFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SignalGateServiceTest {

    private final KolActivityProvider kolActivityProvider = mock(KolActivityProvider.class);
    private final SignalGateService service = new SignalGateService(new SignalProperties(), kolActivityProvider);

    @Test
    void buyGateChecksScoreFirst() {
        SignalGateService.GateDecision decision = service.meetsBuyRequirements(score(44), List.of());

        assertThat(decision.meets()).isFalse();
        assertThat(decision.reason()).isEqualTo("Score 44 below minimum 45");
    }

    @Test
    void buyGateRequiresKolActivity() {
        SignalGateService.GateDecision decision = service.meetsBuyRequirements(score(120), List.of());

        assertThat(decision.meets()).isFalse();
        assertThat(decision.reason()).isEqualTo("No KOL activity detected");
    }

    @Test
    void buyGateRequiresOneQualifyingKol() {
        KolWalletActivity weak = TestTokenFactory.sideWalletBuy("weak", 1, 3);
        KolWalletActivity strong = TestTokenFactory.mainWalletBuy("strong", 20, 80);
        when(kolActivityProvider.meetsSignalRequirements(weak)).thenReturn(false);
        when(kolActivityProvider.meetsSignalRequirements(strong)).thenReturn(true);

        assertThat(service.meetsBuyRequirements(score(60), List.of(weak)).reason())
                .isEqualTo("No KOL activity meets confidence requirements");
        assertThat(service.meetsBuyRequirements(score(60), List.of(weak, strong)).meets()).isTrue();
    }

    @Test
    void failingRequirementCheckDoesNotQualify() {
        when(kolActivityProvider.meetsSignalRequirements(any())).thenThrow(new IllegalStateException("tracker down"));

        SignalGateService.GateDecision decision = service.meetsBuyRequirements(score(90),
                List.of(TestTokenFactory.mainWalletBuy("alpha", 10, 50)));

        assertThat(decision.meets()).isFalse();
    }

    @Test
    void discoveryGatePassesHealthyDiscovery() {
        SignalGateService.GateDecision decision = service.meetsDiscoveryRequirements(score(50), TestTokenFactory.cleanFilter());

        assertThat(decision.meets()).isTrue();
        assertThat(decision.reason()).isNull();
    }

    @Test
    void discoveryGateAllowsOneActiveAuthority() {
        ScamFilterOutput filter = filter(FilterResult.FLAG, new ContractAnalysis(false, true, false, false));

        assertThat(service.meetsDiscoveryRequirements(score(50), filter).meets()).isTrue();
    }

    @Test
    void discoveryGateBlocks() {
        assertThat(service.meetsDiscoveryRequirements(score(40), TestTokenFactory.cleanFilter()).reason())
                .isEqualTo("Score 40 below discovery minimum 45");
        assertThat(service.meetsDiscoveryRequirements(score(80),
                filter(FilterResult.REJECT, TestTokenFactory.revokedContract())).reason())
                .isEqualTo("Failed safety checks");
        assertThat(service.meetsDiscoveryRequirements(score(80),
                filter(FilterResult.FLAG, new ContractAnalysis(false, false, false, false))).reason())
                .isEqualTo("Both mint and freeze authorities still enabled");
        assertThat(service.meetsDiscoveryRequirements(score(80),
                filter(FilterResult.FLAG, new ContractAnalysis(true, true, false, true))).reason())
                .isEqualTo("Known scam template detected");
    }

    @Test
    void nullInputsAreNotMet() {
        assertThat(service.meetsBuyRequirements(null, null).meets()).isFalse();
        assertThat(service.meetsDiscoveryRequirements(score(90), null).meets()).isFalse();
    }

    private ScamFilterOutput filter(FilterResult result, ContractAnalysis contract) {
        return new ScamFilterOutput(result, List.of(), contract, BundleAnalysis.neutral(), null, 0);
    }

    private TokenScore score(double composite) {
        return new TokenScore(TestTokenFactory.ADDRESS, composite, new ScoreFactors(0, 0, 0, 0, 0, 0, 0),
                Confidence.MEDIUM, 12, List.of(), RiskLevel.MEDIUM, ScoringProfile.DISCOVERY, FilterResult.PASS);
    }
}
