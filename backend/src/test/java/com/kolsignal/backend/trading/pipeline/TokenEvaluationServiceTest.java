package com.kolsignal.backend.trading.pipeline;

import com.kolsignal.backend.config.PipelineProperties;
import com.kolsignal.backend.config.RiskFilterProperties;
import com.kolsignal.backend.config.ScoringProperties;
import com.kolsignal.backend.config.SignalProperties;
import com.kolsignal.backend.exception.InvalidTokenAddressException;
import com.kolsignal.backend.model.BundleAnalysis;
import com.kolsignal.backend.model.ContractAnalysis;
import com.kolsignal.backend.model.FilterResult;
import com.kolsignal.backend.model.SignalType;
import com.kolsignal.backend.model.SocialMetrics;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.model.TradeSignal;
import com.kolsignal.backend.service.DataFetchService;
import com.kolsignal.backend.service.PipelineMetrics;
import com.kolsignal.backend.service.QuickScreenService;
import com.kolsignal.backend.service.SignalBuilderService;
import com.kolsignal.backend.service.SignalGateService;
import com.kolsignal.backend.service.TokenScreeningService;
import com.kolsignal.backend.service.datasource.DiscoveryLedger;
import com.kolsignal.backend.service.datasource.KolActivityProvider;
import com.kolsignal.backend.service.datasource.OnChainDataProvider;
import com.kolsignal.backend.service.datasource.PositionTracker;
import com.kolsignal.backend.service.datasource.RugWalletRegistry;
import com.kolsignal.backend.service.datasource.SignalPublisher;
import com.kolsignal.backend.service.datasource.SocialDataProvider;
import com.kolsignal.backend.service.risk.RiskFilterDataCollector;
import com.kolsignal.backend.service.risk.RiskFilterService;
import com.kolsignal.backend.service.scoring.CompositeScoringService;
import com.kolsignal.backend.util.TestTokenFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static com.kolsignal.backend.util.TestTokenFactory.ADDRESS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TokenEvaluationServiceTest {

    private PositionTracker positionTracker;
    private OnChainDataProvider onChainDataProvider;
    private SocialDataProvider socialDataProvider;
    private KolActivityProvider kolActivityProvider;
    private DiscoveryLedger discoveryLedger;
    private SignalPublisher signalPublisher;
    private SimpleMeterRegistry meterRegistry;
    private CompositeScoringService compositeScoringService;
    private TokenEvaluationService service;

    @BeforeEach
    void setUp() {
        positionTracker = mock(PositionTracker.class);
        onChainDataProvider = mock(OnChainDataProvider.class);
        socialDataProvider = mock(SocialDataProvider.class);
        kolActivityProvider = mock(KolActivityProvider.class);
        discoveryLedger = mock(DiscoveryLedger.class);
        signalPublisher = mock(SignalPublisher.class);
        RugWalletRegistry rugWalletRegistry = mock(RugWalletRegistry.class);
        meterRegistry = new SimpleMeterRegistry();

        when(positionTracker.hasOpenPosition(anyString())).thenReturn(false);
        when(onChainDataProvider.analyzeContract(anyString())).thenReturn(TestTokenFactory.revokedContract());
        when(onChainDataProvider.getTokenMetrics(anyString())).thenReturn(TestTokenFactory.healthyMetrics());
        when(onChainDataProvider.isHoneypot(anyString())).thenReturn(false);
        when(onChainDataProvider.analyzeBundles(anyString())).thenReturn(BundleAnalysis.neutral());
        when(onChainDataProvider.getVolumeAuthenticity(anyString())).thenReturn(TestTokenFactory.authenticVolume());
        when(onChainDataProvider.getTopHolders(anyString(), anyInt())).thenReturn(List.of());
        when(socialDataProvider.getSocialMetrics(anyString())).thenReturn(SocialMetrics.empty());
        when(kolActivityProvider.getKolActivity(anyString(), any())).thenReturn(List.of());
        when(kolActivityProvider.calculateSignalWeight(any())).thenReturn(0.6);
        when(kolActivityProvider.meetsSignalRequirements(any())).thenReturn(true);
        when(discoveryLedger.findDiscovery(anyString())).thenReturn(Optional.empty());

        ScoringProperties scoringProperties = new ScoringProperties();
        SignalProperties signalProperties = new SignalProperties();
        RiskFilterProperties riskFilterProperties = new RiskFilterProperties();
        DataFetchService dataFetchService = TestTokenFactory.directFetchService();
        RiskFilterDataCollector collector = new RiskFilterDataCollector(dataFetchService, onChainDataProvider,
                rugWalletRegistry, riskFilterProperties);
        compositeScoringService = TestTokenFactory.compositeScoring(scoringProperties, kolActivityProvider);

        service = new TokenEvaluationService(
                new PipelineProperties(),
                dataFetchService,
                positionTracker,
                new QuickScreenService(dataFetchService, onChainDataProvider),
                onChainDataProvider,
                socialDataProvider,
                kolActivityProvider,
                discoveryLedger,
                new TokenScreeningService(signalProperties),
                collector,
                new RiskFilterService(TestTokenFactory.defaultStages(riskFilterProperties), collector),
                compositeScoringService,
                new SignalGateService(signalProperties, kolActivityProvider),
                new SignalBuilderService(signalProperties, scoringProperties),
                signalPublisher,
                new PipelineMetrics(meterRegistry));
    }

    @Test
    void sendsDiscoveryWhenNoKolActivity() {
        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.DISCOVERY_SENT);
        assertThat(result.compositeScore()).isEqualTo(100.0);
        assertThat(result.signal().signalType()).isEqualTo(SignalType.DISCOVERY);
        assertThat(result.signal().primaryKolActivity()).isNull();
        verify(signalPublisher).publish(result.signal());
        verify(discoveryLedger).recordDiscovery(result.signal());
        assertThat(meterRegistry.get("token_evaluations_total").tag("outcome", "DISCOVERY_SENT").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("risk_filter_results_total").tag("result", "PASS").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void sendsBuyWhenKolBoughtWithoutPriorDiscovery() {
        when(kolActivityProvider.getKolActivity(anyString(), any()))
                .thenReturn(List.of(TestTokenFactory.mainWalletBuy("alpha", 15, 50)));

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.BUY_SENT);
        assertThat(result.compositeScore()).isEqualTo(77.0);
        assertThat(result.signal().signalType()).isEqualTo(SignalType.BUY);
        assertThat(result.signal().primaryKolActivity().kol().handle()).isEqualTo("@alpha");
        verify(signalPublisher).publish(result.signal());
        verify(discoveryLedger, never()).recordDiscovery(any());
        verify(discoveryLedger, never()).markValidated(anyString());
    }

    @Test
    void sendsKolValidationWhenDiscoveryPreceded() {
        TokenScore discoveryScore = compositeScoringService.calculateDiscoveryScore(ADDRESS,
                TestTokenFactory.healthyMetrics(), SocialMetrics.empty(), TestTokenFactory.authenticVolume(),
                TestTokenFactory.cleanFilter());
        TradeSignal previous = TradeSignal.builder()
                .id("disc_0123456789abcdef")
                .tokenAddress(ADDRESS)
                .score(discoveryScore)
                .signalType(SignalType.DISCOVERY)
                .build();
        when(discoveryLedger.findDiscovery(ADDRESS)).thenReturn(Optional.of(previous));
        when(kolActivityProvider.getKolActivity(anyString(), any()))
                .thenReturn(List.of(TestTokenFactory.mainWalletBuy("alpha", 15, 50)));

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.KOL_VALIDATION_SENT);
        assertThat(result.compositeScore()).isEqualTo(125.0);
        assertThat(result.score().flags()).contains("KOL_VALIDATED").doesNotContain("DISCOVERY_SIGNAL");
        assertThat(result.signal().signalType()).isEqualTo(SignalType.KOL_VALIDATION);
        verify(discoveryLedger).markValidated(ADDRESS);
        assertThat(meterRegistry.get("signals_emitted_total").tag("type", "KOL_VALIDATION")
                .tag("score_bucket", "90+").counter().count()).isEqualTo(1.0);
    }

    @Test
    void stopsOnHoneypot() {
        when(onChainDataProvider.isHoneypot(ADDRESS)).thenReturn(true);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.SCAM_REJECTED);
        assertThat(result.filterOutput().result()).isEqualTo(FilterResult.REJECT);
        assertThat(result.reasons()).anyMatch(reason -> reason.startsWith("HONEYPOT:"));
        assertThat(result.score()).isNull();
        verify(signalPublisher, never()).publish(any());
    }

    @Test
    void skipsTokenWithOpenPosition() {
        when(positionTracker.hasOpenPosition(ADDRESS)).thenReturn(true);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.SKIPPED_OPEN_POSITION);
        assertThat(result.reasons()).containsExactly("Open position exists");
        verify(onChainDataProvider, never()).getTokenMetrics(anyString());
    }

    @Test
    void skipsTokenWhenPositionCheckFails() {
        when(positionTracker.hasOpenPosition(ADDRESS)).thenThrow(new IllegalStateException("tracker down"));

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.SKIPPED_OPEN_POSITION);
        assertThat(result.reasons()).containsExactly("Position check unavailable");
    }

    @Test
    void stopsOnScamTemplateBeforeFetchingMetrics() {
        when(onChainDataProvider.analyzeContract(ADDRESS)).thenReturn(new ContractAnalysis(true, true, false, true));

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.QUICK_SCREEN_FAILED);
        assertThat(result.reasons()).containsExactly("Known scam contract template");
        verify(onChainDataProvider, never()).getTokenMetrics(anyString());
    }

    @Test
    void stopsWithoutMetrics() {
        when(onChainDataProvider.getTokenMetrics(ADDRESS)).thenReturn(null);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.NO_METRICS);
        verify(onChainDataProvider, never()).isHoneypot(anyString());
    }

    @Test
    void stopsWhenScreeningFails() {
        when(onChainDataProvider.getTokenMetrics(ADDRESS))
                .thenReturn(TestTokenFactory.healthyMetricsBuilder().marketCap(10_000).build());

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.SCREENING_FAILED);
        assertThat(result.reasons()).anyMatch(reason -> reason.startsWith("MCAP_LOW"));
        verify(onChainDataProvider, never()).isHoneypot(anyString());
    }

    @Test
    void reportsBelowThresholdWhenNoKolQualifies() {
        when(kolActivityProvider.getKolActivity(anyString(), any()))
                .thenReturn(List.of(TestTokenFactory.mainWalletBuy("alpha", 15, 50)));
        when(kolActivityProvider.meetsSignalRequirements(any())).thenReturn(false);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.BELOW_THRESHOLD);
        assertThat(result.reasons()).containsExactly("No KOL activity meets confidence requirements");
        assertThat(result.score()).isNotNull();
        assertThat(result.signal()).isNull();
        verify(signalPublisher, never()).publish(any());
    }

    @Test
    void discoveryBlockedWhenBothAuthoritiesActive() {
        when(onChainDataProvider.analyzeContract(ADDRESS)).thenReturn(new ContractAnalysis(false, false, false, false));
        when(onChainDataProvider.getTokenMetrics(ADDRESS))
                .thenReturn(TestTokenFactory.healthyMetricsBuilder().tokenAge(10).build());

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.BELOW_THRESHOLD);
        assertThat(result.reasons()).containsExactly("Both mint and freeze authorities still enabled");
        verify(discoveryLedger, never()).recordDiscovery(any());
    }

    @Test
    void degradesMissingSocialAndVolumeData() {
        when(socialDataProvider.getSocialMetrics(anyString())).thenThrow(new IllegalStateException("rate limited"));
        when(onChainDataProvider.getVolumeAuthenticity(anyString())).thenReturn(null);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.DISCOVERY_SENT);
        assertThat(result.signal().socialMetrics()).isEqualTo(SocialMetrics.empty());
    }

    @Test
    void discoveryStaysSentWhenLedgerFails() {
        doThrow(new IllegalStateException("ledger down")).when(discoveryLedger).recordDiscovery(any());

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.DISCOVERY_SENT);
        verify(signalPublisher).publish(result.signal());
        assertThat(meterRegistry.get("signals_emitted_total").tag("type", "DISCOVERY").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void kolValidationStaysSentWhenLedgerFails() {
        TokenScore discoveryScore = compositeScoringService.calculateDiscoveryScore(ADDRESS,
                TestTokenFactory.healthyMetrics(), SocialMetrics.empty(), TestTokenFactory.authenticVolume(),
                TestTokenFactory.cleanFilter());
        when(discoveryLedger.findDiscovery(ADDRESS)).thenReturn(Optional.of(TradeSignal.builder()
                .id("disc_0123456789abcdef")
                .tokenAddress(ADDRESS)
                .score(discoveryScore)
                .signalType(SignalType.DISCOVERY)
                .build()));
        when(kolActivityProvider.getKolActivity(anyString(), any()))
                .thenReturn(List.of(TestTokenFactory.mainWalletBuy("alpha", 15, 50)));
        doThrow(new IllegalStateException("ledger down")).when(discoveryLedger).markValidated(ADDRESS);

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.KOL_VALIDATION_SENT);
        verify(signalPublisher).publish(result.signal());
    }

    @Test
    void failedDeliveryIsReportedAndNotRecorded() {
        doThrow(new IllegalStateException("telegram 502")).when(signalPublisher).publish(any());

        EvaluationResult result = service.evaluate(ADDRESS);

        assertThat(result.outcome()).isEqualTo(EvaluationOutcome.PUBLISH_FAILED);
        assertThat(result.outcome().signalSent()).isFalse();
        assertThat(result.signal()).isNotNull();
        assertThat(result.reasons()).containsExactly("Signal delivery failed or unconfirmed");
        verify(discoveryLedger, never()).recordDiscovery(any());
        assertThat(meterRegistry.find("signals_emitted_total").counter()).isNull();
        assertThat(meterRegistry.get("token_evaluations_total").tag("outcome", "PUBLISH_FAILED").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void rejectsMalformedAddress() {
        assertThatThrownBy(() -> service.evaluate("not-a-token!"))
                .isInstanceOf(InvalidTokenAddressException.class);
        verify(positionTracker, never()).hasOpenPosition(anyString());
    }

    @Test
    void recordsLatencyForEveryEvaluation() {
        service.evaluate(ADDRESS);
        when(positionTracker.hasOpenPosition(ADDRESS)).thenReturn(true);
        service.evaluate(ADDRESS);

        assertThat(meterRegistry.get("token_evaluation_latency").timer().count()).isEqualTo(2L);
        verify(kolActivityProvider).getKolActivity(eq(ADDRESS), any());
    }
}
