package com.kolsignal.backend.trading.pipeline;

import com.kolsignal.backend.config.PipelineProperties;
import com.kolsignal.backend.exception.InvalidTokenAddressException;
import com.kolsignal.backend.model.KolWalletActivity;
import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.SocialMetrics;
import com.kolsignal.backend.model.TokenMetrics;
import com.kolsignal.backend.model.TokenScore;
import com.kolsignal.backend.model.TradeSignal;
import com.kolsignal.backend.model.VolumeAuthenticityScore;
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
import com.kolsignal.backend.service.datasource.SignalPublisher;
import com.kolsignal.backend.service.datasource.SocialDataProvider;
import com.kolsignal.backend.service.risk.RiskFilterDataCollector;
import com.kolsignal.backend.service.risk.RiskFilterInput;
import com.kolsignal.backend.service.risk.RiskFilterService;
import com.kolsignal.backend.service.scoring.CompositeScoringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Per-token decision flow: cheap gates first, then concurrent data gathering, the
 * risk cascade, scoring and one of three signal paths.
 */
@Service
@Slf4j
public class TokenEvaluationService {

    private final PipelineProperties pipelineProperties;
    private final DataFetchService dataFetchService;
    private final PositionTracker positionTracker;
    private final QuickScreenService quickScreenService;
    private final OnChainDataProvider onChainDataProvider;
    private final SocialDataProvider socialDataProvider;
    private final KolActivityProvider kolActivityProvider;
    private final DiscoveryLedger discoveryLedger;
    private final TokenScreeningService tokenScreeningService;
    private final RiskFilterDataCollector riskFilterDataCollector;
    private final RiskFilterService riskFilterService;
    private final CompositeScoringService compositeScoringService;
    private final SignalGateService signalGateService;
    private final SignalBuilderService signalBuilderService;
    private final SignalPublisher signalPublisher;
    private final PipelineMetrics pipelineMetrics;
    private final Pattern addressPattern;

    public TokenEvaluationService(PipelineProperties pipelineProperties,
                                  DataFetchService dataFetchService,
                                  PositionTracker positionTracker,
                                  QuickScreenService quickScreenService,
                                  OnChainDataProvider onChainDataProvider,
                                  SocialDataProvider socialDataProvider,
                                  KolActivityProvider kolActivityProvider,
                                  DiscoveryLedger discoveryLedger,
                                  TokenScreeningService tokenScreeningService,
                                  RiskFilterDataCollector riskFilterDataCollector,
                                  RiskFilterService riskFilterService,
                                  CompositeScoringService compositeScoringService,
                                  SignalGateService signalGateService,
                                  SignalBuilderService signalBuilderService,
                                  SignalPublisher signalPublisher,
                                  PipelineMetrics pipelineMetrics) {
        this.pipelineProperties = pipelineProperties;
        this.dataFetchService = dataFetchService;
        this.positionTracker = positionTracker;
        this.quickScreenService = quickScreenService;
        this.onChainDataProvider = onChainDataProvider;
        this.socialDataProvider = socialDataProvider;
        this.kolActivityProvider = kolActivityProvider;
        this.discoveryLedger = discoveryLedger;
        this.tokenScreeningService = tokenScreeningService;
        this.riskFilterDataCollector = riskFilterDataCollector;
        this.riskFilterService = riskFilterService;
        this.compositeScoringService = compositeScoringService;
        this.signalGateService = signalGateService;
        this.signalBuilderService = signalBuilderService;
        this.signalPublisher = signalPublisher;
        this.pipelineMetrics = pipelineMetrics;
        this.addressPattern = Pattern.compile(pipelineProperties.getAddressPattern());
    }

    public EvaluationResult evaluate(String tokenAddress) {
        if (tokenAddress == null || !addressPattern.matcher(tokenAddress).matches()) {
            throw new InvalidTokenAddressException(tokenAddress);
        }
        long started = System.nanoTime();
        EvaluationResult result = runPipeline(tokenAddress);
        pipelineMetrics.recordOutcome(result.outcome());
        pipelineMetrics.recordEvaluationLatency(Duration.ofNanos(System.nanoTime() - started));
        return result;
    }

    private EvaluationResult runPipeline(String tokenAddress) {
        Optional<Boolean> openPosition = dataFetchService.fetch("open-position", tokenAddress,
                () -> positionTracker.hasOpenPosition(tokenAddress));
        if (openPosition.isEmpty() || openPosition.get()) {
            String reason = openPosition.isEmpty() ? "Position check unavailable" : "Open position exists";
            log.debug("Skipping {}: {}", tokenAddress, reason);
            return EvaluationResult.stopped(tokenAddress, EvaluationOutcome.SKIPPED_OPEN_POSITION, List.of(reason));
        }

        QuickScreenService.QuickCheckResult quickCheck = quickScreenService.quickCheck(tokenAddress);
        if (!quickCheck.pass()) {
            return EvaluationResult.stopped(tokenAddress, EvaluationOutcome.QUICK_SCREEN_FAILED,
                    List.of(quickCheck.reason()));
        }

        Optional<TokenMetrics> metricsResult = dataFetchService.fetch("token-metrics", tokenAddress,
                () -> onChainDataProvider.getTokenMetrics(tokenAddress));
        if (metricsResult.isEmpty()) {
            log.info("No metrics for {}", tokenAddress);
            return EvaluationResult.stopped(tokenAddress, EvaluationOutcome.NO_METRICS,
                    List.of("Token metrics unavailable"));
        }
        TokenMetrics metrics = metricsResult.get();

        TokenScreeningService.ScreeningResult screening = tokenScreeningService.screen(metrics);
        if (!screening.passed()) {
            log.info("Screening failed for {} ({}): {}", metrics.ticker(), tokenAddress, screening.failures());
            return EvaluationResult.stopped(tokenAddress, EvaluationOutcome.SCREENING_FAILED, screening.failures());
        }

        Duration kolWindow = Duration.ofMinutes(pipelineProperties.getKolActivityWindowMinutes());
        CompletableFuture<RiskFilterInput> filterInputFuture = riskFilterDataCollector.collect(tokenAddress, metrics);
        CompletableFuture<Optional<SocialMetrics>> socialFuture = dataFetchService.fetchAsync("social", tokenAddress,
                () -> socialDataProvider.getSocialMetrics(tokenAddress));
        CompletableFuture<Optional<VolumeAuthenticityScore>> volumeFuture = dataFetchService.fetchAsync(
                "volume-authenticity", tokenAddress, () -> onChainDataProvider.getVolumeAuthenticity(tokenAddress));
        CompletableFuture<Optional<List<KolWalletActivity>>> kolFuture = dataFetchService.fetchAsync("kol-activity",
                tokenAddress, () -> kolActivityProvider.getKolActivity(tokenAddress, kolWindow));
        CompletableFuture<Optional<TradeSignal>> discoveryFuture = dataFetchService.fetchAsync("discovery-ledger",
                tokenAddress, () -> discoveryLedger.findDiscovery(tokenAddress).orElse(null));
        CompletableFuture.allOf(filterInputFuture, socialFuture, volumeFuture, kolFuture, discoveryFuture).join();

        ScamFilterOutput filter = riskFilterService.evaluate(filterInputFuture.join());
        pipelineMetrics.recordFilterResult(filter.result());
        if (filter.rejected()) {
            return new EvaluationResult(tokenAddress, EvaluationOutcome.SCAM_REJECTED, filter.flags(), filter, null, null);
        }

        TokenContext context = new TokenContext(
                metrics,
                socialFuture.join().orElseGet(SocialMetrics::empty),
                volumeFuture.join().orElseGet(VolumeAuthenticityScore::neutral),
                filter,
                kolFuture.join().orElse(List.of()));
        Optional<TradeSignal> previousDiscovery = discoveryFuture.join();

        if (!context.activities().isEmpty()) {
            log.info("👀 {} KOL buys on {} ({})", context.activities().size(), metrics.ticker(), tokenAddress);
            if (previousDiscovery.isPresent() && previousDiscovery.get().score() != null) {
                return kolValidationPath(tokenAddress, context, previousDiscovery.get());
            }
            return buyPath(tokenAddress, context);
        }
        return discoveryPath(tokenAddress, context);
    }

    private EvaluationResult kolValidationPath(String tokenAddress, TokenContext context, TradeSignal discovery) {
        TokenScore score = compositeScoringService.applyKolMultiplier(discovery.score(), context.activities());
        log.info("KOL validation for {}: {} -> {}", tokenAddress, discovery.score().compositeScore(), score.compositeScore());
        SignalGateService.GateDecision gate = signalGateService.meetsBuyRequirements(score, context.activities());
        if (!gate.meets()) {
            return belowThreshold(tokenAddress, context.filter(), score, gate);
        }
        TradeSignal signal = signalBuilderService.buildKolValidationSignal(context.metrics(), context.social(),
                context.volumeAuthenticity(), context.filter(), score, context.activities());
        if (!publish(signal)) {
            return deliveryFailed(tokenAddress, context.filter(), score, signal);
        }
        updateLedger("discovery-ledger-validate", tokenAddress, () -> discoveryLedger.markValidated(tokenAddress));
        return sent(tokenAddress, EvaluationOutcome.KOL_VALIDATION_SENT, context.filter(), score, signal);
    }

    private EvaluationResult buyPath(String tokenAddress, TokenContext context) {
        TokenScore score = compositeScoringService.calculateScore(tokenAddress, context.metrics(), context.social(),
                context.volumeAuthenticity(), context.filter(), context.activities());
        SignalGateService.GateDecision gate = signalGateService.meetsBuyRequirements(score, context.activities());
        if (!gate.meets()) {
            return belowThreshold(tokenAddress, context.filter(), score, gate);
        }
        TradeSignal signal = signalBuilderService.buildBuySignal(context.metrics(), context.social(),
                context.volumeAuthenticity(), context.filter(), score, context.activities());
        if (!publish(signal)) {
            return deliveryFailed(tokenAddress, context.filter(), score, signal);
        }
        return sent(tokenAddress, EvaluationOutcome.BUY_SENT, context.filter(), score, signal);
    }

    private EvaluationResult discoveryPath(String tokenAddress, TokenContext context) {
        TokenScore score = compositeScoringService.calculateDiscoveryScore(tokenAddress, context.metrics(),
                context.social(), context.volumeAuthenticity(), context.filter());
        SignalGateService.GateDecision gate = signalGateService.meetsDiscoveryRequirements(score, context.filter());
        if (!gate.meets()) {
            return belowThreshold(tokenAddress, context.filter(), score, gate);
        }
        TradeSignal signal = signalBuilderService.buildDiscoverySignal(context.metrics(), context.social(),
                context.volumeAuthenticity(), context.filter(), score);
        if (!publish(signal)) {
            return deliveryFailed(tokenAddress, context.filter(), score, signal);
        }
        updateLedger("discovery-ledger-record", tokenAddress, () -> discoveryLedger.recordDiscovery(signal));
        return sent(tokenAddress, EvaluationOutcome.DISCOVERY_SENT, context.filter(), score, signal);
    }

    /**
     * @return false when delivery failed or did not confirm within the fetch time limit
     */
    private boolean publish(TradeSignal signal) {
        Optional<Boolean> delivered = dataFetchService.fetch("signal-publish", signal.tokenAddress(), () -> {
            signalPublisher.publish(signal);
            return Boolean.TRUE;
        });
        if (delivered.isEmpty()) {
            log.error("❌ {} signal {} for {} not delivered", signal.signalType(), signal.id(), signal.tokenAddress());
            return false;
        }
        pipelineMetrics.recordSignal(signal.signalType(), signal.score().compositeScore());
        log.info("✅ {} signal {} for {} [Score: {}, Risk: {}, Size: {}%]", signal.signalType(), signal.id(),
                signal.tokenTicker(), signal.score().compositeScore(), signal.score().riskLevel(),
                signal.positionSizePercent());
        return true;
    }

    /**
     * Ledger bookkeeping after a delivered signal. A failure is logged and never turns a
     * sent signal into a failed evaluation.
     */
    private void updateLedger(String source, String tokenAddress, Runnable update) {
        Optional<Boolean> updated = dataFetchService.fetch(source, tokenAddress, () -> {
            update.run();
            return Boolean.TRUE;
        });
        if (updated.isEmpty()) {
            log.warn("⚠️ Ledger update {} failed for {} after signal was sent", source, tokenAddress);
        }
    }

    private EvaluationResult deliveryFailed(String tokenAddress, ScamFilterOutput filter, TokenScore score,
                                            TradeSignal signal) {
        return new EvaluationResult(tokenAddress, EvaluationOutcome.PUBLISH_FAILED,
                List.of("Signal delivery failed or unconfirmed"), filter, score, signal);
    }

    private EvaluationResult belowThreshold(String tokenAddress, ScamFilterOutput filter, TokenScore score,
                                            SignalGateService.GateDecision gate) {
        log.info("Gate not met for {} [Score: {}]: {}", tokenAddress, score.compositeScore(), gate.reason());
        return new EvaluationResult(tokenAddress, EvaluationOutcome.BELOW_THRESHOLD, List.of(gate.reason()),
                filter, score, null);
    }

    private EvaluationResult sent(String tokenAddress, EvaluationOutcome outcome, ScamFilterOutput filter,
                                  TokenScore score, TradeSignal signal) {
        return new EvaluationResult(tokenAddress, outcome, score.flags(), filter, score, signal);
    }

    private record TokenContext(
            TokenMetrics metrics,
            SocialMetrics social,
            VolumeAuthenticityScore volumeAuthenticity,
            ScamFilterOutput filter,
            List<KolWalletActivity> activities
    ) {}
}
