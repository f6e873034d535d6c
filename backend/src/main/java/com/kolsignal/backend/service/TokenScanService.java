package com.kolsignal.backend.service;

import com.kolsignal.backend.trading.pipeline.EvaluationOutcome;
import com.kolsignal.backend.trading.pipeline.EvaluationResult;
import com.kolsignal.backend.trading.pipeline.TokenEvaluationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Evaluates a batch of candidate tokens in parallel. A failure on one token is logged
 * and reported as {@link EvaluationOutcome#ERROR}; the rest of the batch carries on.
 */
@Service
@Slf4j
public class TokenScanService {

    private final TokenEvaluationService tokenEvaluationService;
    private final PipelineMetrics pipelineMetrics;
    private final Executor evaluationExecutor;

    public TokenScanService(TokenEvaluationService tokenEvaluationService,
                            PipelineMetrics pipelineMetrics,
                            @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        this.tokenEvaluationService = tokenEvaluationService;
        this.pipelineMetrics = pipelineMetrics;
        this.evaluationExecutor = evaluationExecutor;
    }

    public List<EvaluationResult> scan(List<String> tokenAddresses) {
        if (tokenAddresses == null || tokenAddresses.isEmpty()) {
            return List.of();
        }
        List<String> candidates = new ArrayList<>(new LinkedHashSet<>(tokenAddresses));
        log.info("🔭 Parallel scanning {} tokens...", candidates.size());

        List<CompletableFuture<EvaluationResult>> futures = candidates.stream()
                .map(address -> CompletableFuture.supplyAsync(() -> evaluateSafely(address), evaluationExecutor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<EvaluationResult> results = new ArrayList<>(futures.stream().map(CompletableFuture::join).toList());
        results.sort(Comparator.comparingDouble(EvaluationResult::compositeScore).reversed());

        long sent = results.stream().filter(r -> r.outcome().signalSent()).count();
        long errors = results.stream().filter(r -> r.outcome() == EvaluationOutcome.ERROR).count();
        log.info("🏁 Scan complete: {} evaluated, {} signals, {} errors", results.size(), sent, errors);
        return results;
    }

    private EvaluationResult evaluateSafely(String address) {
        try {
            return tokenEvaluationService.evaluate(address);
        } catch (RuntimeException e) {
            log.error("Evaluation error {}: {}", address, e.getMessage(), e);
            pipelineMetrics.recordOutcome(EvaluationOutcome.ERROR);
            return EvaluationResult.stopped(address, EvaluationOutcome.ERROR,
                    List.of(e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }
}
