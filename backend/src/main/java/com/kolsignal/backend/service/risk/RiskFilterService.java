package com.kolsignal.backend.service.risk;

import com.kolsignal.backend.model.ScamFilterOutput;
import com.kolsignal.backend.model.TokenMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Runs the ordered risk cascade. Flags accumulate, the result only escalates, and the
 * first REJECT ends the run.
 */
@Service
@Slf4j
public class RiskFilterService {

    private final List<RiskStage> stages;
    private final RiskFilterDataCollector dataCollector;

    public RiskFilterService(List<RiskStage> stages, RiskFilterDataCollector dataCollector) {
        this.stages = stages.stream()
                .sorted(Comparator.comparingInt(RiskStage::order))
                .toList();
        this.dataCollector = dataCollector;
    }

    public ScamFilterOutput filterToken(String tokenAddress) {
        return filterToken(tokenAddress, null);
    }

    public ScamFilterOutput filterToken(String tokenAddress, TokenMetrics knownMetrics) {
        return evaluate(dataCollector.collect(tokenAddress, knownMetrics).join());
    }

    public ScamFilterOutput evaluate(RiskFilterInput input) {
        FilterOutputDraft draft = new FilterOutputDraft();
        for (RiskStage stage : stages) {
            StageVerdict verdict = stage.evaluate(input);
            stage.record(input, draft);
            draft.apply(verdict);
            if (verdict.outcome() != StageVerdict.Outcome.CONTINUE) {
                log.debug("Stage {} on {}: {} {}", stage.name(), input.tokenAddress(), verdict.outcome(), verdict.flags());
            }
            if (verdict.terminal()) {
                log.info("⛔ {} rejected at stage {}: {}", input.tokenAddress(), stage.name(), verdict.flags());
                break;
            }
        }
        ScamFilterOutput output = draft.build();
        log.info("🛡️ Risk filter {} -> {} ({} flags)", input.tokenAddress(), output.result(), output.flags().size());
        return output;
    }

    public List<String> stageNames() {
        return stages.stream().map(RiskStage::name).toList();
    }
}
