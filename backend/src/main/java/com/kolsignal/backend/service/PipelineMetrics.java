package com.kolsignal.backend.service;

import com.kolsignal.backend.model.FilterResult;
import com.kolsignal.backend.model.SignalType;
import com.kolsignal.backend.trading.pipeline.EvaluationOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@RequiredArgsConstructor
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    public void recordFilterResult(FilterResult result) {
        Counter.builder("risk_filter_results_total")
                .tag("result", result.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordOutcome(EvaluationOutcome outcome) {
        Counter.builder("token_evaluations_total")
                .tag("outcome", outcome.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordSignal(SignalType type, double compositeScore) {
        Counter.builder("signals_emitted_total")
                .tag("type", type.name())
                .tag("score_bucket", scoreBucket(compositeScore))
                .register(meterRegistry)
                .increment();
    }

    public void recordEvaluationLatency(Duration duration) {
        Timer.builder("token_evaluation_latency")
                .register(meterRegistry)
                .record(duration);
    }

    static String scoreBucket(double score) {
        if (score >= 90) {
            return "90+";
        }
        if (score >= 75) {
            return "75-89";
        }
        if (score >= 60) {
            return "60-74";
        }
        return "<60";
    }
}
