package com.kolsignal.backend.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class FetchResilienceConfig {

    @Bean
    public TimeLimiter fetchTimeLimiter(PipelineProperties pipelineProperties) {
        PipelineProperties.Fetch fetch = pipelineProperties.getFetch();
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(fetch.getTimeoutMs()))
                .cancelRunningFuture(fetch.isCancelRunningFuture())
                .build();
        return TimeLimiter.of("upstream-fetch", config);
    }
}
