package com.kolsignal.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
@Validated
public class PipelineProperties {

    @NotBlank
    private String addressPattern = "[1-9A-HJ-NP-Za-km-z]{32,44}";
    @Min(1)
    private long kolActivityWindowMinutes = 120;
    private Fetch fetch = new Fetch();
    @Valid
    private ExecutorPool evaluationExecutor = new ExecutorPool(4, 16, 500, 30);
    @Valid
    private ExecutorPool fetchExecutor = new ExecutorPool(16, 64, 2000, 0);

    @Data
    public static class Fetch {
        @Min(1)
        private long timeoutMs = 5000;
        private boolean cancelRunningFuture = true;
    }

    /**
     * Thread pool sizing. {@code awaitTerminationSeconds} of 0 drops queued work on shutdown.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExecutorPool {
        @Min(1)
        private int corePoolSize;
        @Min(1)
        private int maxPoolSize;
        @Min(0)
        private int queueCapacity;
        @Min(0)
        private int awaitTerminationSeconds;
    }
}
