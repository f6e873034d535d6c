package com.kolsignal.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "risk-filter")
@Data
@Validated
public class RiskFilterProperties {

    private Contract contract = new Contract();
    private Bundle bundle = new Bundle();
    private DevWallet devWallet = new DevWallet();
    private RugHistory rugHistory = new RugHistory();

    @Data
    public static class Contract {
        // New launches legitimately keep mint authority for a short while
        @PositiveOrZero
        private double mintAuthorityGraceMinutes = 30.0;
    }

    @Data
    public static class Bundle {
        @Positive
        private double highRiskSupplyPercent = 25.0;

        @Positive
        private double mediumRiskSupplyPercent = 10.0;
    }

    @Data
    public static class DevWallet {
        @Positive
        private double hardDumpPercent = 30.0;

        @Positive
        private double highSellPercent = 10.0;

        @Positive
        private double flagSellPercent = 5.0;
    }

    @Data
    public static class RugHistory {
        @Min(1)
        private int rejectCount = 3;

        @Min(1)
        private int flagCount = 1;

        @Min(1)
        private int topHolderLimit = 20;
    }
}
