package com.edgegate.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
@Validated
public class BacktestProperties {

    @Positive
    private double initialCapital = 10_000.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultPositionFraction = 0.02;

    private int sharpeAnnualization = 252;

    @Valid
    private PassCriteria pass = new PassCriteria();
    @Valid
    private WalkForward walkForward = new WalkForward();
    @Valid
    private Admission admission = new Admission();
    @Valid
    private MarketState marketState = new MarketState();

    @Data
    public static class PassCriteria {
        @Min(0)
        private int minTrades = 10;
        private double minWinRate = 0.45;
        private double minTotalPnl = 0.0;
        private double minProfitFactor = 1.1;
        // Fraction of initial capital.
        private double maxDrawdownPct = 0.30;
    }

    @Data
    public static class WalkForward {
        @Min(1)
        private int trainWindow = 1000;

        @Min(1)
        private int testWindow = 200;

        @Min(1)
        private int step = 200;

        private double minConsistency = 0.70;
        private double maxDegradation = 0.50;
        private double minTestWinRate = 0.40;
        private double minTestPnl = 0.0;
    }

    @Data
    public static class Admission {
        private int minTrades = 30;
        private double minWinRate = 0.52;
        private double minProfitFactor = 1.2;
        private double minSharpe = 0.5;
        private double minTotalPnl = 0.0;
        // Absolute currency amount; null disables the check.
        private Double maxDrawdown;
        private double maxVolatileRegimeConfidence = 0.8;
    }

    @Data
    public static class MarketState {
        @Min(1)
        private int shortLookback = 4;

        @Min(1)
        private int mediumLookback = 16;

        @Min(2)
        private int longLookback = 96;

        private double volatileThreshold = 0.05;
        private double quietThreshold = 0.01;
        private double trendThreshold = 0.02;
        private double volatileConfidenceScale = 0.10;
        private double trendConfidenceScale = 0.05;
    }
}
