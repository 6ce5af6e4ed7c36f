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

/**
 * Tunables for the online decision path: edge history, gate bands, quality scoring and the failure blacklist.
 */
@Configuration
@ConfigurationProperties(prefix = "edgegate")
@Data
@Validated
public class EdgeGateProperties {

    @Valid
    private Stats stats = new Stats();
    @Valid
    private Gate gate = new Gate();
    @Valid
    private Quality quality = new Quality();
    @Valid
    private Blacklist blacklist = new Blacklist();
    @Valid
    private Miner miner = new Miner();
    @Valid
    private Diagnostics diagnostics = new Diagnostics();

    @Data
    public static class Stats {
        @Min(1)
        private int maxWindow = 1000;

        @Min(1)
        private int minSample = 50;

        private boolean persistenceEnabled = true;
    }

    @Data
    public static class Gate {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minConfidence = 0.55;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double percentileProbeSmall = 0.60;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double percentileProbeMedium = 0.75;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double percentileFull = 0.90;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probeSmallMultiplier = 0.10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double probeMediumMultiplier = 0.25;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fullMultiplier = 1.0;

        @Positive
        private double probeStopMultiplier = 0.7;

        // Used in place of a percentile while a key is still below the minimum sample count.
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double insufficientSamplePercentile = 0.60;
    }

    @Data
    public static class Quality {
        private boolean enabled = true;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double minQualityScore = 60.0;

        private double signalStrengthWeight = 0.30;
        private double marketStateMatchWeight = 0.25;
        private double historicalPerformanceWeight = 0.25;
        private double riskRewardWeight = 0.20;
    }

    @Data
    public static class Blacklist {
        private boolean enabled = true;

        @Min(1)
        private int minTradesForAnalysis = 10;

        private double winRateThreshold = 0.40;
        private double expectedValueThreshold = -50.0;
        private double profitFactorThreshold = 0.8;
    }

    @Data
    public static class Miner {
        @Min(1)
        private int minSampleSize = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSeverity = 0.6;

        private double winRateThreshold = 0.42;
        private double expectedValueThreshold = -30.0;
        private double profitFactorThreshold = 0.8;
        private double combinedWinRateThreshold = 0.48;
        private double combinedExpectedValueThreshold = -10.0;
        private double winRateWeight = 0.4;
        private double expectedValueWeight = 0.4;
        private double profitFactorWeight = 0.2;
    }

    @Data
    public static class Diagnostics {
        @Min(1)
        private int maxRecent = 1000;

        private int retentionDays = 30;

        private boolean persistenceEnabled = true;
    }
}
