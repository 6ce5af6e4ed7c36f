package com.edgegate.backend.dto;

import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.StrategyType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalEvaluationRequest {

    @NotBlank
    private String symbol;

    @NotBlank
    private String direction;

    @NotBlank
    private String timeframe;

    @NotNull
    private Double netEdge;

    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double confidence;

    private String strategyId;
    private StrategyType strategyType;
    private MarketRegime regime;
    private Double volatility;

    @DecimalMin("0.0")
    private Double volumeRatio;

    // UTC; evaluation time when absent.
    private LocalDateTime signalTime;

    private Double historicalWinRate;
    private Double rewardRiskRatio;

    @Size(max = 50)
    private String signalType;
    private Map<String, Object> metadata;
}
