package com.edgegate.backend.dto;

import com.edgegate.backend.model.MarketRegime;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Realised result of a live trade, tallied against the conditions it was entered under.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeOutcomeRequest {

    @NotBlank
    @Size(max = 100)
    private String strategyId;

    private MarketRegime regime;

    @DecimalMin("0.0")
    private Double volatility;

    @NotNull
    private Double pnl;
}
