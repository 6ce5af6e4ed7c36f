package com.edgegate.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "strategy_metrics",
        uniqueConstraints = @UniqueConstraint(name = "uk_strategy_metrics_version", columnNames = {"strategy_id", "version"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StrategyMetrics {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "strategy_id", nullable = false, length = 100)
    private String strategyId;

    @Column(nullable = false, length = 50)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private StrategyType strategyType;

    private int totalTrades;
    private int winningTrades;
    private int losingTrades;
    private double totalPnl;
    private double winRate;
    private double profitFactor;
    private double sharpeRatio;
    private double maxDrawdown;
    private double avgTradePnl;
    private double avgWin;
    private double avgLoss;
    private double largestWin;
    private double largestLoss;
    private double avgHoldSeconds;

    private boolean backtestPassed;
    private boolean walkforwardPassed;
    private boolean approvedLive;
    private boolean liveEnabled;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime approvedAt;
}
