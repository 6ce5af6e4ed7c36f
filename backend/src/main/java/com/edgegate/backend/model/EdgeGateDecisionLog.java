package com.edgegate.backend.model;

import com.edgegate.backend.trading.gate.GateState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "edge_gate_decisions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeGateDecisionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime decisionTime;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(length = 10)
    private Direction direction;

    @Column(length = 10)
    private String timeframe;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GateState state;

    @Column(nullable = false, length = 100)
    private String reason;

    private double netEdge;
    private double confidence;
    private Double percentile;
    private boolean percentileSubstituted;
    private double positionMultiplier;
}
