package com.edgegate.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "edge_samples", indexes = @Index(name = "idx_edge_samples_key", columnList = "symbol,direction,timeframe"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EdgeSampleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private Direction direction;

    @Column(nullable = false, length = 10)
    private String timeframe;

    @Column(nullable = false)
    private double netEdge;

    @Column(nullable = false)
    private LocalDateTime recordedAt;

    @Column(length = 50)
    private String signalType;

    @Column(columnDefinition = "TEXT")
    private String metadata;
}
