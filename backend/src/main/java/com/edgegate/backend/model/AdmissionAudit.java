package com.edgegate.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only. Rows are inserted by the admission gate and never updated or removed.
 */
@Entity
@Table(name = "admission_audit")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdmissionAudit {

    public enum Decision {
        APPROVED,
        REJECTED,
        ENABLED,
        DISABLED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "audit_time", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "strategy_id", nullable = false, length = 100)
    private String strategyId;

    @Column(nullable = false, length = 50)
    private String version;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Decision decision;

    @Column(length = 4000)
    private String reason;
}
