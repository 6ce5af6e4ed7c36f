package com.edgegate.backend.repository;

import com.edgegate.backend.model.EdgeGateDecisionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;

public interface EdgeGateDecisionLogRepository extends JpaRepository<EdgeGateDecisionLog, Long> {
    long deleteByDecisionTimeBefore(LocalDateTime cutoff);
}
