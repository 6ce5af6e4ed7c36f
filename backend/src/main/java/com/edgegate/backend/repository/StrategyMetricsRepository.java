package com.edgegate.backend.repository;

import com.edgegate.backend.model.StrategyMetrics;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface StrategyMetricsRepository extends JpaRepository<StrategyMetrics, Long> {
    Optional<StrategyMetrics> findByStrategyIdAndVersion(String strategyId, String version);

    List<StrategyMetrics> findAllByOrderByStrategyIdAscVersionAsc();

    List<StrategyMetrics> findByApprovedLiveTrueOrderByStrategyIdAscVersionAsc();
}
