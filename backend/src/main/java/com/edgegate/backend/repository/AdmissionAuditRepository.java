package com.edgegate.backend.repository;

import com.edgegate.backend.model.AdmissionAudit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AdmissionAuditRepository extends JpaRepository<AdmissionAudit, Long> {
    List<AdmissionAudit> findByStrategyIdAndVersionOrderByIdAsc(String strategyId, String version);
}
