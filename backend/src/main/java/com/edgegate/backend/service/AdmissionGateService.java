package com.edgegate.backend.service;

import com.edgegate.backend.config.BacktestProperties;
import com.edgegate.backend.dto.AdmissionCheck;
import com.edgegate.backend.dto.AdmissionDecision;
import com.edgegate.backend.model.AdmissionAudit;
import com.edgegate.backend.model.MarketRegime;
import com.edgegate.backend.model.MarketState;
import com.edgegate.backend.model.StrategyMetrics;
import com.edgegate.backend.repository.AdmissionAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Paper-to-live promotion. A version is approved only when its backtest and walk-forward both passed and
 * its registry metrics meet the live requirements. Every decision is appended to the admission audit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdmissionGateService {

    static final String REASON_APPROVAL_REVOKED = "live approval revoked";
    static final String REASON_REGISTRY_UNAVAILABLE = "registry unavailable";

    private final StrategyRegistryService strategyRegistryService;
    private final AdmissionAuditRepository admissionAuditRepository;
    private final BacktestProperties backtestProperties;

    public AdmissionDecision requestApproval(String strategyId, String version, boolean backtestPassed,
                                             boolean walkForwardPassed) {
        Optional<StrategyMetrics> existing;
        try {
            existing = strategyRegistryService.getMetrics(strategyId, version);
        } catch (DataAccessException e) {
            log.warn("Admission for {} v{} rejected, registry unavailable: {}", strategyId, version, e.getMessage());
            List<String> reasons = List.of(REASON_REGISTRY_UNAVAILABLE);
            audit(strategyId, version, AdmissionAudit.Decision.REJECTED, reasons.get(0));
            return new AdmissionDecision(strategyId, version, false, reasons);
        }
        if (existing.isEmpty()) {
            List<String> reasons = List.of("strategy not registered");
            audit(strategyId, version, AdmissionAudit.Decision.REJECTED, reasons.get(0));
            log.warn("Admission rejected for {} v{}: not registered", strategyId, version);
            return new AdmissionDecision(strategyId, version, false, reasons);
        }
        StrategyMetrics metrics = existing.get();
        boolean wasApproved = metrics.isApprovedLive();

        List<String> failures = new ArrayList<>();
        if (!backtestPassed) {
            failures.add("backtest not passed");
        }
        if (!walkForwardPassed) {
            failures.add("walk-forward not passed");
        }
        failures.addAll(strategyRegistryService.unmetRequirements(metrics));
        boolean approved = failures.isEmpty();

        try {
            strategyRegistryService.recordAdmission(strategyId, version, backtestPassed, walkForwardPassed, approved);
        } catch (DataAccessException e) {
            log.warn("Admission outcome for {} v{} not stored: {}", strategyId, version, e.getMessage());
        }

        if (approved) {
            audit(strategyId, version, AdmissionAudit.Decision.APPROVED, "all requirements met");
            log.info("✅ {} v{} approved for live", strategyId, version);
            return new AdmissionDecision(strategyId, version, true, List.of());
        }
        String reason = String.join("; ", failures);
        if (wasApproved) {
            reason = reason + "; " + REASON_APPROVAL_REVOKED;
            log.warn("❌ {} v{} lost live approval: {}", strategyId, version, failures);
        } else {
            log.warn("❌ {} v{} rejected for live: {}", strategyId, version, failures);
        }
        audit(strategyId, version, AdmissionAudit.Decision.REJECTED, reason);
        return new AdmissionDecision(strategyId, version, false, failures);
    }

    /**
     * Whether an approved version may trade under the given market conditions.
     */
    public AdmissionCheck checkAdmission(String strategyId, String version, MarketState marketState) {
        Optional<StrategyMetrics> metrics = strategyRegistryService.getMetrics(strategyId, version);
        if (metrics.isEmpty()) {
            return new AdmissionCheck(false, "strategy not registered");
        }
        if (!metrics.get().isApprovedLive()) {
            return new AdmissionCheck(false, "not approved for live");
        }
        if (!metrics.get().isLiveEnabled()) {
            return new AdmissionCheck(false, "live trading disabled");
        }
        if (marketState != null) {
            double maxConfidence = backtestProperties.getAdmission().getMaxVolatileRegimeConfidence();
            if (marketState.regime() == MarketRegime.VOLATILE && marketState.regimeConfidence() > maxConfidence) {
                return new AdmissionCheck(false, String.format("volatile market (confidence %.2f)", marketState.regimeConfidence()));
            }
            if (marketState.regime() == MarketRegime.UNKNOWN) {
                return new AdmissionCheck(false, "market regime unknown");
            }
        }
        return new AdmissionCheck(true, "admitted");
    }

    public StrategyMetrics enableStrategy(String strategyId, String version) {
        StrategyMetrics metrics = strategyRegistryService.enableLive(strategyId, version);
        audit(strategyId, version, AdmissionAudit.Decision.ENABLED, "live trading enabled");
        log.info("{} v{} enabled for live trading", strategyId, version);
        return metrics;
    }

    public StrategyMetrics disableStrategy(String strategyId, String version, String reason) {
        StrategyMetrics metrics = strategyRegistryService.disableLive(strategyId, version);
        String detail = reason == null || reason.isBlank() ? "live trading disabled" : reason;
        audit(strategyId, version, AdmissionAudit.Decision.DISABLED, detail);
        log.warn("{} v{} disabled for live trading: {}", strategyId, version, detail);
        return metrics;
    }

    public List<AdmissionAudit> getAuditLog(String strategyId, String version) {
        return admissionAuditRepository.findByStrategyIdAndVersionOrderByIdAsc(strategyId, version);
    }

    private void audit(String strategyId, String version, AdmissionAudit.Decision decision, String reason) {
        try {
            admissionAuditRepository.save(AdmissionAudit.builder()
                    .timestamp(LocalDateTime.now())
                    .strategyId(strategyId)
                    .version(version)
                    .decision(decision)
                    .reason(reason)
                    .build());
        } catch (DataAccessException e) {
            log.warn("Admission audit for {} v{} ({}) not written: {}", strategyId, version, decision, e.getMessage());
        }
    }
}
