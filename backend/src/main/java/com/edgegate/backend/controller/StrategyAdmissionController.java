package com.edgegate.backend.controller;

import com.edgegate.backend.model.AdmissionAudit;
import com.edgegate.backend.model.StrategyMetrics;
import com.edgegate.backend.service.AdmissionGateService;
import com.edgegate.backend.service.StrategyRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/strategies")
@RequiredArgsConstructor
@Tag(name = "Strategies")
public class StrategyAdmissionController {

    private final StrategyRegistryService strategyRegistryService;
    private final AdmissionGateService admissionGateService;

    @GetMapping
    @Operation(summary = "List registered strategy versions")
    public ResponseEntity<List<StrategyMetrics>> list(@RequestParam(defaultValue = "false") boolean liveOnly) {
        return ResponseEntity.ok(strategyRegistryService.list(liveOnly));
    }

    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Plain-text registry report")
    public ResponseEntity<String> report() {
        return ResponseEntity.ok(strategyRegistryService.generateReport());
    }

    @GetMapping("/{strategyId}/{version}")
    @Operation(summary = "Metrics and approval state of one strategy version")
    public ResponseEntity<StrategyMetrics> get(@PathVariable String strategyId, @PathVariable String version) {
        return ResponseEntity.ok(strategyRegistryService.requireMetrics(strategyId, version));
    }

    @PostMapping("/{strategyId}/{version}/enable")
    @Operation(summary = "Enable live trading for an approved version")
    public ResponseEntity<StrategyMetrics> enable(@PathVariable String strategyId, @PathVariable String version) {
        return ResponseEntity.ok(admissionGateService.enableStrategy(strategyId, version));
    }

    @PostMapping("/{strategyId}/{version}/disable")
    @Operation(summary = "Disable live trading for a version")
    public ResponseEntity<StrategyMetrics> disable(@PathVariable String strategyId, @PathVariable String version,
                                                   @RequestParam(required = false) String reason) {
        return ResponseEntity.ok(admissionGateService.disableStrategy(strategyId, version, reason));
    }

    @GetMapping("/{strategyId}/{version}/audit")
    @Operation(summary = "Admission audit trail of a version")
    public ResponseEntity<List<AdmissionAudit>> audit(@PathVariable String strategyId, @PathVariable String version) {
        return ResponseEntity.ok(admissionGateService.getAuditLog(strategyId, version));
    }
}
