package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.dto.DiagnosticsSummary;
import com.edgegate.backend.dto.PercentileAnalysis;
import com.edgegate.backend.model.EdgeGateDecisionLog;
import com.edgegate.backend.repository.EdgeGateDecisionLogRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only record of gate decisions with the summaries used to tune the percentile bands.
 * Log rows are written by the writer executor; a failed write is logged and the in-memory counters still advance.
 */
@Slf4j
@Service
public class EdgeGateDiagnostics {

    private final EdgeGateProperties properties;
    private final EdgeGateDecisionLogRepository decisionLogRepository;
    private final MeterRegistry meterRegistry;
    private final Executor writer;

    private final AtomicLong totalDecisions = new AtomicLong();
    private final Map<GateState, AtomicLong> stateCounts = new EnumMap<>(GateState.class);
    private final ConcurrentHashMap<String, AtomicLong> blockReasons = new ConcurrentHashMap<>();
    private final Deque<GateDecisionRecord> recent = new ArrayDeque<>();
    private final Map<GateState, Counter> decisionCounters = new EnumMap<>(GateState.class);

    public EdgeGateDiagnostics(EdgeGateProperties properties, EdgeGateDecisionLogRepository decisionLogRepository,
                               MeterRegistry meterRegistry, @Qualifier("persistenceExecutor") Executor writer) {
        this.properties = properties;
        this.decisionLogRepository = decisionLogRepository;
        this.meterRegistry = meterRegistry;
        this.writer = writer;
    }

    @PostConstruct
    void init() {
        for (GateState state : GateState.values()) {
            stateCounts.put(state, new AtomicLong());
            decisionCounters.put(state, Counter.builder("edge_gate_decisions_total")
                    .tag("state", state.name())
                    .register(meterRegistry));
        }
    }

    public void record(GateDecisionRecord decision) {
        totalDecisions.incrementAndGet();
        stateCounts.get(decision.state()).incrementAndGet();
        if (decision.state() == GateState.BLOCK) {
            blockReasons.computeIfAbsent(decision.reason(), r -> new AtomicLong()).incrementAndGet();
        }
        decisionCounters.get(decision.state()).increment();
        synchronized (recent) {
            recent.addLast(decision);
            while (recent.size() > properties.getDiagnostics().getMaxRecent()) {
                recent.removeFirst();
            }
        }
        log.debug("Gate {} {} {} reason='{}' edge={} conf={} pct={}", decision.symbol(), decision.direction(),
                decision.state(), decision.reason(), decision.netEdge(), decision.confidence(), decision.percentile());
        if (properties.getDiagnostics().isPersistenceEnabled()) {
            try {
                writer.execute(() -> persist(decision));
            } catch (RejectedExecutionException e) {
                log.warn("Decision log writer saturated, gate decision for {} not persisted", decision.symbol());
            }
        }
    }

    public DiagnosticsSummary getSummary() {
        long total = totalDecisions.get();
        Map<GateState, Long> counts = new EnumMap<>(GateState.class);
        stateCounts.forEach((state, count) -> counts.put(state, count.get()));
        Map<String, Long> reasons = new LinkedHashMap<>();
        blockReasons.entrySet().stream()
                .sorted(Map.Entry.<String, AtomicLong>comparingByValue(
                        (a, b) -> Long.compare(b.get(), a.get())))
                .forEach(e -> reasons.put(e.getKey(), e.getValue().get()));
        long probes = counts.get(GateState.PROBE_SMALL) + counts.get(GateState.PROBE_MEDIUM);
        return new DiagnosticsSummary(
                total,
                counts,
                reasons,
                rate(counts.get(GateState.BLOCK), total),
                rate(probes, total),
                rate(counts.get(GateState.FULL), total)
        );
    }

    public List<GateDecisionRecord> getRecentDecisions(int limit) {
        List<GateDecisionRecord> snapshot = snapshot();
        return snapshot.subList(Math.max(0, snapshot.size() - limit), snapshot.size());
    }

    public List<GateDecisionRecord> getRecentBlocks(int limit) {
        List<GateDecisionRecord> blocks = snapshot().stream()
                .filter(d -> d.state() == GateState.BLOCK)
                .toList();
        return blocks.subList(Math.max(0, blocks.size() - limit), blocks.size());
    }

    /**
     * Histogram of recent measured percentiles against the gate bands. Substituted percentiles are
     * excluded since they say nothing about the edge itself.
     */
    public PercentileAnalysis analyzePercentiles() {
        List<Double> percentiles = new ArrayList<>();
        for (GateDecisionRecord decision : snapshot()) {
            if (!decision.percentileSubstituted() && !Double.isNaN(decision.percentile())) {
                percentiles.add(decision.percentile());
            }
        }
        if (percentiles.isEmpty()) {
            return PercentileAnalysis.empty();
        }
        Collections.sort(percentiles);
        EdgeGateProperties.Gate gate = properties.getGate();
        int belowFloor = 0;
        int small = 0;
        int medium = 0;
        int full = 0;
        for (double p : percentiles) {
            if (p < gate.getPercentileProbeSmall()) {
                belowFloor++;
            } else if (p < gate.getPercentileProbeMedium()) {
                small++;
            } else if (p < gate.getPercentileFull()) {
                medium++;
            } else {
                full++;
            }
        }
        return new PercentileAnalysis(
                percentiles.size(), belowFloor, small, medium, full,
                quantile(percentiles, 0.10),
                quantile(percentiles, 0.25),
                quantile(percentiles, 0.50),
                quantile(percentiles, 0.75),
                quantile(percentiles, 0.90)
        );
    }

    public String generateReport() {
        DiagnosticsSummary summary = getSummary();
        PercentileAnalysis analysis = analyzePercentiles();
        StringBuilder sb = new StringBuilder();
        String rule = "=".repeat(80);
        sb.append(rule).append('\n').append("EDGE GATE DIAGNOSTIC REPORT").append('\n').append(rule).append("\n\n");

        sb.append("DECISION SUMMARY:\n");
        sb.append(String.format("  Total decisions: %d%n", summary.totalDecisions()));
        sb.append(String.format("  BLOCK rate: %.1f%%%n", summary.blockRate() * 100));
        sb.append(String.format("  PROBE rate: %.1f%%%n", summary.probeRate() * 100));
        sb.append(String.format("  FULL rate: %.1f%%%n%n", summary.fullRate() * 100));

        sb.append("BLOCK REASONS:\n");
        if (summary.blockReasons().isEmpty()) {
            sb.append("  none\n");
        }
        summary.blockReasons().forEach((reason, count) -> sb.append(String.format("  %s: %d (%.1f%%)%n",
                reason, count, rate(count, summary.totalDecisions()) * 100)));
        sb.append('\n');

        EdgeGateProperties.Gate gate = properties.getGate();
        sb.append("EDGE PERCENTILE ANALYSIS:\n");
        sb.append(String.format("  Below %.2f (blocked): %d%n", gate.getPercentileProbeSmall(), analysis.belowFloor()));
        sb.append(String.format("  %.2f-%.2f (probe small): %d%n", gate.getPercentileProbeSmall(),
                gate.getPercentileProbeMedium(), analysis.probeSmall()));
        sb.append(String.format("  %.2f-%.2f (probe medium): %d%n", gate.getPercentileProbeMedium(),
                gate.getPercentileFull(), analysis.probeMedium()));
        sb.append(String.format("  Above %.2f (full): %d%n", gate.getPercentileFull(), analysis.full()));
        sb.append(String.format("  P50: %.3f  P90: %.3f%n%n", analysis.p50(), analysis.p90()));

        sb.append("RECENT BLOCKS (last 5):\n");
        List<GateDecisionRecord> blocks = getRecentBlocks(5);
        if (blocks.isEmpty()) {
            sb.append("  No blocks recorded\n");
        }
        for (GateDecisionRecord block : blocks) {
            sb.append(String.format("  %s %s - %s%n", block.timestamp().withNano(0), block.symbol(), block.reason()));
            sb.append(String.format("    net_edge=%.6f conf=%.3f pct=%.3f%n",
                    block.netEdge(), block.confidence(), block.percentile()));
        }
        sb.append('\n');

        sb.append(rule).append('\n').append("RECOMMENDATIONS:").append('\n').append(rule).append('\n');
        for (String recommendation : recommendations(summary, analysis)) {
            sb.append("  ").append(recommendation).append('\n');
        }
        return sb.toString();
    }

    public void reset() {
        totalDecisions.set(0);
        stateCounts.values().forEach(count -> count.set(0));
        blockReasons.clear();
        synchronized (recent) {
            recent.clear();
        }
    }

    @Scheduled(cron = "0 45 2 * * *")
    @Transactional
    public void cleanupOldDecisions() {
        try {
            int retentionDays = properties.getDiagnostics().getRetentionDays();
            if (retentionDays <= 0) {
                return;
            }
            LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
            long removed = decisionLogRepository.deleteByDecisionTimeBefore(cutoff);
            if (removed > 0) {
                log.info("Pruned {} gate decisions older than {} days", removed, retentionDays);
            }
        } catch (Exception e) {
            log.warn("Failed to prune gate decisions", e);
        }
    }

    List<String> recommendations(DiagnosticsSummary summary, PercentileAnalysis analysis) {
        List<String> lines = new ArrayList<>();
        if (summary.totalDecisions() == 0) {
            lines.add("No decisions recorded yet");
            return lines;
        }
        if (summary.blockRate() > 0.90) {
            lines.add("Very high block rate (>90%): consider lowering the percentile bands and check edge history depth");
        }
        if (analysis.count() > 0 && analysis.belowFloor() > analysis.count() * 0.8) {
            lines.add("Most signals rank below the probe floor: verify the net edge calculation");
        }
        summary.blockReasons().keySet().stream().findFirst().ifPresent(top -> {
            lines.add("Top block reason: " + top);
            switch (top) {
                case EdgeGate.REASON_LOW_CONFIDENCE -> lines.add("  consider lowering the minimum confidence");
                case EdgeGate.REASON_BELOW_FLOOR -> lines.add("  consider lowering the percentile bands");
                case EdgeGate.REASON_NON_POSITIVE_EDGE -> lines.add("  check that net edge includes the correct fees and slippage");
                default -> lines.add("  review the secondary filters");
            }
        });
        return lines;
    }

    private void persist(GateDecisionRecord decision) {
        try {
            decisionLogRepository.save(EdgeGateDecisionLog.builder()
                    .decisionTime(decision.timestamp())
                    .symbol(decision.symbol())
                    .direction(decision.direction())
                    .timeframe(decision.timeframe())
                    .state(decision.state())
                    .reason(decision.reason())
                    .netEdge(decision.netEdge())
                    .confidence(decision.confidence())
                    .percentile(Double.isFinite(decision.percentile()) ? decision.percentile() : null)
                    .percentileSubstituted(decision.percentileSubstituted())
                    .positionMultiplier(decision.positionMultiplier())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Gate decision for {} not persisted: {}", decision.symbol(), e.getMessage());
        }
    }

    private List<GateDecisionRecord> snapshot() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }

    private static double rate(long count, long total) {
        return total > 0 ? (double) count / total : 0.0;
    }

    private static double quantile(List<Double> sorted, double p) {
        int index = (int) (sorted.size() * p);
        return sorted.get(Math.min(index, sorted.size() - 1));
    }
}
