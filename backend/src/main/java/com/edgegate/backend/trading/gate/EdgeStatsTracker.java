package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.exception.InsufficientDataException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Rolling per-key history of observed net edges. Each key keeps the newest {@code maxWindow} samples;
 * percentile queries answer "what fraction of recent edges were smaller than this one".
 *
 * <p>Edges are recorded when the signal is evaluated, before its outcome is known, so a percentile only
 * ever reflects information available at decision time. Store writes are handed to the writer executor;
 * only the in-memory append happens on the caller's thread.
 */
@Slf4j
@Service
public class EdgeStatsTracker {

    private final EdgeGateProperties properties;
    private final EdgeHistoryStore store;
    private final Executor writer;
    private final ConcurrentHashMap<EdgeStatsKey, EdgeHistory> histories = new ConcurrentHashMap<>();

    public EdgeStatsTracker(EdgeGateProperties properties, EdgeHistoryStore store,
                            @Qualifier("persistenceExecutor") Executor writer) {
        this.properties = properties;
        this.store = store;
        this.writer = writer;
    }

    @PostConstruct
    void loadPersistedHistory() {
        if (!properties.getStats().isPersistenceEnabled()) {
            return;
        }
        try {
            Map<EdgeStatsKey, List<EdgeSample>> persisted = store.loadAll();
            int capacity = properties.getStats().getMaxWindow();
            long loaded = 0;
            for (Map.Entry<EdgeStatsKey, List<EdgeSample>> entry : persisted.entrySet()) {
                EdgeHistory history = historyFor(entry.getKey());
                synchronized (history) {
                    for (EdgeSample sample : entry.getValue()) {
                        history.add(sample, capacity);
                        loaded++;
                    }
                }
            }
            log.info("Loaded {} edge samples across {} keys", loaded, persisted.size());
        } catch (RuntimeException e) {
            log.warn("Edge history reload failed, starting with empty history", e);
        }
    }

    public void recordEdge(double netEdge, EdgeStatsKey key, String signalType, Map<String, Object> metadata) {
        if (!Double.isFinite(netEdge)) {
            throw new IllegalArgumentException("netEdge must be finite: " + netEdge);
        }
        Map<String, Object> copy = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        EdgeSample sample = new EdgeSample(netEdge, LocalDateTime.now(), signalType, copy);
        int capacity = properties.getStats().getMaxWindow();
        EdgeHistory history = historyFor(key);
        synchronized (history) {
            history.add(sample, capacity);
            // Queued under the key lock so the writer sees samples in the same order as memory.
            if (properties.getStats().isPersistenceEnabled()) {
                enqueue(key, () -> persist(key, sample, capacity));
            }
        }
    }

    public void recordEdge(double netEdge, EdgeStatsKey key) {
        recordEdge(netEdge, key, null, null);
    }

    /**
     * Fraction of the key's stored samples strictly below {@code netEdge}, or empty while the key holds
     * fewer than {@code minSample} samples.
     */
    public OptionalDouble getPercentile(double netEdge, EdgeStatsKey key) {
        EdgeHistory history = histories.get(key);
        if (history == null) {
            return OptionalDouble.empty();
        }
        synchronized (history) {
            if (history.size() < properties.getStats().getMinSample()) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(history.fractionBelow(netEdge));
        }
    }

    public double requirePercentile(double netEdge, EdgeStatsKey key) {
        OptionalDouble percentile = getPercentile(netEdge, key);
        if (percentile.isEmpty()) {
            throw new InsufficientDataException("Not enough edge history for " + key,
                    sampleCount(key), properties.getStats().getMinSample());
        }
        return percentile.getAsDouble();
    }

    public int sampleCount(EdgeStatsKey key) {
        EdgeHistory history = histories.get(key);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public EdgeStatistics getStatistics(EdgeStatsKey key) {
        EdgeHistory history = histories.get(key);
        if (history == null) {
            return EdgeStatistics.empty(key);
        }
        synchronized (history) {
            int count = history.size();
            if (count == 0) {
                return EdgeStatistics.empty(key);
            }
            return new EdgeStatistics(
                    key,
                    count,
                    count >= properties.getStats().getMinSample(),
                    history.min(),
                    history.max(),
                    history.mean(),
                    history.quantile(0.25),
                    history.quantile(0.50),
                    history.quantile(0.75),
                    history.quantile(0.90)
            );
        }
    }

    public AggregateEdgeStatistics getAggregateStatistics() {
        List<EdgeStatistics> perKey = new ArrayList<>();
        for (EdgeStatsKey key : histories.keySet()) {
            perKey.add(getStatistics(key));
        }
        perKey.sort(Comparator.comparing(EdgeStatistics::key, Comparator.comparing(EdgeStatsKey::toString)));
        long totalSamples = perKey.stream().mapToLong(EdgeStatistics::count).sum();
        int sufficient = (int) perKey.stream().filter(EdgeStatistics::sufficient).count();
        return new AggregateEdgeStatistics(perKey.size(), totalSamples, sufficient, perKey);
    }

    /**
     * Newest samples for the key, oldest first.
     */
    public List<EdgeSample> getRecentSamples(EdgeStatsKey key, int limit) {
        EdgeHistory history = histories.get(key);
        if (history == null || limit <= 0) {
            return List.of();
        }
        synchronized (history) {
            return history.newest(limit);
        }
    }

    public void clear(EdgeStatsKey key) {
        histories.remove(key);
        if (properties.getStats().isPersistenceEnabled()) {
            enqueue(key, () -> store.clear(key));
        }
        log.info("Cleared edge history for {}", key);
    }

    public void clearAll() {
        histories.clear();
        if (properties.getStats().isPersistenceEnabled()) {
            enqueue(null, store::clearAll);
        }
        log.info("Cleared all edge history");
    }

    private EdgeHistory historyFor(EdgeStatsKey key) {
        return histories.computeIfAbsent(key, k -> new EdgeHistory());
    }

    private void enqueue(EdgeStatsKey key, Runnable write) {
        try {
            writer.execute(write);
        } catch (RejectedExecutionException e) {
            log.warn("Edge store writer saturated, {} change kept in memory only: {}",
                    key == null ? "history" : key, e.getMessage());
        }
    }

    private void persist(EdgeStatsKey key, EdgeSample sample, int capacity) {
        try {
            store.append(key, sample, capacity);
        } catch (RuntimeException e) {
            log.warn("Edge sample for {} kept in memory only: {}", key, e.getMessage());
        }
    }
}
