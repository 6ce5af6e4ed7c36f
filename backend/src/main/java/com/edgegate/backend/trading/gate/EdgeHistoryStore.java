package com.edgegate.backend.trading.gate;

import java.util.List;
import java.util.Map;

/**
 * Durable backing for edge history. Implementations keep at most {@code capacity} samples per key
 * and return them in insertion order.
 */
public interface EdgeHistoryStore {

    void append(EdgeStatsKey key, EdgeSample sample, int capacity);

    Map<EdgeStatsKey, List<EdgeSample>> loadAll();

    void clear(EdgeStatsKey key);

    void clearAll();
}
