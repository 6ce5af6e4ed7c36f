package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.model.Direction;
import com.edgegate.backend.repository.EdgeSampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class JpaEdgeHistoryStoreTest {

    private static final EdgeStatsKey BTC_LONG = new EdgeStatsKey("BTCUSDT", Direction.LONG, "15m");
    private static final EdgeStatsKey ETH_SHORT = new EdgeStatsKey("ETHUSDT", Direction.SHORT, "1h");

    @Autowired
    private EdgeSampleRepository edgeSampleRepository;

    private JpaEdgeHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new JpaEdgeHistoryStore(edgeSampleRepository);
    }

    @Test
    void appendKeepsNewestSamplesPerKey() {
        for (int i = 0; i < 8; i++) {
            store.append(BTC_LONG, sample(i), 5);
        }
        store.append(ETH_SHORT, sample(100), 5);

        Map<EdgeStatsKey, List<EdgeSample>> loaded = store.loadAll();

        assertThat(loaded.get(BTC_LONG)).extracting(EdgeSample::netEdge).containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
        assertThat(loaded.get(ETH_SHORT)).extracting(EdgeSample::netEdge).containsExactly(100.0);
        assertThat(edgeSampleRepository.countBySymbolAndDirectionAndTimeframe("BTCUSDT", Direction.LONG, "15m"))
                .isEqualTo(5);
    }

    @Test
    void metadataRoundTripsAsJson() {
        store.append(BTC_LONG, new EdgeSample(0.002, LocalDateTime.now(), "breakout",
                Map.of("state", "FULL", "confidence", 0.7)), 10);

        EdgeSample loaded = store.loadAll().get(BTC_LONG).get(0);

        assertThat(loaded.signalType()).isEqualTo("breakout");
        assertThat(loaded.metadata()).containsEntry("state", "FULL").containsEntry("confidence", 0.7);
    }

    @Test
    void clearRemovesOnlyThatKey() {
        store.append(BTC_LONG, sample(1), 10);
        store.append(ETH_SHORT, sample(2), 10);

        store.clear(BTC_LONG);

        assertThat(store.loadAll()).containsOnlyKeys(ETH_SHORT);

        store.clearAll();
        assertThat(store.loadAll()).isEmpty();
    }

    @Test
    void reloadFeedsTracker() {
        for (int i = 0; i < 60; i++) {
            store.append(BTC_LONG, sample(i), 1000);
        }
        EdgeGateProperties properties = new EdgeGateProperties();
        EdgeStatsTracker tracker = new EdgeStatsTracker(properties, store, Runnable::run);

        tracker.loadPersistedHistory();

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(60);
        assertThat(tracker.getPercentile(30.0, BTC_LONG)).hasValue(0.5);
    }

    private static EdgeSample sample(double netEdge) {
        return new EdgeSample(netEdge, LocalDateTime.now(), null, Map.of());
    }
}
