package com.edgegate.backend.trading.gate;

import com.edgegate.backend.config.EdgeGateProperties;
import com.edgegate.backend.exception.InsufficientDataException;
import com.edgegate.backend.exception.PersistenceException;
import com.edgegate.backend.model.Direction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EdgeStatsTrackerTest {

    private static final EdgeStatsKey BTC_LONG = new EdgeStatsKey("BTCUSDT", Direction.LONG, "15m");

    private EdgeGateProperties properties;
    private EdgeHistoryStore store;
    private EdgeStatsTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new EdgeGateProperties();
        properties.getStats().setPersistenceEnabled(false);
        store = mock(EdgeHistoryStore.class);
        tracker = new EdgeStatsTracker(properties, store, Runnable::run);
    }

    @Test
    void percentileIsEmptyBelowMinimumSample() {
        for (int i = 0; i < 49; i++) {
            tracker.recordEdge(0.001 * i, BTC_LONG);
        }

        assertThat(tracker.getPercentile(0.01, BTC_LONG)).isEmpty();
        assertThatThrownBy(() -> tracker.requirePercentile(0.01, BTC_LONG))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getAvailable()).isEqualTo(49);
                    assertThat(ex.getRequired()).isEqualTo(50);
                });

        tracker.recordEdge(0.049, BTC_LONG);
        assertThat(tracker.getPercentile(0.01, BTC_LONG)).isPresent();
    }

    @Test
    void percentileIsFractionStrictlyBelow() {
        for (int i = 1; i <= 100; i++) {
            tracker.recordEdge(i / 10_000.0, BTC_LONG);
        }

        assertThat(tracker.getPercentile(0.0050, BTC_LONG).getAsDouble()).isCloseTo(0.49, within(1e-9));
        assertThat(tracker.getPercentile(0.0001, BTC_LONG).getAsDouble()).isEqualTo(0.0);
        assertThat(tracker.getPercentile(0.0200, BTC_LONG).getAsDouble()).isEqualTo(1.0);
    }

    @Test
    void oldestSampleIsEvictedPastWindow() {
        properties.getStats().setMaxWindow(1000);
        tracker.recordEdge(-1.0, BTC_LONG);
        for (int i = 0; i < 1000; i++) {
            tracker.recordEdge(0.001, BTC_LONG);
        }

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(1000);
        assertThat(tracker.getStatistics(BTC_LONG).min()).isEqualTo(0.001);
        assertThat(tracker.getPercentile(0.0, BTC_LONG).getAsDouble()).isEqualTo(0.0);
    }

    @Test
    void keysAreIsolated() {
        EdgeStatsKey btcShort = new EdgeStatsKey("BTCUSDT", Direction.SHORT, "15m");
        EdgeStatsKey ethLong = new EdgeStatsKey("ETHUSDT", Direction.LONG, "15m");
        for (int i = 0; i < 60; i++) {
            tracker.recordEdge(0.002, BTC_LONG);
        }

        assertThat(tracker.getPercentile(0.003, BTC_LONG)).isPresent();
        assertThat(tracker.getPercentile(0.003, btcShort)).isEmpty();
        assertThat(tracker.getPercentile(0.003, ethLong)).isEmpty();
        assertThat(tracker.sampleCount(btcShort)).isZero();
    }

    @Test
    void symbolCaseSharesBucket() {
        tracker.recordEdge(0.001, EdgeStatsKey.of("btcusdt", "long", "15M"));

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(1);
    }

    @Test
    void rejectsNonFiniteEdge() {
        assertThatThrownBy(() -> tracker.recordEdge(Double.NaN, BTC_LONG))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tracker.recordEdge(Double.POSITIVE_INFINITY, BTC_LONG))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.sampleCount(BTC_LONG)).isZero();
    }

    @Test
    void statisticsSummariseWindow() {
        for (int i = 1; i <= 100; i++) {
            tracker.recordEdge(i, BTC_LONG);
        }

        EdgeStatistics stats = tracker.getStatistics(BTC_LONG);
        assertThat(stats.count()).isEqualTo(100);
        assertThat(stats.sufficient()).isTrue();
        assertThat(stats.min()).isEqualTo(1.0);
        assertThat(stats.max()).isEqualTo(100.0);
        assertThat(stats.mean()).isCloseTo(50.5, within(1e-9));
        assertThat(stats.p50()).isEqualTo(51.0);
        assertThat(stats.p90()).isEqualTo(91.0);

        AggregateEdgeStatistics aggregate = tracker.getAggregateStatistics();
        assertThat(aggregate.totalKeys()).isEqualTo(1);
        assertThat(aggregate.totalSamples()).isEqualTo(100);
        assertThat(aggregate.keysWithSufficientData()).isEqualTo(1);
    }

    @Test
    void unknownKeyHasEmptyStatistics() {
        EdgeStatistics stats = tracker.getStatistics(BTC_LONG);

        assertThat(stats.count()).isZero();
        assertThat(stats.sufficient()).isFalse();
        assertThat(tracker.getRecentSamples(BTC_LONG, 10)).isEmpty();
    }

    @Test
    void recentSamplesAreNewestInArrivalOrder() {
        for (int i = 0; i < 10; i++) {
            tracker.recordEdge(i, BTC_LONG, "breakout", Map.of("bar", i));
        }

        List<EdgeSample> recent = tracker.getRecentSamples(BTC_LONG, 3);
        assertThat(recent).extracting(EdgeSample::netEdge).containsExactly(7.0, 8.0, 9.0);
        assertThat(recent.get(0).signalType()).isEqualTo("breakout");
        assertThat(recent.get(0).metadata()).containsEntry("bar", 7);
    }

    @Test
    void clearRemovesHistory() {
        tracker.recordEdge(0.001, BTC_LONG);
        tracker.clear(BTC_LONG);
        assertThat(tracker.sampleCount(BTC_LONG)).isZero();

        tracker.recordEdge(0.001, BTC_LONG);
        tracker.clearAll();
        assertThat(tracker.getAggregateStatistics().totalKeys()).isZero();
        verify(store, never()).clearAll();
    }

    @Test
    void concurrentWritersLoseNoSamples() throws InterruptedException {
        int threads = 8;
        int perThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    tracker.recordEdge(0.001 * i, BTC_LONG);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(threads * perThread);
    }

    @Test
    void persistsSamplesWhenEnabled() {
        properties.getStats().setPersistenceEnabled(true);

        tracker.recordEdge(0.002, BTC_LONG);

        verify(store).append(eq(BTC_LONG), any(EdgeSample.class), eq(1000));
    }

    @Test
    void storeFailureKeepsSampleInMemory() {
        properties.getStats().setPersistenceEnabled(true);
        doThrow(new PersistenceException("db down", null)).when(store).append(any(), any(), anyInt());

        tracker.recordEdge(0.002, BTC_LONG);

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(1);
    }

    @Test
    void slowStoreDoesNotBlockPercentileReads() throws InterruptedException {
        properties.getStats().setPersistenceEnabled(true);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(store).append(any(), any(), anyInt());
        ExecutorService writer = Executors.newSingleThreadExecutor();
        try {
            EdgeStatsTracker async = new EdgeStatsTracker(properties, store, writer);
            for (int i = 0; i < 60; i++) {
                async.recordEdge(i / 1000.0, BTC_LONG);
            }

            assertThat(async.getPercentile(0.030, BTC_LONG).getAsDouble()).isCloseTo(0.5, within(1e-9));
            assertThat(async.sampleCount(BTC_LONG)).isEqualTo(60);

            release.countDown();
        } finally {
            writer.shutdown();
            assertThat(writer.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
        ArgumentCaptor<EdgeSample> written = ArgumentCaptor.forClass(EdgeSample.class);
        verify(store, times(60)).append(eq(BTC_LONG), written.capture(), eq(1000));
        assertThat(written.getAllValues()).extracting(EdgeSample::netEdge)
                .isSortedAccordingTo(Double::compare)
                .startsWith(0.0, 0.001);
    }

    @Test
    void saturatedWriterKeepsSampleInMemory() {
        properties.getStats().setPersistenceEnabled(true);
        EdgeStatsTracker rejecting = new EdgeStatsTracker(properties, store, task -> {
            throw new RejectedExecutionException("queue full");
        });

        rejecting.recordEdge(0.002, BTC_LONG);

        assertThat(rejecting.sampleCount(BTC_LONG)).isEqualTo(1);
        verify(store, never()).append(any(), any(), anyInt());
    }

    @Test
    void reloadsPersistedHistoryOnStartup() {
        properties.getStats().setPersistenceEnabled(true);
        List<EdgeSample> persisted = java.util.stream.IntStream.range(0, 60)
                .mapToObj(i -> new EdgeSample(i / 1000.0, LocalDateTime.now(), null, Map.of()))
                .toList();
        when(store.loadAll()).thenReturn(Map.of(BTC_LONG, persisted));

        tracker.loadPersistedHistory();

        assertThat(tracker.sampleCount(BTC_LONG)).isEqualTo(60);
        OptionalDouble percentile = tracker.getPercentile(0.030, BTC_LONG);
        assertThat(percentile.getAsDouble()).isCloseTo(0.5, within(1e-9));
        verify(store, times(1)).loadAll();
    }

    @Test
    void failedReloadStartsEmpty() {
        properties.getStats().setPersistenceEnabled(true);
        when(store.loadAll()).thenThrow(new PersistenceException("db down", null));

        tracker.loadPersistedHistory();

        assertThat(tracker.getAggregateStatistics().totalKeys()).isZero();
    }
}
