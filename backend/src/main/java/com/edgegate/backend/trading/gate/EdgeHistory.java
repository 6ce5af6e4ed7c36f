package com.edgegate.backend.trading.gate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Rolling window for one key: samples in arrival order plus the same values kept sorted.
 * Not thread-safe; callers synchronize on the instance.
 */
final class EdgeHistory {

    private final Deque<EdgeSample> samples = new ArrayDeque<>();
    private final List<Double> sorted = new ArrayList<>();

    void add(EdgeSample sample, int capacity) {
        samples.addLast(sample);
        sorted.add(upperBound(sample.netEdge()), sample.netEdge());
        while (samples.size() > capacity) {
            EdgeSample evicted = samples.removeFirst();
            sorted.remove(lowerBound(evicted.netEdge()));
        }
    }

    int size() {
        return samples.size();
    }

    /**
     * Fraction of stored values strictly below {@code value}.
     */
    double fractionBelow(double value) {
        return (double) lowerBound(value) / sorted.size();
    }

    double quantile(double p) {
        int index = (int) (sorted.size() * p);
        return sorted.get(Math.min(index, sorted.size() - 1));
    }

    double min() {
        return sorted.get(0);
    }

    double max() {
        return sorted.get(sorted.size() - 1);
    }

    double mean() {
        double sum = 0.0;
        for (double value : sorted) {
            sum += value;
        }
        return sum / sorted.size();
    }

    List<EdgeSample> newest(int limit) {
        int n = Math.min(limit, samples.size());
        List<EdgeSample> result = new ArrayList<>(n);
        Iterator<EdgeSample> it = samples.descendingIterator();
        while (it.hasNext() && result.size() < n) {
            result.add(it.next());
        }
        Collections.reverse(result);
        return result;
    }

    private int lowerBound(double value) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid) < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private int upperBound(double value) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid) <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
