package org.descartes.validator.internal.metrics;

import org.descartes.validator.metrics.LatencyMetrics;

import java.util.concurrent.TimeUnit;

import org.HdrHistogram.ConcurrentHistogram;
import org.HdrHistogram.Histogram;

final class LatencyTracker implements LatencyMetrics {
    // Values above the highest trackable value are clamped instead of failing the call being measured.
    private static final long HIGHEST_TRACKABLE = TimeUnit.MINUTES.toNanos(1L);

    private final Histogram histogram = new ConcurrentHistogram(HIGHEST_TRACKABLE, 3);

    void recordLatency(long latencyNanos) {
        histogram.recordValue(Math.max(0, Math.min(latencyNanos, HIGHEST_TRACKABLE)));
    }

    @Override
    public double getAvgLatency() {
        return histogram.getMean();
    }

    @Override
    public double getP99Latency() {
        return histogram.getValueAtPercentile(99);
    }

    @Override
    public double getMaxLatency() {
        return histogram.getMaxValue();
    }

    @Override
    public double getPercentile(double p) {
        return histogram.getValueAtPercentile(p);
    }

    @Override
    public long getTotalMeasurements() {
        return histogram.getTotalCount();
    }
}
