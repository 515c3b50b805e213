package org.descartes.validator.metrics;

/**
 * Latency distribution of mutating calls, in nanoseconds.
 *
 * @since 1.0
 */
public interface LatencyMetrics {

    double getAvgLatency();

    double getP99Latency();

    double getMaxLatency();

    double getPercentile(double p);

    long getTotalMeasurements();
}
