package org.descartes.validator.internal.metrics;

import org.descartes.validator.ClaimResult;
import org.descartes.validator.metrics.LatencyMetrics;
import org.descartes.validator.metrics.ValidatorMetrics;
import org.descartes.validator.util.TimeService;

import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

/**
 * Collects the counters behind {@link ValidatorMetrics}.
 *
 * <p>
 * The manager records into the collector unconditionally. When metrics are disabled every record call returns
 * immediately and {@link #view()} hands out {@link ValidatorMetrics#disabled()}.
 * </p>
 */
public final class ValidatorMetricsCollector implements ValidatorMetrics {

    private final boolean enabled;
    private final TimeService timeService;
    private final IntSupplier totalValidators;
    private final IntSupplier activeValidators;

    private final LongAdder claims = new LongAdder();
    private final LongAdder conflicts = new LongAdder();
    private final LongAdder consensus = new LongAdder();
    private final LongAdder disputes = new LongAdder();
    private final LongAdder removals = new LongAdder();
    private final LongAdder epochs = new LongAdder();
    private final LatencyTracker latency = new LatencyTracker();

    public ValidatorMetricsCollector(boolean enabled, IntSupplier totalValidators, IntSupplier activeValidators) {
        this.enabled = enabled;
        this.timeService = TimeService.create(enabled);
        this.totalValidators = totalValidators;
        this.activeValidators = activeValidators;
    }

    public ValidatorMetrics view() {
        return enabled ? this : ValidatorMetrics.disabled();
    }

    public long start() {
        return timeService.nanos();
    }

    public void claimProcessed(ClaimResult result, long start) {
        if (!enabled) return;

        claims.increment();
        record(result, start);
    }

    public void disputeProcessed(ClaimResult result, boolean removed, long start) {
        if (!enabled) return;

        disputes.increment();
        if (removed) removals.increment();
        record(result, start);
    }

    public void epochFinalized() {
        if (!enabled) return;

        epochs.increment();
    }

    private void record(ClaimResult result, long start) {
        switch (result.outcome()) {
            case CONFLICT -> conflicts.increment();
            case CONSENSUS -> consensus.increment();
            default -> { }
        }
        latency.recordLatency(timeService.interval(start));
    }

    @Override
    public long getClaimsSubmitted() {
        return claims.sum();
    }

    @Override
    public long getConflicts() {
        return conflicts.sum();
    }

    @Override
    public long getConsensusReached() {
        return consensus.sum();
    }

    @Override
    public long getDisputesResolved() {
        return disputes.sum();
    }

    @Override
    public long getValidatorsRemoved() {
        return removals.sum();
    }

    @Override
    public long getEpochsFinalized() {
        return epochs.sum();
    }

    @Override
    public int getTotalValidators() {
        return totalValidators.getAsInt();
    }

    @Override
    public int getActiveValidators() {
        return activeValidators.getAsInt();
    }

    @Override
    public LatencyMetrics getProcessingLatency() {
        return latency;
    }
}
