package org.descartes.validator.metrics;

import org.descartes.validator.configuration.Property;

import static org.descartes.validator.configuration.RuntimeProperties.PROPERTY_PREFIX;

/**
 * Counters over the lifetime of a validator manager.
 *
 * <p>
 * Metrics are disabled by default, in which case every getter returns -1. Enable them with {@link #METRICS_ENABLED}.
 * </p>
 *
 * @since 1.0
 */
public interface ValidatorMetrics {

    String METRICS_PROPERTY_PREFIX = PROPERTY_PREFIX + ".validator.metrics";

    Property METRICS_ENABLED = Property.create(METRICS_PROPERTY_PREFIX + ".enabled")
            .withDisplayName("Validator metrics enabled")
            .withDescription("Enable metrics collection")
            .withDefaultValue(false)
            .build();

    long getClaimsSubmitted();

    long getConflicts();

    long getConsensusReached();

    long getDisputesResolved();

    long getValidatorsRemoved();

    long getEpochsFinalized();

    int getTotalValidators();

    int getActiveValidators();

    LatencyMetrics getProcessingLatency();

    static ValidatorMetrics disabled() {
        return DisabledValidatorMetrics.INSTANCE;
    }

    final class DisabledValidatorMetrics implements ValidatorMetrics {

        private static final DisabledValidatorMetrics INSTANCE = new DisabledValidatorMetrics();

        private static final LatencyMetrics LATENCY_METRICS = new LatencyMetrics() {
            @Override
            public double getAvgLatency() {
                return -1;
            }

            @Override
            public double getP99Latency() {
                return -1;
            }

            @Override
            public double getMaxLatency() {
                return -1;
            }

            @Override
            public double getPercentile(double p) {
                return -1;
            }

            @Override
            public long getTotalMeasurements() {
                return -1;
            }
        };

        private DisabledValidatorMetrics() { }

        @Override
        public long getClaimsSubmitted() {
            return -1;
        }

        @Override
        public long getConflicts() {
            return -1;
        }

        @Override
        public long getConsensusReached() {
            return -1;
        }

        @Override
        public long getDisputesResolved() {
            return -1;
        }

        @Override
        public long getValidatorsRemoved() {
            return -1;
        }

        @Override
        public long getEpochsFinalized() {
            return -1;
        }

        @Override
        public int getTotalValidators() {
            return -1;
        }

        @Override
        public int getActiveValidators() {
            return -1;
        }

        @Override
        public LatencyMetrics getProcessingLatency() {
            return LATENCY_METRICS;
        }
    }
}
