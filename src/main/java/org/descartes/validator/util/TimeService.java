package org.descartes.validator.util;

import java.time.Instant;

/**
 * Source of wall-clock and monotonic time.
 *
 * <p>
 * The coordinator reads epoch and challenge deadlines from {@link #now()}, and the metrics collector measures call
 * latency with {@link #nanos()}. Tests replace it to drive deadlines without sleeping.
 * </p>
 *
 * @since 1.0
 */
public interface TimeService {

    Instant now();

    long nanos();

    long interval(long start);

    static TimeService create(boolean enabled) {
        return enabled ? new SystemTimeService() : new DisabledTimeService();
    }

    static TimeService system() {
        return new SystemTimeService();
    }

    final class DisabledTimeService implements TimeService {

        @Override
        public Instant now() {
            return Instant.EPOCH;
        }

        @Override
        public long nanos() {
            return 0;
        }

        @Override
        public long interval(long start) {
            return 0;
        }
    }

    final class SystemTimeService implements TimeService {

        @Override
        public Instant now() {
            return Instant.now();
        }

        @Override
        public long nanos() {
            return System.nanoTime();
        }

        @Override
        public long interval(long start) {
            return nanos() - start;
        }
    }
}
