package io.delegate.spi;

/**
 * Observability hook for exporting delegate counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems. Calls are made on
 * the thread that mutates or invokes the delegate, so implementations must be cheap and
 * thread-safe.
 */
public interface DelegateMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    DelegateMetrics NOOP = new Noop();

    /**
     * Records one completed invocation of the delegate.
     *
     * @param callbacks number of callables actually called (expired entries excluded)
     */
    void recordInvocation(int callbacks);

    /**
     * Increments the count of registrations evicted because their observer died.
     *
     * @param count number of registrations evicted, always positive
     */
    void incrementEvicted(int count);

    /**
     * Increments the count of registrations removed explicitly (remove, cancel, clear).
     *
     * @param count number of registrations removed, always positive
     */
    void incrementRemoved(int count);

    /**
     * Records a change in the number of registrations held: positive when a callable is
     * added, negative when registrations are removed or evicted. Summing the deltas gives
     * the total across every delegate sharing this instance.
     *
     * @param delta change in registration count, never zero
     */
    void adjustRegistrations(int delta);

    /**
     * Increments the count of invocations aborted by a throwing callable.
     */
    default void incrementCallbackFailure() {
    }

    /**
     * Records the wall time of one invocation, including every callable it ran.
     *
     * @param durationNanos duration in nanoseconds (always non-negative)
     */
    default void recordInvocationDurationNanos(long durationNanos) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements DelegateMetrics {
        @Override
        public void recordInvocation(int callbacks) {
        }

        @Override
        public void incrementEvicted(int count) {
        }

        @Override
        public void incrementRemoved(int count) {
        }

        @Override
        public void adjustRegistrations(int delta) {
        }
    }
}
