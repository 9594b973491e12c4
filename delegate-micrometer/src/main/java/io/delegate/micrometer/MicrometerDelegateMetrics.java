package io.delegate.micrometer;

import io.delegate.spi.DelegateMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link DelegateMetrics}.
 *
 * <p>Registers counters, a gauge and distribution summaries with a {@link MeterRegistry}
 * for export to Prometheus, Grafana, Datadog, and other monitoring backends. Share one
 * instance between delegates to aggregate them (counters add up and the registrations
 * gauge shows the total held by all of them), or give each delegate its own prefix.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code delegate.invocations}: completed invocations</li>
 *   <li>{@code delegate.callbacks}: callables called across all invocations</li>
 *   <li>{@code delegate.callbacks.failed}: invocations aborted by a throwing callable</li>
 *   <li>{@code delegate.registrations.evicted}: registrations evicted after their observer died</li>
 *   <li>{@code delegate.registrations.removed}: registrations removed explicitly</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code delegate.registrations}: registrations currently held by the reporting delegates</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code delegate.invocation.fanout}: callables called per invocation</li>
 *   <li>{@code delegate.invocation.duration.ns}: invocation wall time in nanoseconds</li>
 * </ul>
 *
 * @see DelegateMetrics
 */
public final class MicrometerDelegateMetrics implements DelegateMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter invocations;
    private final Counter callbacks;
    private final Counter callbackFailures;
    private final Counter evicted;
    private final Counter removed;
    private final Gauge registrationsGauge;
    private final DistributionSummary fanout;
    private final DistributionSummary invocationDuration;

    private final AtomicInteger registrations = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates metrics with the default meter name prefix {@code "delegate"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerDelegateMetrics(MeterRegistry registry) {
        this(registry, "delegate");
    }

    /**
     * Creates metrics with a custom meter name prefix, one per delegate you want to tell apart.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.placed"})
     */
    public MicrometerDelegateMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.invocations = Counter.builder(namePrefix + ".invocations")
                .description("Completed delegate invocations")
                .register(registry);
        this.callbacks = Counter.builder(namePrefix + ".callbacks")
                .description("Callables called across all invocations")
                .register(registry);
        this.callbackFailures = Counter.builder(namePrefix + ".callbacks.failed")
                .description("Invocations aborted by a throwing callable")
                .register(registry);
        this.evicted = Counter.builder(namePrefix + ".registrations.evicted")
                .description("Registrations evicted because an observer was destroyed")
                .register(registry);
        this.removed = Counter.builder(namePrefix + ".registrations.removed")
                .description("Registrations removed explicitly")
                .register(registry);

        this.registrationsGauge = Gauge.builder(namePrefix + ".registrations", registrations, AtomicInteger::get)
                .description("Registrations currently held by the reporting delegates")
                .register(registry);

        this.fanout = DistributionSummary.builder(namePrefix + ".invocation.fanout")
                .description("Callables called per invocation")
                .register(registry);
        this.invocationDuration = DistributionSummary.builder(namePrefix + ".invocation.duration.ns")
                .description("Invocation wall time in nanoseconds")
                .baseUnit("nanoseconds")
                .register(registry);
    }

    @Override
    public void recordInvocation(int callbackCount) {
        if (closed) return;
        invocations.increment();
        callbacks.increment(callbackCount);
        fanout.record(callbackCount);
    }

    @Override
    public void incrementEvicted(int count) {
        if (closed) return;
        evicted.increment(count);
    }

    @Override
    public void incrementRemoved(int count) {
        if (closed) return;
        removed.increment(count);
    }

    @Override
    public void adjustRegistrations(int delta) {
        if (closed) return;
        registrations.addAndGet(delta);
    }

    @Override
    public void incrementCallbackFailure() {
        if (closed) return;
        callbackFailures.increment();
    }

    @Override
    public void recordInvocationDurationNanos(long durationNanos) {
        if (closed) return;
        invocationDuration.record(durationNanos);
    }

    /**
     * Removes all meters registered by this instance from the registry.
     *
     * <p>Call this when the delegates reporting here are discarded, to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(invocations, callbacks, callbackFailures, evicted, removed,
                registrationsGauge, fanout, invocationDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
