package io.delegate;

import io.delegate.spi.DelegateMetrics;

import java.util.Objects;

/**
 * Construction-time settings for a {@link Delegate}.
 *
 * <p>Values are read once when the delegate is created; changing a config afterwards
 * does not affect delegates already built from it. Defaults: name {@code "delegate"},
 * {@link InvocationMode#LOCKED}, {@link DelegateMetrics#NOOP}.
 *
 * <pre>{@code
 * var config = new DelegateConfig()
 *     .setName("order-events")
 *     .setInvocationMode(InvocationMode.SNAPSHOT)
 *     .setMetrics(new MicrometerDelegateMetrics(meterRegistry, "orders.delegate"));
 * var orderPlaced = new ConsumerDelegate<Order>(config);
 * }</pre>
 */
public final class DelegateConfig {
    private String name = "delegate";
    private InvocationMode invocationMode = InvocationMode.LOCKED;
    private DelegateMetrics metrics = DelegateMetrics.NOOP;

    public String getName() {
        return name;
    }

    /**
     * @param name label used in log messages; must not be blank
     * @return this config
     */
    public DelegateConfig setName(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        return this;
    }

    public InvocationMode getInvocationMode() {
        return invocationMode;
    }

    public DelegateConfig setInvocationMode(InvocationMode invocationMode) {
        this.invocationMode = Objects.requireNonNull(invocationMode, "invocationMode");
        return this;
    }

    public DelegateMetrics getMetrics() {
        return metrics;
    }

    public DelegateConfig setMetrics(DelegateMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        return this;
    }
}
