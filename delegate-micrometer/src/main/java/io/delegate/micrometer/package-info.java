/**
 * Micrometer bridge for exporting delegate metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.delegate.micrometer.MicrometerDelegateMetrics} implements the
 * {@link io.delegate.spi.DelegateMetrics} SPI using Micrometer counters, a gauge and
 * distribution summaries.
 *
 * @see io.delegate.micrometer.MicrometerDelegateMetrics
 */
package io.delegate.micrometer;
