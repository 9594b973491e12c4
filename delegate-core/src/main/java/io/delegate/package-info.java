/**
 * Lifetime-aware, thread-safe callback dispatch.
 *
 * <p>A {@linkplain io.delegate.Delegate delegate} is an ordered registry of callables
 * invoked as a group on the caller's thread. Callables can be bound to the lifetime of
 * one or more {@linkplain io.delegate.lifetime.Observer observers}; once an observer is
 * closed (or garbage-collected) its callables stop being called and are evicted lazily,
 * without the observer unsubscribing.
 *
 * <h2>Invocation Strategies</h2>
 * <ul>
 *   <li>{@link io.delegate.VoidDelegate} fires callables and discards results:
 *       {@link io.delegate.ActionDelegate}, {@link io.delegate.ConsumerDelegate},
 *       {@link io.delegate.BiConsumerDelegate}</li>
 *   <li>{@link io.delegate.ValueDelegate} collects one result per live callable:
 *       {@link io.delegate.SupplierDelegate}, {@link io.delegate.FunctionDelegate},
 *       {@link io.delegate.BiFunctionDelegate}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * class Thermostat extends Observer {
 *     Thermostat(ConsumerDelegate<Double> temperature) {
 *         temperature.add(this::onTemperature, this);
 *     }
 *
 *     void onTemperature(double celsius) { ... }
 * }
 *
 * var temperature = new ConsumerDelegate<Double>();
 * var thermostat = new Thermostat(temperature);
 * temperature.invoke(21.5);   // thermostat notified
 * thermostat.close();
 * temperature.invoke(22.0);   // thermostat's registration evicted
 * }</pre>
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>delegate-core</b>: delegates, observers, value wrapper (zero external deps)</li>
 *   <li><b>delegate-micrometer</b>: Micrometer bridge for
 *       {@link io.delegate.spi.DelegateMetrics}</li>
 * </ul>
 *
 * @see io.delegate.Delegate
 * @see io.delegate.Registration
 * @see io.delegate.DelegateConfig
 * @see io.delegate.value.DelegateValue
 */
package io.delegate;
