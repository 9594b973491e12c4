/**
 * Service provider interfaces for plugging delegates into external infrastructure.
 *
 * <p>{@link io.delegate.spi.DelegateMetrics} is the only extension point today; the
 * {@code delegate-micrometer} module ships a Micrometer implementation.
 */
package io.delegate.spi;
