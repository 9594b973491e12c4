/**
 * Values that notify subscribers on assignment, built on
 * {@link io.delegate.ConsumerDelegate}.
 */
package io.delegate.value;
