/**
 * Observer lifetimes and the liveness tokens delegates use to detect their end.
 *
 * @see io.delegate.lifetime.Observer
 * @see io.delegate.lifetime.LivenessToken
 */
package io.delegate.lifetime;
