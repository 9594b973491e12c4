package io.delegate.lifetime;

/**
 * Something whose end can be observed by a delegate registration.
 *
 * <p>{@link Observer} is the canonical implementation. A class that cannot extend
 * {@code Observer} can hold one as a field and implement this interface by returning
 * the field's token:
 *
 * <pre>{@code
 * class PriceTicker implements Lifetime {
 *     private final Observer observer = new Observer();
 *
 *     PriceTicker(ConsumerDelegate<Price> prices) {
 *         prices.add(this::onPrice, this);
 *     }
 *
 *     public LivenessToken livenessToken() {
 *         return observer.livenessToken();
 *     }
 * }
 * }</pre>
 *
 * @see Observer
 */
public interface Lifetime {

    /**
     * Returns the token tracking this lifetime. Must return the same instance on every call.
     *
     * @return the liveness token, never {@code null}
     */
    LivenessToken livenessToken();
}
