package io.delegate;

import io.delegate.lifetime.LivenessToken;

import java.lang.ref.WeakReference;
import java.util.List;

/**
 * One callable registered with a {@link Delegate}, together with weak references to the
 * liveness tokens of the observers it was bound to.
 *
 * <p>A registration never owns its observers' tokens. It is <em>expired</em> as soon as
 * any of them has been invalidated or garbage-collected; a registration bound to no
 * observer never expires. Expired registrations are not called and are evicted by the
 * delegate the next time it adds, invokes, or purges.
 *
 * <p>The handle also gives exact removal: {@link #cancel()} removes this registration
 * and nothing else, unlike {@link Delegate#remove(Object)} which matches by type.
 *
 * @param <F> the callable type
 */
public final class Registration<F> implements AutoCloseable {
    private final Delegate<F> owner;
    private final F callable;
    private final List<WeakReference<LivenessToken>> tokens;
    private volatile boolean removed;

    Registration(Delegate<F> owner, F callable, List<WeakReference<LivenessToken>> tokens) {
        this.owner = owner;
        this.callable = callable;
        this.tokens = tokens;
    }

    public F callable() {
        return callable;
    }

    /**
     * @return how many observers this registration was bound to
     */
    public int observerCount() {
        return tokens.size();
    }

    /**
     * Checks whether any bound observer has been destroyed. Does not modify the registration.
     *
     * @return {@code true} if at least one observer token is invalid or collected
     */
    public boolean isExpired() {
        for (WeakReference<LivenessToken> ref : tokens) {
            LivenessToken token = ref.get();
            if (token == null || !token.isValid()) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return {@code true} if this registration is still in its delegate and not expired
     */
    public boolean isActive() {
        return !removed && !isExpired();
    }

    /**
     * Removes this registration from its delegate.
     *
     * @return {@code true} if it was still registered
     */
    public boolean cancel() {
        return owner.removeRegistration(this);
    }

    /**
     * Same as {@link #cancel()}, for try-with-resources scoping of a subscription.
     */
    @Override
    public void close() {
        cancel();
    }

    void markRemoved() {
        removed = true;
    }

    boolean hasCallableOfType(Class<?> type) {
        return callable.getClass() == type;
    }

    @Override
    public String toString() {
        return "Registration[callable=" + callable.getClass().getName()
                + ", observers=" + tokens.size()
                + ", active=" + isActive() + "]";
    }
}
