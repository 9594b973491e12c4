package io.delegate;

/**
 * How a delegate runs its callables relative to its registry lock.
 *
 * @see DelegateConfig#setInvocationMode(InvocationMode)
 */
public enum InvocationMode {

    /**
     * The default. The lock is held across every callable of an invocation, so
     * invocations are serialized with each other and with mutations: a concurrent
     * {@code invoke}, {@code add}, {@code remove} or {@code clear} waits until the
     * batch completes. A callable that calls back into the same delegate gets an
     * {@link IllegalStateException}.
     */
    LOCKED,

    /**
     * Expired entries are evicted and the live entries copied while the lock is held;
     * callables then run with the lock released. A callable may add, remove, clear or
     * invoke on the same delegate. Entries added during an invocation first run on the
     * next one; entries removed or expired during an invocation are skipped if not yet
     * reached. Invocations from different threads may overlap, and a callable already
     * past its liveness check may still run after a concurrent removal returns.
     */
    SNAPSHOT
}
