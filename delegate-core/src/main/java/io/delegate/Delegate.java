package io.delegate;

import io.delegate.lifetime.Lifetime;
import io.delegate.lifetime.LivenessToken;
import io.delegate.spi.DelegateMetrics;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe, ordered registry of callables that are invoked as a group.
 *
 * <p>Each callable may be bound to one or more {@linkplain Lifetime observers}. Once any
 * of them is destroyed the callable is no longer called, and its registration is evicted
 * the next time the delegate adds, invokes, or purges. The owner never has to
 * unsubscribe.
 *
 * <p>What happens with a callable's return value is decided by the subclass:
 * {@link VoidDelegate} discards it, {@link ValueDelegate} collects it. Use the
 * arity-specific subclasses ({@link ConsumerDelegate}, {@link FunctionDelegate}, ...) for
 * {@code java.util.function} signatures, or the two strategy classes directly for your
 * own listener interfaces.
 *
 * <h2>Thread Safety</h2>
 * <p>Every instance owns one lock guarding its registration list; there is no shared
 * state between instances. Callables run synchronously on the invoking thread, in
 * registration order. Whether the lock is held while they run is decided by the
 * {@link InvocationMode}.
 *
 * <h2>Errors</h2>
 * <p>A callable that throws aborts the rest of the invocation and the exception reaches
 * the invoking thread unchanged.
 *
 * @param <F> the callable type
 * @see Registration
 * @see DelegateConfig
 */
public abstract class Delegate<F> {
    private static final Logger logger = Logger.getLogger(Delegate.class.getName());

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Registration<F>> registrations = new ArrayList<>();
    private final String name;
    private final InvocationMode invocationMode;
    private final DelegateMetrics metrics;

    protected Delegate() {
        this(new DelegateConfig());
    }

    protected Delegate(DelegateConfig config) {
        Objects.requireNonNull(config, "config");
        this.name = config.getName();
        this.invocationMode = config.getInvocationMode();
        this.metrics = config.getMetrics();
    }

    /**
     * Registers a callable, optionally bound to the lifetimes of one or more observers.
     *
     * <p>The observers' liveness tokens are weakly referenced, never owned. With no
     * observers the callable lives until it is removed.
     *
     * @param callable  the callable to register
     * @param observers observers whose destruction should end this registration
     * @return a handle for exact removal
     */
    public final Registration<F> add(F callable, Lifetime... observers) {
        Objects.requireNonNull(observers, "observers");
        return add(callable, Arrays.asList(observers));
    }

    /**
     * Registers a callable bound to every observer in {@code observers}.
     *
     * @param callable  the callable to register
     * @param observers observers whose destruction should end this registration
     * @return a handle for exact removal
     */
    public final Registration<F> add(F callable, Iterable<? extends Lifetime> observers) {
        Objects.requireNonNull(callable, "callable");
        Objects.requireNonNull(observers, "observers");
        List<WeakReference<LivenessToken>> tokens = new ArrayList<>();
        for (Lifetime observer : observers) {
            Objects.requireNonNull(observer, "observer");
            LivenessToken token = Objects.requireNonNull(observer.livenessToken(), "livenessToken");
            tokens.add(new WeakReference<>(token));
        }
        Registration<F> registration = new Registration<>(this, callable, List.copyOf(tokens));

        acquire();
        try {
            evictExpired();
            registrations.add(registration);
            metrics.adjustRegistrations(1);
        } finally {
            lock.unlock();
        }
        return registration;
    }

    /**
     * Removes every registration whose callable has the same runtime class as
     * {@code callable}.
     *
     * <p>Matching is by type, not by instance: all closures created by the same lambda
     * expression or method reference share a class, so removing one of them removes
     * all of them. Keep the {@link Registration} returned by {@code add} when exact
     * removal matters.
     *
     * @param callable a callable of the type to remove
     * @return number of registrations removed
     */
    public final int remove(F callable) {
        Objects.requireNonNull(callable, "callable");
        Class<?> type = callable.getClass();
        acquire();
        try {
            int removed = 0;
            Iterator<Registration<F>> it = registrations.iterator();
            while (it.hasNext()) {
                Registration<F> registration = it.next();
                if (registration.hasCallableOfType(type)) {
                    it.remove();
                    registration.markRemoved();
                    removed++;
                }
            }
            if (removed > 0) {
                metrics.incrementRemoved(removed);
                metrics.adjustRegistrations(-removed);
            }
            if (removed > 1 && logger.isLoggable(Level.FINE)) {
                logger.fine("Delegate '" + name + "' removed " + removed
                        + " registrations sharing callable type " + type.getName());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes exactly the given registration.
     *
     * @param registration a handle returned by {@code add} on this delegate
     * @return {@code true} if it was still registered
     */
    public final boolean remove(Registration<F> registration) {
        Objects.requireNonNull(registration, "registration");
        return removeRegistration(registration);
    }

    boolean removeRegistration(Registration<F> registration) {
        acquire();
        try {
            if (!registrations.remove(registration)) {
                return false;
            }
            registration.markRemoved();
            metrics.incrementRemoved(1);
            metrics.adjustRegistrations(-1);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes all registrations.
     */
    public final void clear() {
        acquire();
        try {
            int removed = registrations.size();
            if (removed == 0) {
                return;
            }
            for (Registration<F> registration : registrations) {
                registration.markRemoved();
            }
            registrations.clear();
            metrics.incrementRemoved(removed);
            metrics.adjustRegistrations(-removed);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Shorthand for {@code add(callable)} that returns this delegate for chaining.
     *
     * @param callable the callable to register
     * @return this delegate
     */
    public Delegate<F> plus(F callable) {
        add(callable);
        return this;
    }

    /**
     * Shorthand for {@link #remove(Object)} that returns this delegate for chaining.
     *
     * @param callable a callable of the type to remove
     * @return this delegate
     */
    public Delegate<F> minus(F callable) {
        remove(callable);
        return this;
    }

    /**
     * Evicts every expired registration now instead of waiting for the next add or invoke.
     *
     * @return number of registrations evicted
     */
    public final int purgeExpired() {
        acquire();
        try {
            return evictExpired();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of registrations currently held, including expired ones that
     * have not been evicted yet.
     *
     * @return the registration count
     */
    public final int size() {
        lock.lock();
        try {
            return registrations.size();
        } finally {
            lock.unlock();
        }
    }

    public final boolean isEmpty() {
        return size() == 0;
    }

    public final String name() {
        return name;
    }

    public final InvocationMode invocationMode() {
        return invocationMode;
    }

    /**
     * Calls {@code call} once for every live registration, in registration order,
     * evicting expired registrations on the way. An empty delegate returns at once
     * and reports nothing to its metrics.
     *
     * @param call applies one callable to the invocation arguments
     * @return number of callables called
     */
    protected final int forEachLive(Consumer<? super F> call) {
        Objects.requireNonNull(call, "call");
        if (isEmpty()) {
            return 0;
        }
        long start = System.nanoTime();
        int called = invocationMode == InvocationMode.LOCKED
                ? invokeLocked(call)
                : invokeSnapshot(call);
        metrics.recordInvocation(called);
        metrics.recordInvocationDurationNanos(System.nanoTime() - start);
        return called;
    }

    private int invokeLocked(Consumer<? super F> call) {
        acquire();
        int evicted = 0;
        try {
            if (registrations.isEmpty()) {
                return 0;
            }
            int called = 0;
            Iterator<Registration<F>> it = registrations.iterator();
            while (it.hasNext()) {
                Registration<F> registration = it.next();
                if (registration.isExpired()) {
                    it.remove();
                    registration.markRemoved();
                    evicted++;
                    continue;
                }
                callOne(registration, call);
                called++;
            }
            return called;
        } finally {
            if (evicted > 0) {
                onEvicted(evicted);
            }
            lock.unlock();
        }
    }

    private int invokeSnapshot(Consumer<? super F> call) {
        List<Registration<F>> snapshot;
        acquire();
        try {
            evictExpired();
            if (registrations.isEmpty()) {
                return 0;
            }
            snapshot = new ArrayList<>(registrations);
        } finally {
            lock.unlock();
        }

        int called = 0;
        for (Registration<F> registration : snapshot) {
            // removed or expired by an earlier callable of this invocation
            if (!registration.isActive()) {
                continue;
            }
            callOne(registration, call);
            called++;
        }
        return called;
    }

    private void callOne(Registration<F> registration, Consumer<? super F> call) {
        try {
            call.accept(registration.callable());
        } catch (RuntimeException e) {
            metrics.incrementCallbackFailure();
            logger.log(Level.FINE, "Callable of delegate '" + name + "' failed; "
                    + "remaining callables of this invocation are skipped", e);
            throw e;
        }
    }

    // Caller must hold the lock.
    private int evictExpired() {
        int evicted = 0;
        Iterator<Registration<F>> it = registrations.iterator();
        while (it.hasNext()) {
            Registration<F> registration = it.next();
            if (registration.isExpired()) {
                it.remove();
                registration.markRemoved();
                evicted++;
            }
        }
        if (evicted > 0) {
            onEvicted(evicted);
        }
        return evicted;
    }

    private void onEvicted(int evicted) {
        metrics.incrementEvicted(evicted);
        metrics.adjustRegistrations(-evicted);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Delegate '" + name + "' evicted " + evicted
                    + " expired registration(s), " + registrations.size() + " remaining");
        }
    }

    private void acquire() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Re-entrant call on delegate '" + name
                    + "' while its registry lock is held by the current thread");
        }
        lock.lock();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", size=" + size() + "]";
    }
}
