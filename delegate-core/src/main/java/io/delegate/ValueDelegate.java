package io.delegate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Delegate whose callables return a value: every live callable is fired and its result
 * collected.
 *
 * <p>The results come back in registration order, one per callable actually called.
 * Expired registrations contribute nothing. Duplicates and {@code null} results are kept.
 * With no live callables the result is an empty list, never {@code null}.
 *
 * @param <F> the callable type
 * @param <R> the result type
 * @see VoidDelegate
 */
public class ValueDelegate<F, R> extends Delegate<F> {

    public ValueDelegate() {
    }

    public ValueDelegate(DelegateConfig config) {
        super(config);
    }

    /**
     * Fires every live callable in registration order and collects the results.
     *
     * @param call applies one callable to the invocation arguments
     * @return unmodifiable list of results
     */
    public List<R> invokeAll(Function<? super F, ? extends R> call) {
        Objects.requireNonNull(call, "call");
        List<R> results = new ArrayList<>();
        forEachLive(callable -> results.add(call.apply(callable)));
        return Collections.unmodifiableList(results);
    }
}
