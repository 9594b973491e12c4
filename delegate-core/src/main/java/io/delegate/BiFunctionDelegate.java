package io.delegate;

import java.util.List;
import java.util.function.BiFunction;

/**
 * Delegate over {@code R(A, B)} callables.
 *
 * @param <A> the first argument type
 * @param <B> the second argument type
 * @param <R> the result type
 */
public class BiFunctionDelegate<A, B, R>
        extends ValueDelegate<BiFunction<? super A, ? super B, ? extends R>, R>
        implements BiFunction<A, B, List<R>> {

    public BiFunctionDelegate() {
    }

    public BiFunctionDelegate(DelegateConfig config) {
        super(config);
    }

    public List<R> invoke(A first, B second) {
        return invokeAll(function -> function.apply(first, second));
    }

    @Override
    public List<R> apply(A first, B second) {
        return invoke(first, second);
    }
}
