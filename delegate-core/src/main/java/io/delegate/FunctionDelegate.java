package io.delegate;

import java.util.List;
import java.util.function.Function;

/**
 * Delegate over {@code R(A)} callables; an invocation returns one result per live
 * function, in registration order.
 *
 * <pre>{@code
 * FunctionDelegate<Integer, Integer> transforms = new FunctionDelegate<>();
 * transforms.add(x -> x + 1);
 * transforms.add(x -> x * 2);
 * transforms.invoke(3);   // [4, 6]
 * }</pre>
 *
 * @param <A> the argument type
 * @param <R> the result type
 */
public class FunctionDelegate<A, R> extends ValueDelegate<Function<? super A, ? extends R>, R>
        implements Function<A, List<R>> {

    public FunctionDelegate() {
    }

    public FunctionDelegate(DelegateConfig config) {
        super(config);
    }

    public List<R> invoke(A argument) {
        return invokeAll(function -> function.apply(argument));
    }

    @Override
    public List<R> apply(A argument) {
        return invoke(argument);
    }
}
