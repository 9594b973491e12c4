package io.delegate;

import java.util.List;
import java.util.function.Supplier;

/**
 * Delegate over {@code R()} callables; an invocation returns every live supplier's value.
 *
 * @param <R> the result type
 */
public class SupplierDelegate<R> extends ValueDelegate<Supplier<? extends R>, R>
        implements Supplier<List<R>> {

    public SupplierDelegate() {
    }

    public SupplierDelegate(DelegateConfig config) {
        super(config);
    }

    public List<R> invoke() {
        return invokeAll(supplier -> supplier.get());
    }

    @Override
    public List<R> get() {
        return invoke();
    }
}
