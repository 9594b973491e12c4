package io.delegate;

import java.util.function.BiConsumer;

/**
 * Delegate over {@code void(A, B)} callables.
 *
 * @param <A> the first argument type
 * @param <B> the second argument type
 */
public class BiConsumerDelegate<A, B> extends VoidDelegate<BiConsumer<? super A, ? super B>>
        implements BiConsumer<A, B> {

    public BiConsumerDelegate() {
    }

    public BiConsumerDelegate(DelegateConfig config) {
        super(config);
    }

    public void invoke(A first, B second) {
        invokeEach(consumer -> consumer.accept(first, second));
    }

    @Override
    public void accept(A first, B second) {
        invoke(first, second);
    }
}
