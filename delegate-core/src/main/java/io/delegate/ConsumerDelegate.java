package io.delegate;

import java.util.function.Consumer;

/**
 * Delegate over {@code void(A)} callables.
 *
 * <pre>{@code
 * ConsumerDelegate<String> messages = new ConsumerDelegate<>();
 * messages.add(log::info);
 * messages.add(view::append, view);
 * messages.invoke("connected");
 * }</pre>
 *
 * @param <A> the argument type
 */
public class ConsumerDelegate<A> extends VoidDelegate<Consumer<? super A>> implements Consumer<A> {

    public ConsumerDelegate() {
    }

    public ConsumerDelegate(DelegateConfig config) {
        super(config);
    }

    public void invoke(A argument) {
        invokeEach(consumer -> consumer.accept(argument));
    }

    @Override
    public void accept(A argument) {
        invoke(argument);
    }
}
