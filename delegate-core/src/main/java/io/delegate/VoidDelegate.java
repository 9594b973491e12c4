package io.delegate;

import java.util.function.Consumer;

/**
 * Delegate whose callables return nothing: each live callable is fired and no result is
 * kept. An invocation of an empty delegate returns immediately.
 *
 * <p>Usable directly with any listener interface:
 *
 * <pre>{@code
 * interface PriceListener {
 *     void onPrice(String symbol, double price);
 * }
 *
 * VoidDelegate<PriceListener> prices = new VoidDelegate<>();
 * prices.add((symbol, price) -> chart.plot(symbol, price), chart);
 * prices.invokeEach(listener -> listener.onPrice("ACME", 12.5));
 * }</pre>
 *
 * @param <F> the callable type
 * @see ValueDelegate
 */
public class VoidDelegate<F> extends Delegate<F> {

    public VoidDelegate() {
    }

    public VoidDelegate(DelegateConfig config) {
        super(config);
    }

    /**
     * Fires every live callable in registration order.
     *
     * @param call applies one callable to the invocation arguments
     */
    public void invokeEach(Consumer<? super F> call) {
        forEachLive(call);
    }
}
