package io.delegate;

/**
 * Delegate over {@code void()} callables. Is itself a {@link Runnable}, so it can be
 * registered with another delegate or handed to an executor.
 */
public class ActionDelegate extends VoidDelegate<Runnable> implements Runnable {

    public ActionDelegate() {
    }

    public ActionDelegate(DelegateConfig config) {
        super(config);
    }

    public void invoke() {
        invokeEach(action -> action.run());
    }

    @Override
    public void run() {
        invoke();
    }
}
