package io.delegate.lifetime;

/**
 * Lifetime capability for objects that own delegate subscriptions.
 *
 * <p>Extend it, or keep one as a field and pass it to
 * {@link io.delegate.Delegate#add(Object, Lifetime...) Delegate.add}. Every registration
 * bound to this observer is skipped and evicted once the observer is destroyed, without
 * the owner unsubscribing anything.
 *
 * <p>An observer is destroyed when {@link #close()} is called, or when it becomes
 * unreachable and is garbage-collected. The second path only works if the registered
 * callable does not itself reference the observer: a bound method reference such as
 * {@code this::onChange} keeps its target reachable. Call {@code close()} for
 * deterministic teardown.
 *
 * <pre>{@code
 * class Label extends Observer {
 *     Label(DelegateValue<String> text) {
 *         text.add(this::render, this);
 *     }
 *
 *     void render(String value) { ... }
 * }
 *
 * Label label = new Label(text);
 * text.set("hello");   // rendered
 * label.close();
 * text.set("bye");     // label's callback evicted, not called
 * }</pre>
 */
public class Observer implements Lifetime, AutoCloseable {
    private final LivenessToken token = new LivenessToken();

    @Override
    public final LivenessToken livenessToken() {
        return token;
    }

    /**
     * @return {@code true} once {@link #close()} has been called
     */
    public final boolean isClosed() {
        return !token.isValid();
    }

    /**
     * Invalidates this observer's token. Idempotent.
     */
    @Override
    public void close() {
        token.invalidate();
    }
}
