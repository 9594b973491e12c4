package io.delegate.value;

import io.delegate.ConsumerDelegate;
import io.delegate.DelegateConfig;

import java.util.Objects;
import java.util.function.Function;

/**
 * A single value that notifies its subscribers whenever it is assigned.
 *
 * <p>{@link #set(Object)} stores the new value first and then invokes the delegate with
 * it, so a subscriber reading {@link #get()} during notification sees the new value.
 * Every assignment notifies, including one that assigns an equal value. Reads never
 * notify.
 *
 * <p>Being a {@link java.util.function.Consumer}, a {@code DelegateValue} can itself be
 * subscribed to another delegate; {@link #accept(Object)} assigns.
 *
 * <pre>{@code
 * DelegateValue<Integer> volume = new DelegateValue<>(5);
 * volume.add(level -> mixer.setGain(level), mixer);
 * volume.set(7);      // mixer sees 7
 * volume.get();       // 7
 * }</pre>
 *
 * @param <T> the value type; {@code null} values are allowed
 */
public class DelegateValue<T> extends ConsumerDelegate<T> {
    private volatile T value;

    /**
     * Creates a wrapper holding {@code null}.
     */
    public DelegateValue() {
        this(null);
    }

    public DelegateValue(T initialValue) {
        this.value = initialValue;
    }

    public DelegateValue(T initialValue, DelegateConfig config) {
        super(config);
        this.value = initialValue;
    }

    public T get() {
        return value;
    }

    /**
     * Stores {@code newValue}, then notifies every live subscriber with it.
     *
     * @param newValue the value to assign
     * @return this wrapper
     */
    public DelegateValue<T> set(T newValue) {
        this.value = newValue;
        invoke(newValue);
        return this;
    }

    /**
     * Reads a property of the current value without notifying anyone.
     *
     * @param mapper function applied to the current value
     * @param <U>    the property type
     * @return the mapped value
     */
    public <U> U map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return mapper.apply(value);
    }

    @Override
    public void accept(T newValue) {
        set(newValue);
    }

    @Override
    public String toString() {
        return "DelegateValue[" + value + "]";
    }
}
