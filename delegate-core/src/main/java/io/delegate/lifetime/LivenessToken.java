package io.delegate.lifetime;

/**
 * Shared flag telling whether the {@link Observer} that minted it is still alive.
 *
 * <p>The owning observer holds the only strong reference; delegate registrations hold
 * weak references. A token reports dead once {@link #invalidate()} has run or once the
 * observer (and with it the token) has been garbage-collected and the weak reference
 * cleared. Invalidation is one-way.
 *
 * <p>This class is thread-safe.
 */
public final class LivenessToken {
    private volatile boolean valid = true;

    LivenessToken() {
    }

    /**
     * @return {@code true} until the owning observer is closed
     */
    public boolean isValid() {
        return valid;
    }

    void invalidate() {
        valid = false;
    }

    @Override
    public String toString() {
        return "LivenessToken[" + (valid ? "valid" : "invalid") + "]";
    }
}
