package com.example.measure.common;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Reference-counted handle around data shared by several snapshots.
 *
 * <p>Every handle carries a stable numeric identity. Two snapshots are comparable
 * only when they hold handles with the same identity, regardless of whether the
 * wrapped values happen to be equal.
 *
 * <p>The handle starts with one reference. {@link #retain()} adds one,
 * {@link #release()} removes one; when the count reaches zero the release
 * action runs exactly once and the handle can no longer be retained.
 *
 * <p>Example usage:
 * <pre>{@code
 * SharedData<CommonSystemData> shared = SharedData.create(common, c -> log.debug("freed"));
 * SharedData<CommonSystemData> second = shared.retain();   // refCount == 2
 * shared.release();                                       // refCount == 1
 * second.release();                                       // release action runs
 * }</pre>
 *
 * @param <T> the type of the shared value
 */
public final class SharedData<T> {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final T value;
    private final AtomicInteger refCount = new AtomicInteger(1);
    private final AtomicBoolean freed = new AtomicBoolean(false);
    private final Consumer<? super SharedData<T>> releaseAction;

    private SharedData(T value, Consumer<? super SharedData<T>> releaseAction) {
        this.id = NEXT_ID.getAndIncrement();
        this.value = Objects.requireNonNull(value, "value");
        this.releaseAction = Objects.requireNonNull(releaseAction, "releaseAction");
    }

    /**
     * Wraps a value in a new handle holding a single reference.
     *
     * @param value         the shared value
     * @param releaseAction run once when the last reference is released
     * @param <T>           the type of the shared value
     * @return the new handle
     */
    public static <T> SharedData<T> create(T value, Consumer<? super SharedData<T>> releaseAction) {
        return new SharedData<>(value, releaseAction);
    }

    /**
     * Adds a reference.
     *
     * @return this handle
     * @throws IllegalStateException if the last reference was already released
     */
    public SharedData<T> retain() {
        while (true) {
            int current = refCount.get();
            if (current <= 0) {
                throw new IllegalStateException("Shared data #" + id + " was already released");
            }
            if (refCount.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    /**
     * Removes a reference, running the release action when it was the last one.
     *
     * @return true if this call released the last reference
     * @throws IllegalStateException if the last reference was already released
     */
    public boolean release() {
        int remaining = refCount.decrementAndGet();
        if (remaining < 0) {
            refCount.incrementAndGet();
            throw new IllegalStateException("Shared data #" + id + " was already released");
        }
        if (remaining == 0 && freed.compareAndSet(false, true)) {
            releaseAction.accept(this);
            return true;
        }
        return false;
    }

    /**
     * Checks whether two handles wrap the same shared instance.
     */
    public boolean sameIdentity(SharedData<?> other) {
        return other != null && other.id == id;
    }

    public long id() {
        return id;
    }

    public T value() {
        return value;
    }

    public int refCount() {
        return Math.max(refCount.get(), 0);
    }

    public boolean isFreed() {
        return freed.get();
    }

    @Override
    public String toString() {
        return "SharedData#" + id + "[refCount=" + refCount() + "]";
    }
}
