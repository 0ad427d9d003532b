package com.example.measure.common;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of initializing a snapshot: the outcome plus the snapshot when usable.
 *
 * <p>A FAILED initialization carries no snapshot and took no reference on any
 * shared data. SUCCESS and PARTIAL carry a snapshot that must be closed.
 *
 * @param <S> the snapshot type
 * @param <R> the resource flag type
 */
public final class Initialization<S, R extends Enum<R>> {

    private final Outcome<R> outcome;
    private final S snapshot;

    private Initialization(Outcome<R> outcome, S snapshot) {
        this.outcome = outcome;
        this.snapshot = snapshot;
    }

    public static <S, R extends Enum<R>> Initialization<S, R> of(S snapshot, Outcome<R> outcome) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (outcome.isFailed()) {
            throw new IllegalArgumentException("A failed initialization cannot carry a snapshot");
        }
        return new Initialization<>(outcome, snapshot);
    }

    public static <S, R extends Enum<R>> Initialization<S, R> failed(String reason) {
        return new Initialization<S, R>(Outcome.<R>failed(reason), null);
    }

    public Outcome<R> outcome() {
        return outcome;
    }

    public Optional<S> snapshot() {
        return Optional.ofNullable(snapshot);
    }

    /**
     * Returns the snapshot, or throws if initialization was unrecoverable.
     *
     * @throws NoSuchElementException if the initialization failed
     */
    public S orElseThrow() {
        if (snapshot == null) {
            throw new NoSuchElementException("Initialization failed: " + outcome.reason());
        }
        return snapshot;
    }

    public boolean isFailed() {
        return outcome.isFailed();
    }

    @Override
    public String toString() {
        return "Initialization[" + outcome + "]";
    }
}
