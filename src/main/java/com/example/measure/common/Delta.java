package com.example.measure.common;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * The outcome of comparing two snapshots: either a value or an invalid-argument
 * result explaining why the comparison was refused.
 *
 * <p>Like {@link OptionalLong}, but an invalid delta keeps its reason.
 */
public final class Delta {

    private final boolean valid;
    private final long value;
    private final String reason;

    private Delta(boolean valid, long value, String reason) {
        this.valid = valid;
        this.value = value;
        this.reason = reason;
    }

    public static Delta of(long value) {
        return new Delta(true, value, null);
    }

    public static Delta invalid(String reason) {
        return new Delta(false, 0, Objects.requireNonNull(reason, "reason"));
    }

    public boolean isValid() {
        return valid;
    }

    public boolean isInvalid() {
        return !valid;
    }

    /**
     * @throws NoSuchElementException if this delta is invalid
     */
    public long getAsLong() {
        if (!valid) {
            throw new NoSuchElementException("Invalid delta: " + reason);
        }
        return value;
    }

    public long orElse(long other) {
        return valid ? value : other;
    }

    /**
     * The reason this delta is invalid, null for valid deltas.
     */
    public String reason() {
        return reason;
    }

    public OptionalLong toOptional() {
        return valid ? OptionalLong.of(value) : OptionalLong.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Delta other)) return false;
        return valid == other.valid && value == other.value && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, value, reason);
    }

    @Override
    public String toString() {
        return valid ? "Delta[" + value + "]" : "Delta[invalid: " + reason + "]";
    }
}
