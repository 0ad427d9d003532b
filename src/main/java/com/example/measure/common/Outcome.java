package com.example.measure.common;

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Result of reading a set of resource groups.
 *
 * <p>There are three tiers:
 * <ul>
 *   <li>{@link Status#SUCCESS} - every requested group was read</li>
 *   <li>{@link Status#PARTIAL} - some groups failed; {@link #failed()} names them
 *       and their values are cleared, the rest of the snapshot is usable</li>
 *   <li>{@link Status#FAILED} - unrecoverable; nothing was changed and
 *       {@link #reason()} describes why</li>
 * </ul>
 *
 * @param status the outcome tier
 * @param failed the resource groups that could not be read (empty unless PARTIAL)
 * @param reason description of an unrecoverable failure, null otherwise
 * @param <R>    the resource flag type
 */
public record Outcome<R extends Enum<R>>(
        Status status,
        Set<R> failed,
        String reason
) {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILED
    }

    public Outcome {
        Objects.requireNonNull(status, "status");
        failed = failed != null ? Set.copyOf(failed) : Set.of();
    }

    public static <R extends Enum<R>> Outcome<R> success() {
        return new Outcome<R>(Status.SUCCESS, Set.of(), null);
    }

    /**
     * Creates an outcome from the groups that failed, SUCCESS when there are none.
     */
    public static <R extends Enum<R>> Outcome<R> ofFailures(Collection<R> failed) {
        if (failed.isEmpty()) {
            return success();
        }
        return new Outcome<>(Status.PARTIAL, Set.copyOf(failed), null);
    }

    public static <R extends Enum<R>> Outcome<R> failed(String reason) {
        return new Outcome<R>(Status.FAILED, Set.of(), reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean isPartial() {
        return status == Status.PARTIAL;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    /**
     * Returns true unless the outcome is unrecoverable.
     */
    public boolean isUsable() {
        return status != Status.FAILED;
    }

    /**
     * Merges the failed groups of two outcomes. A FAILED outcome wins.
     */
    public Outcome<R> and(Outcome<R> other) {
        if (isFailed()) {
            return this;
        }
        if (other.isFailed()) {
            return other;
        }
        if (failed.isEmpty() && other.failed.isEmpty()) {
            return this;
        }
        Set<R> merged = new HashSet<>(failed);
        merged.addAll(other.failed);
        return ofFailures(merged);
    }

    /**
     * Returns the failed groups as a mutable {@link EnumSet}.
     */
    public EnumSet<R> failedSet(Class<R> type) {
        return failed.isEmpty() ? EnumSet.noneOf(type) : EnumSet.copyOf(failed);
    }
}
