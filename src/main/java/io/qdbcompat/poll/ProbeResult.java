package io.qdbcompat.poll;

import java.util.Objects;

/**
 * Outcome of a single probe attempt.
 *
 * @param <T> type of the value produced on success
 */
public final class ProbeResult<T> {

    /**
     * Kind of outcome.
     */
    public enum Kind {
        NOT_YET,
        SUCCESS,
        PERMANENT_FAILURE
    }

    private final Kind kind;
    private final T value;
    private final RuntimeException error;

    private ProbeResult(Kind kind, T value, RuntimeException error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static <T> ProbeResult<T> notYet() {
        return new ProbeResult<>(Kind.NOT_YET, null, null);
    }

    /**
     * A "not yet" outcome remembering what went wrong, reported as the cause if polling times out.
     */
    public static <T> ProbeResult<T> notYet(RuntimeException transientError) {
        return new ProbeResult<>(Kind.NOT_YET, null, Objects.requireNonNull(transientError, "transientError"));
    }

    public static <T> ProbeResult<T> success(T value) {
        return new ProbeResult<>(Kind.SUCCESS, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> ProbeResult<T> permanentFailure(RuntimeException error) {
        return new ProbeResult<>(Kind.PERMANENT_FAILURE, null, Objects.requireNonNull(error, "error"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    public T getValue() {
        if (kind != Kind.SUCCESS) {
            throw new IllegalStateException("No value for outcome " + kind);
        }
        return value;
    }

    /**
     * Gets the error attached to this outcome, or {@code null} if there is none.
     */
    public RuntimeException getError() {
        return error;
    }

    @Override
    public String toString() {
        return error == null ? kind.name() : kind + "(" + error.getMessage() + ")";
    }
}
