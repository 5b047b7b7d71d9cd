package io.cloudsoft.gax4j.client;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Immutable Value Object describing the outcome of one RPC attempt.
 * 
 * Retry policies only look at {@link #isPermanentFailure()}.
 */
public final class Status {
    public static final Status OK = new Status(StatusCode.OK, "");

    private final StatusCode code;
    private final String message;

    public Status(StatusCode code, String message) {
        this.code = requireNonNull(code, "code");
        this.message = requireNonNull(message, "message");
    }

    public static Status of(StatusCode code, String message) {
        return new Status(code, message);
    }

    public StatusCode code() {
        return code;
    }

    public String message() {
        return message;
    }

    public boolean isOk() {
        return code == StatusCode.OK;
    }

    /**
     * @return {@code true} if retrying the request cannot succeed; never true for {@link StatusCode#OK}
     */
    public boolean isPermanentFailure() {
        return !isOk() && !code.isTransient();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Status)) return false;
        Status other = (Status) o;
        return code == other.code && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message);
    }

    @Override
    public String toString() {
        return message.isEmpty() ? code.name() : code + ": " + message;
    }
}
