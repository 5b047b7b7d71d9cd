package io.cloudsoft.gax4j.client;

import static java.util.Objects.requireNonNull;

/**
 * Thrown by a retrying client when an operation fails for good, carrying the status of the last attempt.
 */
public class StatusException extends RuntimeException {
    private static final long serialVersionUID = 5183940282546373620L;

    private final Status status;

    public StatusException(Status status) {
        this(status, null);
    }

    public StatusException(Status status, Throwable cause) {
        super(requireNonNull(status, "status").toString(), cause);
        this.status = status;
    }

    public Status getStatus() {
        return status;
    }
}
