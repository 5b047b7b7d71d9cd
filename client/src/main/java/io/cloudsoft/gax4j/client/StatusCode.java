package io.cloudsoft.gax4j.client;

/**
 * Canonical outcome codes of an RPC attempt.
 */
public enum StatusCode {
    OK(0),
    CANCELLED(1),
    UNKNOWN(2),
    INVALID_ARGUMENT(3),
    DEADLINE_EXCEEDED(4),
    NOT_FOUND(5),
    ALREADY_EXISTS(6),
    PERMISSION_DENIED(7),
    RESOURCE_EXHAUSTED(8),
    FAILED_PRECONDITION(9),
    ABORTED(10),
    OUT_OF_RANGE(11),
    UNIMPLEMENTED(12),
    INTERNAL(13),
    UNAVAILABLE(14),
    DATA_LOSS(15),
    UNAUTHENTICATED(16);

    final int value;
    StatusCode(int value) {
        this.value = value;
    }

    public int value() { return value; }

    /**
     * @return {@code true} for codes where a later attempt of the same request may succeed
     */
    public boolean isTransient() {
        switch (this) {
            case UNAVAILABLE:
            case DEADLINE_EXCEEDED:
            case RESOURCE_EXHAUSTED:
            case ABORTED:
                return true;
            default:
                return false;
        }
    }

    public static StatusCode forValue(int value) {
        for (StatusCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        throw new IllegalArgumentException("No status code with value " + value);
    }
}
