package com.mimecast.wren.error;

import java.util.Objects;

/**
 * Validation error.
 * <p>Structured error value attached to a validation result or resolution outcome.
 * <p>Carries the kind, the offending value and a human readable message.
 */
public final class ValidationError {
    private final ErrorKind kind;
    private final String value;
    private final String message;

    /**
     * Constructs a new ValidationError instance.
     *
     * @param kind    Error kind.
     * @param value   Offending value, may be empty.
     * @param message Message.
     */
    public ValidationError(ErrorKind kind, String value, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = value != null ? value : "";
        this.message = message != null ? message : kind.name();
    }

    /**
     * Gets kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets offending value.
     *
     * @return Value string.
     */
    public String getValue() {
        return value;
    }

    /**
     * Gets message.
     *
     * @return Message string.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationError)) return false;
        ValidationError that = (ValidationError) o;
        return kind == that.kind && value.equals(that.value) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message + (value.isEmpty() ? "" : " [" + value + "]");
    }
}
