package com.mimecast.wren.error;

/**
 * Exception thrown when a validator operation fails.
 * <p>Thrown by list loads, bloom filter activation, save and load.
 * <p>State of the validator is left as it was before the failing call.
 */
public class ValidatorException extends Exception {
    private final ErrorKind kind;

    /**
     * Constructs a new ValidatorException.
     *
     * @param kind    Error kind.
     * @param message Error message.
     */
    public ValidatorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new ValidatorException with cause.
     *
     * @param kind    Error kind.
     * @param message Error message.
     * @param cause   Underlying cause.
     */
    public ValidatorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets error kind.
     *
     * @return ErrorKind.
     */
    public ErrorKind getKind() {
        return kind;
    }
}
