package com.ndclient.exception;

/**
 * Base runtime exception for every failure raised by the controller client.
 * <p>
 * Components never downgrade an error to a default value; they throw one of the subtypes of
 * this class so that callers can decide how to report the failure (for example, log it and
 * exit with a non-zero status).
 */
public class NdClientException extends RuntimeException {

    /**
     * Constructs a new NdClientException with the specified detail message.
     *
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public NdClientException(String message) {
        super(message);
    }

    /**
     * Constructs a new NdClientException with the specified detail message and cause.
     *
     * @param message The detail message (which is saved for later retrieval by the
     *                {@link #getMessage()} method).
     * @param cause   The underlying library or I/O failure. A {@code null} value is permitted,
     *                and indicates that the cause is nonexistent or unknown.
     */
    public NdClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
