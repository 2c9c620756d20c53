package com.ndclient.exception;

/**
 * Signals that a request could not be delivered: every attempt allowed by the retry policy
 * failed transiently, or the failure was not recoverable at all. The cause is the error of the
 * last attempt.
 */
public class TransportException extends NdClientException {

    private final int attempts;

    public TransportException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    /**
     * @return The number of attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
