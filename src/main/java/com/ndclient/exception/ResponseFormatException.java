package com.ndclient.exception;

/**
 * Signals a successful-looking HTTP exchange whose payload cannot be parsed.
 */
public class ResponseFormatException extends NdClientException {

    public ResponseFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
