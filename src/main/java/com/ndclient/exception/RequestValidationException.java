package com.ndclient.exception;

/**
 * Signals that a request body built by the endpoint catalog failed validation. No request is
 * sent when this is thrown.
 */
public class RequestValidationException extends NdClientException {

    public RequestValidationException(String message) {
        super(message);
    }
}
