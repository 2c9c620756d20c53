package com.ndclient.exception;

/**
 * Signals that the controller rejected the login call or answered it with something that
 * does not carry a usable session token.
 */
public class AuthenticationException extends NdClientException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
