package com.ndclient.exception;

/**
 * Signals that effective controller credentials could not be resolved, either because a
 * required field is empty in every source or because the encrypted vault could not be read.
 */
public class CredentialException extends NdClientException {

    public CredentialException(String message) {
        super(message);
    }

    public CredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
