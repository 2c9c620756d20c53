package com.ndclient.service.api;

import com.ndclient.model.Credentials;
import com.ndclient.model.Session;

public interface SessionAuthenticator {

    /**
     * Exchanges resolved credentials for a session token with a single login call.
     *
     * @param credentials The resolved controller credentials.
     * @return A {@link Session} holding the token issued by the controller.
     * @throws com.ndclient.exception.AuthenticationException if the controller rejects the login,
     *                                                        cannot be reached, or answers without
     *                                                        a usable token.
     */
    Session authenticate(Credentials credentials);
}
