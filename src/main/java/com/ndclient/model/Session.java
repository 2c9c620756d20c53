package com.ndclient.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Server-issued proof of authentication, attached to every request sent after login.
 * <p>
 * A session is created only by the session authenticator and is read-only afterwards, so one
 * instance can be shared by concurrent callers within the same process. The controller does not
 * report an expiry; a new session is obtained by logging in again.
 *
 * @param token     The session token returned by the login call.
 * @param address   The controller address the session was issued by.
 * @param baseUrl   The scheme and address every request path is appended to.
 * @param domain    The login domain.
 * @param createdAt When the login call completed.
 */
public record Session(String token, String address, String baseUrl, String domain, Instant createdAt) {

    public Session {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Session token must not be blank");
        }
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    @Override
    public String toString() {
        return "Session[address=" + address + ", domain=" + domain + ", createdAt=" + createdAt + ", token=****]";
    }
}
