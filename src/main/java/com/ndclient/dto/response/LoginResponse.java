package com.ndclient.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.ToString;

/**
 * The subset of the login response this client uses. Controller releases differ in which
 * token field they populate, so both are read.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class LoginResponse {

    @ToString.Exclude
    private String token;

    @ToString.Exclude
    private String jwttoken;

    /**
     * @return The session token, preferring {@code token} over {@code jwttoken}, or {@code null} if neither is set.
     */
    public String sessionToken() {
        if (token != null && !token.isBlank()) {
            return token;
        }
        if (jwttoken != null && !jwttoken.isBlank()) {
            return jwttoken;
        }
        return null;
    }
}
