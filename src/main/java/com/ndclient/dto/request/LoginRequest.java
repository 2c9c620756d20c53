package com.ndclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of the controller login call.
 *
 * @param userName   The controller username.
 * @param userPasswd The controller password.
 * @param domain     The login domain.
 */
public record LoginRequest(
        @JsonProperty("userName") String userName,
        @JsonProperty("userPasswd") String userPasswd,
        @JsonProperty("domain") String domain) {

    @Override
    public String toString() {
        return "LoginRequest[userName=" + userName + ", domain=" + domain + "]";
    }
}
