package com.ndclient.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndclient.config.NdClientProperties;
import com.ndclient.dto.request.LoginRequest;
import com.ndclient.dto.response.LoginResponse;
import com.ndclient.exception.AuthenticationException;
import com.ndclient.model.Credentials;
import com.ndclient.model.RawResponse;
import com.ndclient.model.Session;
import com.ndclient.service.api.ResponseNormalizer;
import com.ndclient.service.api.SessionAuthenticator;
import java.net.URI;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Exceptions;

/**
 * Logs in to the controller with a single {@code POST} to the login endpoint and turns the
 * returned token into a {@link Session}. The login call is never retried: a rejected login is
 * reported immediately.
 */
@Service
@Slf4j
public class SessionAuthenticatorImpl implements SessionAuthenticator {

    private final WebClient webClient;
    private final NdClientProperties properties;
    private final ResponseNormalizer responseNormalizer;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SessionAuthenticatorImpl(WebClient webClient, NdClientProperties properties,
                                    ResponseNormalizer responseNormalizer) {
        this.webClient = webClient;
        this.properties = properties;
        this.responseNormalizer = responseNormalizer;
    }

    @Override
    public Session authenticate(Credentials credentials) {
        String baseUrl = properties.baseUrl(credentials.address());
        String loginPath = properties.getLoginPath();
        LoginRequest loginRequest = new LoginRequest(credentials.username(), credentials.password(),
                credentials.domainOrDefault());

        log.info("Logging in to controller {} as '{}' (domain '{}')",
                credentials.address(), credentials.username(), loginRequest.domain());
        RawResponse response = login(baseUrl, loginPath, loginRequest);

        if (!response.isSuccess()) {
            String diagnostic = responseNormalizer.normalize(response).message();
            log.error("Login to {} rejected with status {}: {}", credentials.address(), response.statusCode(), diagnostic);
            throw new AuthenticationException("Login to controller " + credentials.address() + " failed with status "
                    + response.statusCode() + ": " + diagnostic);
        }

        String token = extractToken(response, credentials.address());
        log.info("Login to controller {} successful.", credentials.address());
        return new Session(token, credentials.address(), baseUrl, loginRequest.domain(), Instant.now());
    }

    private RawResponse login(String baseUrl, String loginPath, LoginRequest loginRequest) {
        try {
            RawResponse response = webClient.post()
                    .uri(URI.create(baseUrl + loginPath))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(loginRequest)
                    .exchangeToMono(clientResponse -> clientResponse.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new RawResponse(clientResponse.statusCode().value(), body,
                                    HttpMethod.POST, loginPath)))
                    .timeout(properties.getSend().getTimeout())
                    .block();
            if (response == null) {
                throw new AuthenticationException("Controller at " + baseUrl + " returned no login response.");
            }
            return response;
        } catch (AuthenticationException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            log.error("Unable to reach controller at {} for login", baseUrl, cause);
            throw new AuthenticationException("Unable to reach controller at " + baseUrl + " for login: "
                    + cause.getMessage(), cause);
        }
    }

    private String extractToken(RawResponse response, String address) {
        LoginResponse loginResponse;
        try {
            loginResponse = objectMapper.readValue(response.body(), LoginResponse.class);
        } catch (JsonProcessingException e) {
            log.error("Controller {} returned a malformed login response", address);
            throw new AuthenticationException("Controller " + address + " returned a malformed login response.", e);
        }

        String token = loginResponse != null ? loginResponse.sessionToken() : null;
        if (token == null) {
            log.error("Login response from controller {} contains no session token", address);
            throw new AuthenticationException("Login response from controller " + address
                    + " does not contain a session token.");
        }
        return token;
    }
}
