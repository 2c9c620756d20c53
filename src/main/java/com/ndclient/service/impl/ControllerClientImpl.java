package com.ndclient.service.impl;

import com.ndclient.dto.request.CredentialArgs;
import com.ndclient.model.Credentials;
import com.ndclient.model.NormalizedResult;
import com.ndclient.model.RawResponse;
import com.ndclient.model.RequestDescriptor;
import com.ndclient.model.Session;
import com.ndclient.service.api.ControllerClient;
import com.ndclient.service.api.CredentialResolver;
import com.ndclient.service.api.RequestSender;
import com.ndclient.service.api.ResponseNormalizer;
import com.ndclient.service.api.SessionAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ControllerClientImpl implements ControllerClient {

    private final CredentialResolver credentialResolver;
    private final SessionAuthenticator sessionAuthenticator;
    private final RequestSender requestSender;
    private final ResponseNormalizer responseNormalizer;

    public ControllerClientImpl(CredentialResolver credentialResolver, SessionAuthenticator sessionAuthenticator,
                                RequestSender requestSender, ResponseNormalizer responseNormalizer) {
        this.credentialResolver = credentialResolver;
        this.sessionAuthenticator = sessionAuthenticator;
        this.requestSender = requestSender;
        this.responseNormalizer = responseNormalizer;
    }

    @Override
    public Session login(CredentialArgs explicitArgs) {
        Credentials credentials = credentialResolver.resolve(explicitArgs);
        return sessionAuthenticator.authenticate(credentials);
    }

    @Override
    public NormalizedResult execute(Session session, RequestDescriptor request) {
        RawResponse rawResponse = requestSender.send(session, request);
        NormalizedResult result = responseNormalizer.normalize(rawResponse);
        if (result.success()) {
            log.info("{} {} succeeded ({}).", request.verb(), request.path(), result.statusCode());
        } else {
            log.warn("{} {} failed with status {}: {}", request.verb(), request.path(), result.statusCode(),
                    result.message());
        }
        return result;
    }
}
