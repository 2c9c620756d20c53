package com.ndclient.service.impl;

import com.ndclient.exception.TransportException;
import com.ndclient.model.RawResponse;
import com.ndclient.model.RequestDescriptor;
import com.ndclient.model.SendConfig;
import com.ndclient.model.Session;
import com.ndclient.service.api.RequestSender;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Sends authenticated requests to the controller through a shared {@link WebClient}.
 * <p>
 * Each attempt is bounded by {@link SendConfig#timeout()}. A connection failure, a timeout or a
 * 5xx status makes the attempt transient; resilience4j then waits {@link SendConfig#sendInterval()}
 * and resubscribes, up to {@link SendConfig#maxAttempts()} attempts in total. Attempts of the same
 * request never overlap. A 4xx status is returned to the caller without retrying.
 */
@Service
@Slf4j
public class RequestSenderImpl implements RequestSender {

    static final String RETRY_NAME_PREFIX = "nd-request-";
    static final String AUTH_COOKIE = "AuthCookie";

    private static final AtomicInteger SENDER_SEQUENCE = new AtomicInteger();

    private final WebClient webClient;
    private final SendConfig sendConfig;
    private final Retry retry;

    public RequestSenderImpl(WebClient webClient, SendConfig sendConfig, RetryRegistry retryRegistry) {
        this.webClient = webClient;
        this.sendConfig = sendConfig;

        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(sendConfig.maxAttempts())
                .waitDuration(sendConfig.sendInterval())
                .retryOnException(RequestSenderImpl::isTransient)
                .build();
        // One retry instance per sender, never shared through the registry.
        this.retry = retryRegistry.retry(RETRY_NAME_PREFIX + SENDER_SEQUENCE.incrementAndGet(), retryConfig);
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Attempt {} of {} failed ({}). Retrying in {} ms.",
                event.getNumberOfRetryAttempts(), sendConfig.maxAttempts(),
                describe(event.getLastThrowable()), event.getWaitInterval().toMillis()));
    }

    @Override
    public RawResponse send(Session session, RequestDescriptor request) {
        AtomicInteger attempts = new AtomicInteger();
        log.info("Sending {} {}", request.verb(), request.path());

        try {
            URI uri = URI.create(session.baseUrl() + request.path());
            RawResponse response = Mono.defer(() -> attempt(session, request, uri, attempts.incrementAndGet()))
                    .transform(RetryOperator.of(retry))
                    .block();
            if (response == null) {
                throw new TransportException("No response received for " + request.verb() + " " + request.path(),
                        attempts.get(), null);
            }
            log.info("{} {} completed with status {} after {} attempt(s).",
                    request.verb(), request.path(), response.statusCode(), attempts.get());
            return response;
        } catch (TransportException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String reason = isTransient(cause)
                    ? "retries exhausted after " + attempts.get() + " attempt(s)"
                    : "unrecoverable error on attempt " + attempts.get();
            log.error("{} {} failed: {}. Last error: {}", request.verb(), request.path(), reason, describe(cause));
            throw new TransportException(request.verb() + " " + request.path() + " failed, " + reason + ": "
                    + describe(cause), attempts.get(), cause);
        }
    }

    @Override
    public SendConfig config() {
        return sendConfig;
    }

    String retryName() {
        return retry.getName();
    }

    private Mono<RawResponse> attempt(Session session, RequestDescriptor request, URI uri, int attempt) {
        log.debug("  Attempt {} of {} for {} {}", attempt, sendConfig.maxAttempts(), request.verb(), uri);

        WebClient.RequestBodySpec requestSpec = webClient.method(request.verb())
                .uri(uri)
                .headers(headers -> {
                    headers.setBearerAuth(session.token());
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .cookie(AUTH_COOKIE, session.token());

        WebClient.RequestHeadersSpec<?> exchangeSpec = requestSpec;
        if (request.hasBody()) {
            exchangeSpec = requestSpec.contentType(MediaType.APPLICATION_JSON).bodyValue(request.body());
        }

        return exchangeSpec
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new RawResponse(response.statusCode().value(), body, request.verb(), request.path())))
                .timeout(sendConfig.timeout())
                .flatMap(response -> response.isServerError()
                        ? Mono.error(new ServerErrorResponseException(response))
                        : Mono.just(response));
    }

    /**
     * Connection errors, per-attempt timeouts and 5xx responses are worth another attempt;
     * anything else will fail the same way again.
     */
    static boolean isTransient(Throwable throwable) {
        return throwable instanceof ServerErrorResponseException
                || throwable instanceof WebClientRequestException
                || throwable instanceof TimeoutException
                || throwable instanceof IOException;
    }

    private static String describe(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }

    /**
     * Raised inside the reactive pipeline for a 5xx status so that the retry operator treats it
     * like any other transient failure.
     */
    static class ServerErrorResponseException extends RuntimeException {

        ServerErrorResponseException(RawResponse response) {
            super("controller returned status " + response.statusCode() + " for " + response.verb() + " "
                    + response.path());
        }
    }
}
