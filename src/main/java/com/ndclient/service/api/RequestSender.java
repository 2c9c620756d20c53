package com.ndclient.service.api;

import com.ndclient.model.RawResponse;
import com.ndclient.model.RequestDescriptor;
import com.ndclient.model.SendConfig;
import com.ndclient.model.Session;

public interface RequestSender {

    /**
     * Sends one request on behalf of an authenticated session, retrying transient failures.
     * <p>
     * Connection errors, per-attempt timeouts and 5xx responses are retried after
     * {@link SendConfig#sendInterval()} until {@link SendConfig#maxAttempts()} attempts have been
     * made. Any other response, 4xx included, is returned as-is. The calling thread is blocked for
     * the whole exchange, waits included.
     *
     * @param session The session whose token is attached to the request.
     * @param request The verb, path and body to send.
     * @return The raw response of the first non-transient attempt.
     * @throws com.ndclient.exception.TransportException if every attempt failed transiently, or an
     *                                                   attempt failed in a way that cannot be
     *                                                   recovered by retrying.
     */
    RawResponse send(Session session, RequestDescriptor request);

    /**
     * @return The timeout and retry settings this sender applies.
     */
    SendConfig config();
}
