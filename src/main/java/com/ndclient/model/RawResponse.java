package com.ndclient.model;

import org.springframework.http.HttpMethod;

/**
 * The unprocessed outcome of one HTTP exchange with the controller.
 *
 * @param statusCode The HTTP status code.
 * @param body       The response body as text; empty when the controller sent none.
 * @param verb       The HTTP method of the request.
 * @param path       The request path.
 */
public record RawResponse(int statusCode, String body, HttpMethod verb, String path) {

    public RawResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
}
