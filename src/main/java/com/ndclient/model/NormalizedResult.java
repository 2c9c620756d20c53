package com.ndclient.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The uniform outcome returned for every controller operation, regardless of endpoint.
 * A failed operation is reported through {@code success == false}, not by an exception.
 *
 * @param success       {@code true} for any 2xx status.
 * @param statusCode    The HTTP status code.
 * @param message       The controller's diagnostic message, or a description of the status code.
 * @param data          The returned payload; an empty object when there is none.
 * @param requestMethod The HTTP method of the request.
 * @param requestPath   The request path.
 */
public record NormalizedResult(boolean success, int statusCode, String message, JsonNode data,
                               String requestMethod, String requestPath) {
}
