package com.ndclient.model;

import java.net.URI;
import java.util.Objects;
import java.util.Set;
import org.springframework.http.HttpMethod;

/**
 * An immutable verb/path/body triple describing one controller operation.
 * <p>
 * The body is trusted to be valid already: descriptors built by
 * {@link com.ndclient.endpoint.ManageEndpoints} have been validated, and callers that build
 * their own are responsible for their payload.
 *
 * @param verb The HTTP method. One of GET, POST, PUT, DELETE or PATCH.
 * @param path The request path, starting with {@code /} and already URL-encoded.
 * @param body The structured request body, or {@code null} when the operation has none.
 */
public record RequestDescriptor(HttpMethod verb, String path, Object body) {

    private static final Set<HttpMethod> SUPPORTED_VERBS = Set.of(
            HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE, HttpMethod.PATCH);

    public RequestDescriptor {
        Objects.requireNonNull(verb, "verb");
        if (!SUPPORTED_VERBS.contains(verb)) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + verb);
        }
        if (path == null || !path.startsWith("/")) {
            throw new IllegalArgumentException("Request path must start with '/': " + path);
        }
        try {
            URI.create(path);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Request path is not URL-encoded: " + path, e);
        }
    }

    public static RequestDescriptor of(HttpMethod verb, String path) {
        return new RequestDescriptor(verb, path, null);
    }

    public static RequestDescriptor of(HttpMethod verb, String path, Object body) {
        return new RequestDescriptor(verb, path, body);
    }

    public boolean hasBody() {
        return body != null;
    }
}
