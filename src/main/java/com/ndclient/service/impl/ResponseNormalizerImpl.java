package com.ndclient.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import com.ndclient.exception.ResponseFormatException;
import com.ndclient.model.NormalizedResult;
import com.ndclient.model.RawResponse;
import com.ndclient.service.api.ResponseNormalizer;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

/**
 * Normalizes controller responses independently of the endpoint that produced them.
 * <p>
 * The diagnostic message is taken from the first of {@link #DIAGNOSTIC_PATHS} that yields a
 * non-blank string. Bodies that are already in normalized shape (either this client's own
 * {@code success/statusCode/message/data} form or the {@code RETURN_CODE/MESSAGE/DATA} form)
 * have their embedded payload unwrapped, so normalizing twice gives the same result.
 */
@Service
@Slf4j
public class ResponseNormalizerImpl implements ResponseNormalizer {

    static final List<String> DIAGNOSTIC_PATHS = List.of(
            "$.message",
            "$.MESSAGE",
            "$.messages[0].message",
            "$.error",
            "$.error.message",
            "$.errors[0]",
            "$.errors[0].message",
            "$.description");

    private static final Configuration JSON_PATH_CONFIGURATION = Configuration.defaultConfiguration()
            .addOptions(Option.SUPPRESS_EXCEPTIONS);

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public NormalizedResult normalize(RawResponse rawResponse) {
        boolean success = rawResponse.isSuccess();
        Optional<JsonNode> body = parseBody(rawResponse);

        String message = body.flatMap(node -> diagnosticMessage(rawResponse.body(), node))
                .orElseGet(() -> describeStatus(rawResponse.statusCode()));
        JsonNode data = body.map(this::unwrapPayload).orElseGet(objectMapper::createObjectNode);

        if (!success) {
            log.debug("Request {} {} failed with status {}: {}",
                    rawResponse.verb(), rawResponse.path(), rawResponse.statusCode(), message);
        }
        return new NormalizedResult(success, rawResponse.statusCode(), message, data,
                rawResponse.verb().name(), rawResponse.path());
    }

    /**
     * Parses the body as JSON. An empty body or a JSON {@code null} is valid and yields no payload. An unparseable body
     * is a format error for a 2xx response; for any other status the failure is already reported
     * by the status code, so the body is ignored.
     */
    private Optional<JsonNode> parseBody(RawResponse rawResponse) {
        if (rawResponse.body().isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(rawResponse.body());
            if (node == null || node.isNull() || node.isMissingNode()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException e) {
            if (rawResponse.isSuccess()) {
                log.error("Controller returned an unparseable body for {} {} (status {})",
                        rawResponse.verb(), rawResponse.path(), rawResponse.statusCode());
                throw new ResponseFormatException("Unable to parse response body of " + rawResponse.verb() + " "
                        + rawResponse.path() + " (status " + rawResponse.statusCode() + ")", e);
            }
            log.debug("Ignoring non-JSON body of failed request {} {}", rawResponse.verb(), rawResponse.path());
            return Optional.empty();
        }
    }

    private Optional<String> diagnosticMessage(String rawBody, JsonNode body) {
        if (!body.isContainerNode()) {
            return Optional.empty();
        }
        DocumentContext document = JsonPath.using(JSON_PATH_CONFIGURATION).parse(rawBody);
        for (String path : DIAGNOSTIC_PATHS) {
            Object value = document.read(path);
            if (value instanceof String text && !text.isBlank()) {
                return Optional.of(text);
            }
        }
        return Optional.empty();
    }

    private JsonNode unwrapPayload(JsonNode body) {
        if (body.isObject()) {
            if (body.has("success") && body.has("statusCode") && body.has("data")) {
                return body.get("data");
            }
            if (body.has("RETURN_CODE") && body.has("DATA")) {
                return body.get("DATA");
            }
        }
        return body;
    }

    private static String describeStatus(int statusCode) {
        HttpStatus status = HttpStatus.resolve(statusCode);
        return status != null ? status.getReasonPhrase() : "HTTP " + statusCode;
    }
}
