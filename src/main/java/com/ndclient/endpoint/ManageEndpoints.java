package com.ndclient.endpoint;

import com.ndclient.dto.request.SwitchCredentialsPayload;
import com.ndclient.dto.request.SwitchId;
import com.ndclient.dto.request.SwitchIdsPayload;
import com.ndclient.dto.request.UserSwitchCredentialsPayload;
import com.ndclient.exception.RequestValidationException;
import com.ndclient.model.RequestDescriptor;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

/**
 * Factory for the descriptors of the controller's {@code /api/v1/manage} operations.
 * <p>
 * Every factory method returns a ready-to-send {@link RequestDescriptor}. Bodies and query
 * parameters are validated before the descriptor is built; invalid input is rejected with a
 * {@link RequestValidationException} and no descriptor is produced.
 */
@Component
@Slf4j
public class ManageEndpoints {

    public static final String MANAGE = "/api/v1/manage";
    public static final String CREDENTIALS = MANAGE + "/credentials";
    public static final String FABRICS = MANAGE + "/fabrics";
    public static final String SWITCHES = MANAGE + "/switches";

    static final int MAX_FABRIC_NAME_LENGTH = 64;
    static final String FABRIC_CATEGORY = "fabric";

    private final Validator validator;

    public ManageEndpoints(Validator validator) {
        this.validator = validator;
    }

    // Credentials

    public RequestDescriptor credentialsDetailsGet() {
        return RequestDescriptor.of(HttpMethod.GET, CREDENTIALS + "/details");
    }

    public RequestDescriptor defaultSwitchCredentialsGet() {
        return RequestDescriptor.of(HttpMethod.GET, CREDENTIALS + "/defaultSwitchCredentials");
    }

    public RequestDescriptor defaultSwitchCredentialsSave(String switchUsername, String switchPassword) {
        SwitchCredentialsPayload payload = validated(
                SwitchCredentialsPayload.defaultCredentials(switchUsername, switchPassword));
        return RequestDescriptor.of(HttpMethod.POST, CREDENTIALS + "/defaultSwitchCredentials", payload);
    }

    public RequestDescriptor defaultSwitchCredentialsDelete() {
        return RequestDescriptor.of(HttpMethod.DELETE, CREDENTIALS + "/defaultSwitchCredentials");
    }

    public RequestDescriptor robotSwitchCredentialsGet() {
        return RequestDescriptor.of(HttpMethod.GET, CREDENTIALS + "/robotSwitchCredentials");
    }

    public RequestDescriptor robotSwitchCredentialsSave(String switchUsername, String switchPassword) {
        SwitchCredentialsPayload payload = validated(
                SwitchCredentialsPayload.robotCredentials(switchUsername, switchPassword));
        return RequestDescriptor.of(HttpMethod.POST, CREDENTIALS + "/robotSwitchCredentials", payload);
    }

    public RequestDescriptor robotSwitchCredentialsDelete() {
        return RequestDescriptor.of(HttpMethod.DELETE, CREDENTIALS + "/robotSwitchCredentials");
    }

    public RequestDescriptor userSwitchCredentialsGet() {
        return RequestDescriptor.of(HttpMethod.GET, CREDENTIALS + "/switches");
    }

    /**
     * @param switchIds      Serial numbers of the switches the credentials apply to.
     * @param switchUsername The switch username.
     * @param switchPassword The switch password.
     */
    public RequestDescriptor userSwitchCredentialsSave(List<String> switchIds, String switchUsername,
                                                       String switchPassword) {
        UserSwitchCredentialsPayload payload = validated(
                new UserSwitchCredentialsPayload(toSwitchIds(switchIds), switchUsername, switchPassword));
        return RequestDescriptor.of(HttpMethod.POST, CREDENTIALS + "/switches", payload);
    }

    /**
     * Removes per-switch credentials. The controller exposes this as a {@code POST} action rather
     * than a {@code DELETE}.
     *
     * @param switchIds Serial numbers of the switches whose credentials are removed.
     */
    public RequestDescriptor userSwitchCredentialsRemove(List<String> switchIds) {
        SwitchIdsPayload payload = validated(new SwitchIdsPayload(toSwitchIds(switchIds)));
        return RequestDescriptor.of(HttpMethod.POST, CREDENTIALS + "/switches/actions/remove", payload);
    }

    // Fabrics

    public RequestDescriptor fabricsGet(QueryFilter queryFilter) {
        String query = validated(orNone(queryFilter)).toQueryString();
        return RequestDescriptor.of(HttpMethod.GET, query.isEmpty() ? FABRICS : FABRICS + "?" + query);
    }

    /**
     * Lists fabric details. The {@code category=fabric} parameter always comes first, followed by
     * the optional filter parameters.
     */
    public RequestDescriptor fabricDetailGet(QueryFilter queryFilter) {
        String query = validated(orNone(queryFilter)).toQueryString();
        String path = FABRICS + "?category=" + FABRIC_CATEGORY + (query.isEmpty() ? "" : "&" + query);
        return RequestDescriptor.of(HttpMethod.GET, path);
    }

    // Switches

    public RequestDescriptor switchesInventoryGet(String fabricName) {
        String name = fabricName != null ? fabricName.trim() : "";
        if (name.isEmpty() || name.length() > MAX_FABRIC_NAME_LENGTH) {
            log.error("Rejected fabric name '{}'", fabricName);
            throw new RequestValidationException("fabricName must be between 1 and " + MAX_FABRIC_NAME_LENGTH
                    + " characters long");
        }
        return RequestDescriptor.of(HttpMethod.GET, SWITCHES + "?fabricName=" + QueryFilter.encode(name));
    }

    private <T> T validated(T payload) {
        Set<ConstraintViolation<T>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            // Record component constraints can be reported for both field and accessor.
            Set<String> messages = violations.stream()
                    .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                    .collect(Collectors.toCollection(TreeSet::new));
            String description = String.join(", ", messages);
            log.error("Invalid {}: {}", payload.getClass().getSimpleName(), description);
            throw new RequestValidationException("Invalid " + payload.getClass().getSimpleName() + ": " + description);
        }
        return payload;
    }

    private static List<SwitchId> toSwitchIds(List<String> switchIds) {
        if (switchIds == null) {
            return List.of();
        }
        return switchIds.stream().map(SwitchId::new).collect(Collectors.toList());
    }

    private static QueryFilter orNone(QueryFilter queryFilter) {
        return queryFilter != null ? queryFilter : QueryFilter.none();
    }
}
