package com.ndclient.dto.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of the default and robot switch credential save calls.
 *
 * @param switchUsername The switch username, trimmed.
 * @param switchPassword The switch password, trimmed.
 * @param isRobot        {@code true} for robot credentials; omitted from the body otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SwitchCredentialsPayload(
        @NotBlank @JsonProperty("switchUsername") String switchUsername,
        @NotBlank @JsonProperty("switchPassword") String switchPassword,
        @JsonProperty("isRobot") Boolean isRobot) {

    public SwitchCredentialsPayload {
        switchUsername = switchUsername != null ? switchUsername.trim() : null;
        switchPassword = switchPassword != null ? switchPassword.trim() : null;
    }

    public static SwitchCredentialsPayload defaultCredentials(String switchUsername, String switchPassword) {
        return new SwitchCredentialsPayload(switchUsername, switchPassword, null);
    }

    public static SwitchCredentialsPayload robotCredentials(String switchUsername, String switchPassword) {
        return new SwitchCredentialsPayload(switchUsername, switchPassword, Boolean.TRUE);
    }

    @Override
    public String toString() {
        return "SwitchCredentialsPayload[switchUsername=" + switchUsername + ", isRobot=" + isRobot + "]";
    }
}
