package com.ndclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Body of the per-switch credential save call.
 *
 * @param switchIds      The switches the credentials apply to.
 * @param switchUsername The switch username, trimmed.
 * @param switchPassword The switch password, trimmed.
 */
public record UserSwitchCredentialsPayload(
        @NotEmpty @JsonProperty("switchIds") List<@NotNull @Valid SwitchId> switchIds,
        @NotBlank @JsonProperty("switchUsername") String switchUsername,
        @NotBlank @JsonProperty("switchPassword") String switchPassword) {

    public UserSwitchCredentialsPayload {
        switchIds = switchIds != null ? Collections.unmodifiableList(new ArrayList<>(switchIds)) : null;
        switchUsername = switchUsername != null ? switchUsername.trim() : null;
        switchPassword = switchPassword != null ? switchPassword.trim() : null;
    }

    @Override
    public String toString() {
        return "UserSwitchCredentialsPayload[switchIds=" + switchIds + ", switchUsername=" + switchUsername + "]";
    }
}
