package com.ndclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * One entry of a {@code switchIds} list. The controller identifies switches by serial number.
 *
 * @param switchId The switch serial number, e.g. {@code SAL1948TRTT}.
 */
public record SwitchId(@NotBlank @JsonProperty("switchId") String switchId) {

    public SwitchId {
        switchId = switchId != null ? switchId.trim() : null;
    }
}
