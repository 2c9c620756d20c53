package com.ndclient.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Body of the per-switch credential removal call.
 *
 * @param switchIds The switches whose credentials are removed.
 */
public record SwitchIdsPayload(@NotEmpty @JsonProperty("switchIds") List<@NotNull @Valid SwitchId> switchIds) {

    public SwitchIdsPayload {
        switchIds = switchIds != null ? Collections.unmodifiableList(new ArrayList<>(switchIds)) : null;
    }
}
