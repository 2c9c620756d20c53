package com.ndclient.dto.request;

import lombok.Builder;

/**
 * Credential values passed explicitly by the caller, typically parsed from command-line
 * arguments or a configuration file. Any field may be {@code null}; those fields are then looked
 * up in the environment and in the vault.
 *
 * @param address      The controller address.
 * @param username     The controller username.
 * @param password     The controller password.
 * @param domain       The login domain.
 * @param nxosUsername The NX-OS switch username.
 * @param nxosPassword The NX-OS switch password.
 */
@Builder
public record CredentialArgs(String address, String username, String password, String domain,
                             String nxosUsername, String nxosPassword) {

    /**
     * @return Arguments with every field unset, so that resolution relies on the environment and the vault.
     */
    public static CredentialArgs none() {
        return CredentialArgs.builder().build();
    }
}
