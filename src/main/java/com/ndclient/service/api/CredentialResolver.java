package com.ndclient.service.api;

import com.ndclient.dto.request.CredentialArgs;
import com.ndclient.model.Credentials;

/**
 * Determines the effective controller credentials from a prioritized set of sources.
 */
public interface CredentialResolver {

    /**
     * Resolves every credential field by checking, in order, the explicit arguments, the
     * environment variables and the encrypted vault. The first non-blank value wins.
     *
     * @param explicitArgs Values supplied directly by the caller; any field may be {@code null}.
     * @return Complete {@link Credentials}.
     * @throws com.ndclient.exception.CredentialException if the address, username or password is
     *                                                    blank in every source, or if the vault
     *                                                    cannot be read or decrypted.
     */
    Credentials resolve(CredentialArgs explicitArgs);
}
