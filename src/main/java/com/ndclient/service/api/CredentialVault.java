package com.ndclient.service.api;

import java.util.Optional;
import java.util.Set;

/**
 * An encrypted store of credential values, used as the lowest-priority credential source.
 * Entries are encrypted at rest; the passphrase is supplied out-of-band.
 */
public interface CredentialVault {

    /**
     * Retrieves and decrypts a single entry.
     *
     * @param key The entry name (e.g. {@code nd_password}).
     * @return The decrypted value, or an empty {@link Optional} if the vault has no such entry.
     * @throws com.ndclient.exception.CredentialException if the vault file cannot be parsed or
     *                                                    the entry cannot be decrypted.
     */
    Optional<String> get(String key);

    /**
     * Encrypts a value and persists it under the given key, replacing any previous entry.
     *
     * @param key   The entry name.
     * @param value The plain-text value.
     * @throws com.ndclient.exception.CredentialException if the vault file cannot be written.
     */
    void put(String key, String value);

    /**
     * @return The names of all entries currently stored.
     */
    Set<String> keys();
}
