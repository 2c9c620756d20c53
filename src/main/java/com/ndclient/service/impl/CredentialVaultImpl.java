package com.ndclient.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ndclient.config.NdClientProperties;
import com.ndclient.exception.CredentialException;
import com.ndclient.service.api.CredentialVault;
import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.jasypt.encryption.StringEncryptor;
import org.springframework.stereotype.Service;

/**
 * A file-based implementation of the {@link CredentialVault} that keeps encrypted credential
 * values in a JSON file.
 * <p>
 * The file has the shape {@code {"credentials": {"nd_password": "<ciphertext>", ...}}}. Values
 * are encrypted with a {@link StringEncryptor} and stay encrypted in memory; they are decrypted
 * only when read. The file is loaded lazily on first access, so a run that never needs the vault
 * never touches it. A missing file is an empty vault; an unreadable file or an entry that cannot
 * be decrypted is reported as a {@link CredentialException}.
 */
@Service
@Slf4j
public class CredentialVaultImpl implements CredentialVault {

    private static final String CREDENTIALS_KEY = "credentials";

    private final File vaultFile;
    private final StringEncryptor encryptor;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private Map<String, String> entries;

    /**
     * Constructs the vault with a Jasypt {@link StringEncryptor}.
     * The encryptor bean is configured by the Jasypt Spring Boot starter, which reads the
     * passphrase from {@code jasypt.encryptor.password} (e.g. the {@code JASYPT_ENCRYPTOR_PASSWORD}
     * environment variable).
     *
     * @param encryptor  The {@link StringEncryptor} used to encrypt and decrypt entries.
     * @param properties The bound settings holding the vault file location.
     */
    public CredentialVaultImpl(StringEncryptor encryptor, NdClientProperties properties) {
        this.encryptor = encryptor;
        this.vaultFile = new File(properties.getVault().getPath());
    }

    /**
     * {@inheritDoc}
     * <p>
     * This implementation decrypts the entry on-the-fly. A decryption failure usually means the
     * passphrase is wrong or missing.
     */
    @Override
    public Optional<String> get(String key) {
        String encryptedValue = entries().get(key);
        if (encryptedValue == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(encryptor.decrypt(encryptedValue));
        } catch (RuntimeException e) {
            log.error("Could not decrypt vault entry '{}' from {}. The vault passphrase may be missing or incorrect.",
                    key, vaultFile.getAbsolutePath());
            throw new CredentialException("Unable to decrypt vault entry '" + key + "' in "
                    + vaultFile.getAbsolutePath() + ". Check the vault passphrase.", e);
        }
    }

    /**
     * {@inheritDoc}
     * <p>
     * This implementation encrypts the value, stores it in memory and immediately writes the
     * whole vault back to disk.
     */
    @Override
    public void put(String key, String value) {
        log.info("Encrypting and saving vault entry '{}'", key);
        String encryptedValue;
        try {
            encryptedValue = encryptor.encrypt(value);
        } catch (RuntimeException e) {
            throw new CredentialException("Unable to encrypt vault entry '" + key + "'. Check the vault passphrase.", e);
        }
        entries().put(key, encryptedValue);
        saveVault();
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(entries().keySet());
    }

    private synchronized Map<String, String> entries() {
        if (entries == null) {
            entries = loadVault();
        }
        return entries;
    }

    /**
     * Writes the encrypted entries to the vault file, creating its parent directory when needed.
     *
     * @throws CredentialException if the directory cannot be created or the file cannot be written.
     */
    private synchronized void saveVault() {
        try {
            File parentDir = vaultFile.getAbsoluteFile().getParentFile();
            if (!parentDir.exists() && !parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories at: " + parentDir.getAbsolutePath());
            }

            Map<String, Object> vault = new HashMap<>();
            vault.put(CREDENTIALS_KEY, entries);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(vaultFile, vault);
        } catch (IOException e) {
            log.error("Failed to save credential vault to {}", vaultFile.getAbsolutePath(), e);
            throw new CredentialException("Failed to save credential vault to " + vaultFile.getAbsolutePath(), e);
        }
    }

    /**
     * Reads the vault file. Unlike application state, a corrupted vault is never replaced with an
     * empty one: the caller must fix or remove the file.
     */
    private Map<String, String> loadVault() {
        if (!vaultFile.exists() || vaultFile.length() == 0) {
            log.debug("No credential vault found at {}, treating it as empty.", vaultFile.getAbsolutePath());
            return new ConcurrentHashMap<>();
        }
        try {
            TypeReference<HashMap<String, Object>> typeRef = new TypeReference<>() {};
            Map<String, Object> vault = objectMapper.readValue(vaultFile, typeRef);

            Map<String, String> loaded = new ConcurrentHashMap<>();
            if (vault.get(CREDENTIALS_KEY) != null) {
                TypeReference<HashMap<String, String>> credTypeRef = new TypeReference<>() {};
                Map<String, String> stored = objectMapper.convertValue(vault.get(CREDENTIALS_KEY), credTypeRef);
                stored.forEach((key, value) -> {
                    if (value != null) {
                        loaded.put(key, value);
                    }
                });
            }
            log.info("Loaded {} credential vault entries from {}", loaded.size(), vaultFile.getAbsolutePath());
            return loaded;
        } catch (IOException | IllegalArgumentException e) {
            log.error("Could not parse credential vault at {}", vaultFile.getAbsolutePath(), e);
            throw new CredentialException("Credential vault at " + vaultFile.getAbsolutePath() + " is not readable: "
                    + e.getMessage(), e);
        }
    }
}
