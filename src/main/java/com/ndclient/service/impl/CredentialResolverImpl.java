package com.ndclient.service.impl;

import com.ndclient.dto.request.CredentialArgs;
import com.ndclient.exception.CredentialException;
import com.ndclient.model.Credentials;
import com.ndclient.service.api.CredentialResolver;
import com.ndclient.service.api.CredentialVault;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves controller credentials field by field. For each field the explicit argument wins over
 * the environment variable, which wins over the vault entry. The vault is only opened for fields
 * that are still blank after the first two sources.
 * <p>
 * Environment variables are read as-is from the process environment. They do not go through
 * Spring property resolution, so values containing {@code ${...}} or shaped like {@code ENC(...)}
 * are used literally.
 */
@Service
@Slf4j
public class CredentialResolverImpl implements CredentialResolver {

    /**
     * Every resolvable field with its environment variable and vault entry name.
     */
    enum CredentialField {
        ADDRESS("ND_IP4", "nd_ip4", CredentialArgs::address),
        USERNAME("ND_USERNAME", "nd_username", CredentialArgs::username),
        PASSWORD("ND_PASSWORD", "nd_password", CredentialArgs::password),
        DOMAIN("ND_DOMAIN", "nd_domain", CredentialArgs::domain),
        NXOS_USERNAME("NXOS_USERNAME", "nxos_username", CredentialArgs::nxosUsername),
        NXOS_PASSWORD("NXOS_PASSWORD", "nxos_password", CredentialArgs::nxosPassword);

        private final String environmentVariable;
        private final String vaultKey;
        private final Function<CredentialArgs, String> explicitValue;

        CredentialField(String environmentVariable, String vaultKey, Function<CredentialArgs, String> explicitValue) {
            this.environmentVariable = environmentVariable;
            this.vaultKey = vaultKey;
            this.explicitValue = explicitValue;
        }

        String environmentVariable() {
            return environmentVariable;
        }

        String vaultKey() {
            return vaultKey;
        }
    }

    private final Map<String, String> environmentVariables;
    private final CredentialVault vault;

    @Autowired
    public CredentialResolverImpl(CredentialVault vault) {
        this(System.getenv(), vault);
    }

    CredentialResolverImpl(Map<String, String> environmentVariables, CredentialVault vault) {
        this.environmentVariables = environmentVariables;
        this.vault = vault;
    }

    @Override
    public Credentials resolve(CredentialArgs explicitArgs) {
        CredentialArgs args = explicitArgs != null ? explicitArgs : CredentialArgs.none();
        Map<CredentialField, String> resolved = new EnumMap<>(CredentialField.class);
        for (CredentialField field : CredentialField.values()) {
            resolveField(field, args).ifPresent(value -> resolved.put(field, value));
        }

        Credentials credentials;
        try {
            credentials = new Credentials(
                    resolved.get(CredentialField.ADDRESS),
                    resolved.get(CredentialField.USERNAME),
                    resolved.get(CredentialField.PASSWORD),
                    resolved.get(CredentialField.DOMAIN),
                    resolved.get(CredentialField.NXOS_USERNAME),
                    resolved.get(CredentialField.NXOS_PASSWORD));
        } catch (CredentialException e) {
            log.error("Credential resolution failed: {}", e.getMessage());
            throw e;
        }
        log.info("Resolved credentials for controller {} (user '{}', domain '{}')",
                credentials.address(), credentials.username(), credentials.domainOrDefault());
        return credentials;
    }

    private Optional<String> resolveField(CredentialField field, CredentialArgs args) {
        String explicit = field.explicitValue.apply(args);
        if (hasText(explicit)) {
            log.debug("  Resolved {} from explicit arguments", field);
            return Optional.of(explicit);
        }

        String fromEnvironment = environmentVariables.get(field.environmentVariable());
        if (hasText(fromEnvironment)) {
            log.debug("  Resolved {} from environment variable {}", field, field.environmentVariable());
            return Optional.of(fromEnvironment);
        }

        Optional<String> fromVault = vault.get(field.vaultKey()).filter(CredentialResolverImpl::hasText);
        if (fromVault.isPresent()) {
            log.debug("  Resolved {} from vault entry {}", field, field.vaultKey());
        } else {
            log.debug("  No value found for {}", field);
        }
        return fromVault;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
