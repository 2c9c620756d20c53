package com.ndclient.service.impl;

import com.ndclient.dto.request.CredentialArgs;
import com.ndclient.exception.CredentialException;
import com.ndclient.model.Credentials;
import com.ndclient.service.api.CredentialVault;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

// The vault is asked for several keys per resolution; only some of them are stubbed.
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CredentialResolverImplTest {

    @Mock
    private CredentialVault vault;

    private Map<String, String> environment;
    private CredentialResolverImpl resolver;

    @BeforeEach
    void setUp() {
        environment = new HashMap<>();
        resolver = new CredentialResolverImpl(environment, vault);
    }

    @Test
    void resolve_shouldPreferExplicitArgumentsOverEnvironmentAndVault() {
        environment.put("ND_IP4", "10.0.0.2");
        environment.put("ND_USERNAME", "env-user");
        environment.put("ND_PASSWORD", "env-pass");

        Credentials credentials = resolver.resolve(CredentialArgs.builder()
                .address("10.0.0.1")
                .username("admin")
                .password("secret")
                .build());

        assertThat(credentials.address()).isEqualTo("10.0.0.1");
        assertThat(credentials.username()).isEqualTo("admin");
        assertThat(credentials.password()).isEqualTo("secret");
        verify(vault, never()).get("nd_ip4");
        verify(vault, never()).get("nd_username");
        verify(vault, never()).get("nd_password");
    }

    @Test
    void resolve_shouldUseEnvironmentWhenArgumentIsBlank() {
        environment.put("ND_IP4", "10.0.0.2");
        environment.put("ND_USERNAME", "env-user");
        environment.put("ND_PASSWORD", "env-pass");
        environment.put("ND_DOMAIN", "radius");

        Credentials credentials = resolver.resolve(CredentialArgs.builder().address("  ").build());

        assertThat(credentials.address()).isEqualTo("10.0.0.2");
        assertThat(credentials.username()).isEqualTo("env-user");
        assertThat(credentials.domainOrDefault()).isEqualTo("radius");
        verify(vault, never()).get("nd_ip4");
    }

    @Test
    void resolve_shouldFallBackToVaultPerField() {
        environment.put("ND_IP4", "10.0.0.2");
        when(vault.get("nd_username")).thenReturn(Optional.of("vault-user"));
        when(vault.get("nd_password")).thenReturn(Optional.of("vault-pass"));

        Credentials credentials = resolver.resolve(CredentialArgs.builder().build());

        assertThat(credentials.address()).isEqualTo("10.0.0.2");
        assertThat(credentials.username()).isEqualTo("vault-user");
        assertThat(credentials.password()).isEqualTo("vault-pass");
        assertThat(credentials.domain()).isNull();
        assertThat(credentials.domainOrDefault()).isEqualTo("local");
        verify(vault, never()).get("nd_ip4");
    }

    @Test
    void resolve_shouldReadEnvironmentValuesLiterally() {
        environment.put("ND_IP4", "10.0.0.2");
        environment.put("ND_USERNAME", "admin");
        environment.put("ND_PASSWORD", "pa${ss}word");
        environment.put("ND_DOMAIN", "ENC(abcdef)");

        Credentials credentials = resolver.resolve(CredentialArgs.none());

        assertThat(credentials.password()).isEqualTo("pa${ss}word");
        assertThat(credentials.domain()).isEqualTo("ENC(abcdef)");
        verify(vault, never()).get("nd_password");
    }

    @Test
    void resolve_shouldResolveOptionalSwitchCredentials() {
        environment.put("ND_IP4", "10.0.0.2");
        environment.put("ND_USERNAME", "admin");
        environment.put("ND_PASSWORD", "secret");
        environment.put("NXOS_USERNAME", "nxos-admin");
        when(vault.get("nxos_password")).thenReturn(Optional.of("nxos-secret"));

        Credentials credentials = resolver.resolve(null);

        assertThat(credentials.nxosUsernameValue()).contains("nxos-admin");
        assertThat(credentials.nxosPasswordValue()).contains("nxos-secret");
    }

    @Test
    void resolve_shouldFailNamingEveryMissingField() {
        assertThatThrownBy(() -> resolver.resolve(CredentialArgs.none()))
                .isInstanceOf(CredentialException.class)
                .hasMessageContaining("address")
                .hasMessageContaining("username")
                .hasMessageContaining("password");
    }

    @Test
    void resolve_shouldPropagateVaultFailure() {
        environment.put("ND_IP4", "10.0.0.2");
        environment.put("ND_USERNAME", "admin");
        when(vault.get("nd_password")).thenThrow(new CredentialException("Unable to decrypt vault entry 'nd_password'"));

        assertThatThrownBy(() -> resolver.resolve(CredentialArgs.none()))
                .isInstanceOf(CredentialException.class)
                .hasMessageContaining("nd_password");
    }

    @Test
    void resolve_shouldNotExposePasswordInToString() {
        Credentials credentials = resolver.resolve(CredentialArgs.builder()
                .address("10.0.0.1").username("admin").password("secret").build());

        assertThat(credentials.toString()).doesNotContain("secret");
    }
}
