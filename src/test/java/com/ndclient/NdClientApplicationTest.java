package com.ndclient;

import com.ndclient.config.NdClientProperties;
import com.ndclient.endpoint.ManageEndpoints;
import com.ndclient.model.SendConfig;
import com.ndclient.service.api.ControllerClient;
import com.ndclient.service.api.CredentialVault;
import com.ndclient.service.api.RequestSender;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "nd.send.timeout=10s",
        "nd.send.send-interval=2s",
        "nd.send.max-attempts=4",
        "nd.verify-tls=false",
        "nd.vault.path=${java.io.tmpdir}/nd-client-test/vault.json",
        "jasypt.encryptor.password=test-passphrase",
        "logging.config=classpath:logback-test.xml"
})
class NdClientApplicationTest {

    @Autowired
    private ControllerClient controllerClient;

    @Autowired
    private ManageEndpoints manageEndpoints;

    @Autowired
    private RequestSender requestSender;

    @Autowired
    private CredentialVault credentialVault;

    @Autowired
    private NdClientProperties properties;

    @Test
    void contextLoads_withClientComponentsWired() {
        assertThat(controllerClient).isNotNull();
        assertThat(credentialVault).isNotNull();
        assertThat(manageEndpoints.credentialsDetailsGet().path()).isEqualTo("/api/v1/manage/credentials/details");
    }

    @Test
    void sendConfig_shouldBeBoundFromProperties() {
        assertThat(requestSender.config())
                .isEqualTo(new SendConfig(Duration.ofSeconds(10), Duration.ofSeconds(2), 4));
        assertThat(properties.isVerifyTls()).isFalse();
        assertThat(properties.baseUrl("10.0.0.1")).isEqualTo("https://10.0.0.1");
    }
}
