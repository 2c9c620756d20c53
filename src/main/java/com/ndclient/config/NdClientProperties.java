package com.ndclient.config;

import com.ndclient.model.SendConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the controller client settings prefixed with {@code nd} from {@code application.yml}.
 * <pre>
 * nd:
 *   scheme: https
 *   verify-tls: true
 *   login-path: /login
 *   vault:
 *     path: ${user.home}/.nd-client/vault.json
 *   send:
 *     timeout: 30s
 *     send-interval: 5s
 *     max-attempts: 3
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "nd")
public class NdClientProperties {

    /**
     * URL scheme used to reach the controller.
     */
    @NotBlank
    private String scheme = "https";

    /**
     * When {@code false}, the controller certificate is not verified. Intended for lab
     * controllers with self-signed certificates.
     */
    private boolean verifyTls = true;

    /**
     * Path of the login endpoint, relative to the controller address.
     */
    @NotBlank
    private String loginPath = "/login";

    @Valid
    @NotNull
    private Vault vault = new Vault();

    @Valid
    @NotNull
    private Send send = new Send();

    /**
     * @param address The controller address, with an optional port.
     * @return The URL every request path is appended to.
     */
    public String baseUrl(String address) {
        return scheme + "://" + address;
    }

    @Data
    public static class Vault {

        /**
         * Location of the encrypted credential vault file.
         */
        @NotBlank
        private String path = System.getProperty("user.home") + "/.nd-client/vault.json";
    }

    @Data
    public static class Send {

        @NotNull
        private Duration timeout = SendConfig.DEFAULT.timeout();

        @NotNull
        private Duration sendInterval = SendConfig.DEFAULT.sendInterval();

        @Min(1)
        private int maxAttempts = SendConfig.DEFAULT.maxAttempts();

        public SendConfig toSendConfig() {
            return new SendConfig(timeout, sendInterval, maxAttempts);
        }
    }
}
