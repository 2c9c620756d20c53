package com.ndclient.config;

import com.ndclient.model.SendConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import javax.net.ssl.SSLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating the HTTP client and the retry
 * infrastructure shared by the session authenticator and the request sender.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(NdClientProperties.class)
public class NdClientConfiguration {

    /**
     * Creates the singleton WebClient used for every controller call.
     * <p>
     * The connect timeout follows {@code nd.send.timeout}. When {@code nd.verify-tls} is
     * {@code false}, the controller certificate is accepted without verification.
     *
     * @param properties The bound {@code nd.*} settings.
     * @return A WebClient backed by a pooled Reactor Netty connector.
     */
    @Bean
    public WebClient ndWebClient(NdClientProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getSend().getTimeout().toMillis());

        if (!properties.isVerifyTls()) {
            log.warn("TLS certificate verification is disabled for controller connections.");
            SslContext sslContext = insecureSslContext();
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
        }

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    /**
     * The send configuration is read once at startup and treated as fixed afterwards.
     */
    @Bean
    public SendConfig sendConfig(NdClientProperties properties) {
        SendConfig sendConfig = properties.getSend().toSendConfig();
        log.info("Request sender configured with timeout={}, sendInterval={}, maxAttempts={}",
                sendConfig.timeout(), sendConfig.sendInterval(), sendConfig.maxAttempts());
        return sendConfig;
    }

    @Bean
    public RetryRegistry ndRetryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    private static SslContext insecureSslContext() {
        try {
            return SslContextBuilder.forClient()
                    .trustManager(InsecureTrustManagerFactory.INSTANCE)
                    .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Could not build the TLS context for controller connections", e);
        }
    }
}
