package com.sendseven.passkeyauth.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Web configuration for the passkey login application.
 */
@Configuration
public class WebConfig {

    private static final int CONNECT_TIMEOUT_MS = 5000;

    /**
     * WebClient for server-to-server calls to the identity provider.
     *
     * The response timeout bounds the token exchange so a slow provider cannot
     * hold the callback request open indefinitely.
     */
    @Bean
    public WebClient identityProviderWebClient(IdentityProviderProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .responseTimeout(properties.getExchangeTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(1024 * 1024)) // 1MB buffer
                .build();
    }
}
