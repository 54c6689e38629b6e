package com.simod.discovery.service.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class CoreConfig {

    private static final int CALLBACK_CONNECT_TIMEOUT_MS = 5000;
    private static final int CALLBACK_READ_TIMEOUT_MS = 10000;

    /**
     * Time source for timestamps, expiry checks and sweeps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for completion callbacks.
     */
    @Bean
    public RestClient callbackRestClient(RestClient.Builder builder) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CALLBACK_CONNECT_TIMEOUT_MS);
        requestFactory.setReadTimeout(CALLBACK_READ_TIMEOUT_MS);
        return builder.requestFactory(requestFactory).build();
    }
}
