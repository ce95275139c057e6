package com.sfiya.autoreply.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used by the AI adapters. The read timeout bounds every classification,
 * generation and lead-detection call.
 */
@Configuration
public class RestTemplateConfig {

    @Value("${app.ai.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${app.ai.read-timeout:30s}")
    private Duration readTimeout;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
