package com.sfiya.autoreply.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Value("${rate-limiter.capacity:60}")
    private long capacity;

    @Value("${rate-limiter.refill-tokens:60}")
    private long refillTokens;

    @Bean(name = "aiRateLimiter")
    public Bucket bucket() {
        return Bucket.builder()
                .addLimit(Bandwidth.classic(capacity, Refill.greedy(refillTokens, Duration.ofMinutes(1))))
                .build();
    }
}
