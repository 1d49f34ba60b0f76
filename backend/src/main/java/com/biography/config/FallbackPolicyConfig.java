package com.biography.config;

import com.biography.service.narration.BackoffSleeper;
import com.biography.service.narration.NarratorCircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 重试、退避与熔断配置
 */
@Configuration
public class FallbackPolicyConfig {

    @Value("${biography.narrator.max-retries:3}")
    private int maxRetries;

    @Value("${biography.narrator.base-backoff-ms:1000}")
    private long baseBackoffMs;

    @Value("${biography.narrator.max-backoff-ms:30000}")
    private long maxBackoffMs;

    @Value("${biography.narrator.breaker.scope:global}")
    private String breakerScope;

    @Value("${biography.narrator.breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${biography.narrator.breaker.reset-timeout-ms:300000}")
    private long resetTimeoutMs;

    @Bean
    public BackoffSleeper backoffSleeper() {
        return Thread::sleep;
    }

    @Bean
    public NarratorCircuitBreakerRegistry narratorCircuitBreakerRegistry(Clock clock) {
        return new NarratorCircuitBreakerRegistry(NarratorCircuitBreakerRegistry.Scope.fromCode(breakerScope),
            failureThreshold, resetTimeoutMs, clock);
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseBackoffMs() { return baseBackoffMs; }
    public long getMaxBackoffMs() { return maxBackoffMs; }
}
