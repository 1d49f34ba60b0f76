package com.biography.service.narration;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 熔断器注册表
 *
 * GLOBAL：所有用户共用一个熔断器；PER_USER：每个用户独立。
 */
public class NarratorCircuitBreakerRegistry {

    private static final Logger logger = LoggerFactory.getLogger(NarratorCircuitBreakerRegistry.class);

    public enum Scope {
        GLOBAL,
        PER_USER;

        public static Scope fromCode(String code) {
            if (code != null && code.trim().replace('-', '_').equalsIgnoreCase(PER_USER.name())) {
                return PER_USER;
            }
            return GLOBAL;
        }
    }

    private static final String GLOBAL_NAME = "global";

    private final Scope scope;
    private final int failureThreshold;
    private final long resetTimeoutMillis;
    private final Clock clock;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Map<String, NarratorCircuitBreaker> breakers = new ConcurrentHashMap<>();

    public NarratorCircuitBreakerRegistry(Scope scope, int failureThreshold, long resetTimeoutMillis, Clock clock) {
        this.scope = scope;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMillis = resetTimeoutMillis;
        this.clock = clock;
        this.circuitBreakerRegistry = CircuitBreakerRegistry.of(
            NarratorCircuitBreaker.config(failureThreshold, resetTimeoutMillis));
    }

    /**
     * 本次运行使用的熔断器
     */
    public NarratorCircuitBreaker forUser(String userId) {
        String name = scope == Scope.PER_USER ? "user:" + userId : GLOBAL_NAME;
        return breakers.computeIfAbsent(name, this::create);
    }

    public Scope getScope() {
        return scope;
    }

    private NarratorCircuitBreaker create(String name) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(name);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
            logger.warn("🚫 熔断器状态变化: name={}, transition={}",
                event.getCircuitBreakerName(), event.getStateTransition()));
        return new NarratorCircuitBreaker(circuitBreaker, failureThreshold, resetTimeoutMillis, clock);
    }
}
