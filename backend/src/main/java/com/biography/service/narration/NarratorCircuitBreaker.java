package com.biography.service.narration;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 叙述协作方的熔断器，状态机由 Resilience4j 承担
 *
 * 失败计数规则：失败加一、成功减一（不清零），计数达到阈值即打开；
 * 距最后一次失败超过冷却时间后复位。冷却按注入的 Clock 计时。
 */
public class NarratorCircuitBreaker {

    private static final Logger logger = LoggerFactory.getLogger(NarratorCircuitBreaker.class);

    private final CircuitBreaker delegate;
    private final int failureThreshold;
    private final long resetTimeoutMillis;
    private final Clock clock;

    private int failureCount;
    private long lastFailureTime;

    public NarratorCircuitBreaker(CircuitBreaker delegate, int failureThreshold, long resetTimeoutMillis, Clock clock) {
        this.delegate = delegate;
        this.failureThreshold = failureThreshold;
        this.resetTimeoutMillis = resetTimeoutMillis;
        this.clock = clock;
    }

    /**
     * 单独使用（不经注册表）时的构造
     */
    public static NarratorCircuitBreaker of(String name, int failureThreshold, long resetTimeoutMillis, Clock clock) {
        return new NarratorCircuitBreaker(CircuitBreaker.of(name, config(failureThreshold, resetTimeoutMillis)),
            failureThreshold, resetTimeoutMillis, clock);
    }

    /**
     * 计数窗口 = 阈值，窗口内全部失败才由 Resilience4j 自行打开
     */
    public static CircuitBreakerConfig config(int failureThreshold, long resetTimeoutMillis) {
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(failureThreshold)
            .minimumNumberOfCalls(failureThreshold)
            .failureRateThreshold(100.0f)
            .waitDurationInOpenState(Duration.ofMillis(resetTimeoutMillis))
            .build();
    }

    /**
     * 是否允许调用协作方
     */
    public synchronized boolean allowRequest() {
        resetIfCooledDown();
        return delegate.tryAcquirePermission();
    }

    public synchronized void recordSuccess() {
        delegate.onSuccess(0, TimeUnit.MILLISECONDS);
        if (failureCount > 0) {
            failureCount--;
        }
    }

    public synchronized void recordFailure(Throwable error) {
        resetIfCooledDown();
        delegate.onError(0, TimeUnit.MILLISECONDS, error);
        failureCount++;
        lastFailureTime = clock.millis();
        if (failureCount >= failureThreshold && delegate.getState() != CircuitBreaker.State.OPEN) {
            delegate.transitionToOpenState();
        }
    }

    public synchronized boolean isOpen() {
        return delegate.getState() == CircuitBreaker.State.OPEN;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public String getName() {
        return delegate.getName();
    }

    CircuitBreaker getDelegate() {
        return delegate;
    }

    private void resetIfCooledDown() {
        if (failureCount > 0 && clock.millis() - lastFailureTime >= resetTimeoutMillis) {
            if (delegate.getState() != CircuitBreaker.State.CLOSED) {
                logger.info("🔄 熔断器冷却结束，复位: name={}", delegate.getName());
            }
            failureCount = 0;
            delegate.reset();
        }
    }
}
