package com.biography.service.narration;

/**
 * 重试退避的等待动作，测试中可替换为不阻塞的实现
 */
@FunctionalInterface
public interface BackoffSleeper {

    void sleep(long millis) throws InterruptedException;
}
