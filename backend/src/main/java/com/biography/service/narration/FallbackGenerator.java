package com.biography.service.narration;

import com.biography.common.NarratorException;
import com.biography.config.FallbackPolicyConfig;
import com.biography.model.ChapterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * 叙述调用的容错包装：重试 + 指数退避 + 熔断 + 模板兜底
 *
 * 只对瞬时错误（限流、超时、网络、5xx）重试，最多3次，退避 1s·2^n，上限30s。
 * 重试耗尽或熔断打开时返回模板文本，运行继续。
 * 每次最终失败的调用只计一次熔断失败。
 */
@Service
public class FallbackGenerator {

    private static final Logger logger = LoggerFactory.getLogger(FallbackGenerator.class);

    @Autowired
    private ChapterNarrator chapterNarrator;

    @Autowired
    private TemplateNarrator templateNarrator;

    @Autowired
    private BackoffSleeper backoffSleeper;

    @Autowired
    private FallbackPolicyConfig policyConfig;

    public NarrationResult generate(ChapterContext context, NarratorCircuitBreaker breaker) {
        if (!breaker.allowRequest()) {
            logger.warn("⚠️ 熔断器已打开，使用模板生成: chapter={}, purpose={}", context.getChapterId(), context.getPurpose());
            return NarrationResult.template(templateNarrator.narrate(context));
        }

        int maxRetries = Math.max(1, policyConfig.getMaxRetries());
        RuntimeException lastError = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                String text = chapterNarrator.generate(context);
                breaker.recordSuccess();
                return NarrationResult.generated(text);
            } catch (RuntimeException e) {
                lastError = e;
                boolean retryable = NarratorException.isTransient(e);
                if (!retryable || attempt == maxRetries - 1) {
                    break;
                }

                long delay = backoffDelay(attempt);
                logger.warn("🔄 叙述调用失败，{}ms后重试 ({}/{}): chapter={}, error={}",
                    delay, attempt + 1, maxRetries, context.getChapterId(), e.getMessage());
                try {
                    backoffSleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        breaker.recordFailure(lastError);
        logger.error("❌ 叙述调用最终失败，使用模板生成: chapter={}, purpose={}, error={}",
            context.getChapterId(), context.getPurpose(), lastError != null ? lastError.getMessage() : null);
        return NarrationResult.template(templateNarrator.narrate(context));
    }

    /**
     * base·2^attempt，不超过上限
     */
    long backoffDelay(int attempt) {
        long delay = policyConfig.getBaseBackoffMs() * (1L << Math.min(attempt, 30));
        return Math.min(delay, policyConfig.getMaxBackoffMs());
    }
}
