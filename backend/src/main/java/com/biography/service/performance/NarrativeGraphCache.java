package com.biography.service.performance;

import com.biography.config.GraphCacheConfig;
import com.biography.model.NarrativeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 叙事图缓存
 *
 * 策略：
 * 1. 每个用户缓存一张图，默认24小时有效
 * 2. 过期即整体重建，不做增量更新
 * 3. 定时清理过期条目
 *
 * 同一用户的并发运行可能同时判定过期并重复构建，后写入者覆盖先写入者；
 * 构建结果相同，这一竞争是可接受的。
 */
@Component
public class NarrativeGraphCache {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeGraphCache.class);

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();

    @Autowired
    private GraphCacheConfig graphCacheConfig;

    @Autowired
    private Clock clock;

    /**
     * 获取未过期的图
     */
    public Optional<NarrativeGraph> get(String userId) {
        CacheEntry entry = cache.get(userId);

        if (entry == null) {
            return Optional.empty();
        }

        if (isExpired(entry, clock.millis())) {
            cache.remove(userId);
            logger.debug("叙事图缓存过期: userId={}", userId);
            return Optional.empty();
        }

        logger.debug("叙事图缓存命中: userId={}", userId);
        return Optional.of(entry.graph);
    }

    public void put(String userId, NarrativeGraph graph) {
        CacheEntry entry = new CacheEntry();
        entry.timestamp = clock.millis();
        entry.graph = graph;

        cache.put(userId, entry);
        logger.debug("叙事图缓存设置: userId={}, atoms={}", userId,
            graph.getAtoms() != null ? graph.getAtoms().size() : 0);
    }

    /**
     * 原子发生变化后由调用方主动失效
     */
    public void invalidate(String userId) {
        if (cache.remove(userId) != null) {
            logger.info("失效叙事图缓存: userId={}", userId);
        }
    }

    /**
     * 定时清理过期缓存
     */
    @Scheduled(fixedRate = 60 * 60 * 1000) // 每小时
    public void cleanExpiredCache() {
        long now = clock.millis();
        int removedCount = 0;

        Iterator<Map.Entry<String, CacheEntry>> iterator = cache.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, CacheEntry> entry = iterator.next();
            if (isExpired(entry.getValue(), now)) {
                iterator.remove();
                removedCount++;
            }
        }

        if (removedCount > 0) {
            logger.info("清理过期叙事图缓存: 移除{}个条目", removedCount);
        }
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return now - entry.timestamp >= ttlMillis();
    }

    private long ttlMillis() {
        return Duration.ofHours(graphCacheConfig.getCacheTtlHours()).toMillis();
    }

    private static class CacheEntry {
        long timestamp;
        NarrativeGraph graph;
    }
}
