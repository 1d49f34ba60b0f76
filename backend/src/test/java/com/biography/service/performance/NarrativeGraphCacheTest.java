package com.biography.service.performance;

import com.biography.config.GraphCacheConfig;
import com.biography.model.NarrativeGraph;
import com.biography.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NarrativeGraphCacheTest {

    private NarrativeGraphCache cache;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T00:00:00Z");
        GraphCacheConfig config = new GraphCacheConfig();
        ReflectionTestUtils.setField(config, "cacheTtlHours", 24L);

        cache = new NarrativeGraphCache();
        ReflectionTestUtils.setField(cache, "graphCacheConfig", config);
        ReflectionTestUtils.setField(cache, "clock", clock);
    }

    private NarrativeGraph graph(String userId) {
        return NarrativeGraph.builder().userId(userId).atoms(new ArrayList<>()).build();
    }

    @Test
    @DisplayName("未缓存时返回空")
    void missReturnsEmpty() {
        assertFalse(cache.get("nobody").isPresent());
    }

    @Test
    @DisplayName("有效期内命中，满24小时即过期")
    void entryExpiresAtTtl() {
        NarrativeGraph graph = graph("u1");
        cache.put("u1", graph);

        clock.advance(Duration.ofHours(24).minusMillis(1));
        assertSame(graph, cache.get("u1").orElse(null));

        clock.advance(Duration.ofMillis(1));
        assertFalse(cache.get("u1").isPresent());
    }

    @Test
    @DisplayName("定时清理只移除过期条目")
    void cleanupRemovesExpiredEntriesOnly() {
        cache.put("old", graph("old"));
        clock.advance(Duration.ofHours(20));
        cache.put("fresh", graph("fresh"));
        clock.advance(Duration.ofHours(5));

        cache.cleanExpiredCache();
        assertTrue(cache.get("fresh").isPresent());

        // 回拨时钟后过期条目仍不可见，说明已被移除
        clock.advance(Duration.ofHours(-25));
        assertFalse(cache.get("old").isPresent());
        assertTrue(cache.get("fresh").isPresent());
    }

    @Test
    @DisplayName("主动失效后不再命中")
    void invalidateDropsEntry() {
        cache.put("u1", graph("u1"));
        cache.invalidate("u1");
        assertFalse(cache.get("u1").isPresent());
    }
}
