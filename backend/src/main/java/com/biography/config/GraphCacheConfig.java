package com.biography.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * 叙事图缓存配置
 */
@Configuration
public class GraphCacheConfig {

    @Value("${biography.graph.cache-ttl-hours:24}")
    private long cacheTtlHours;

    public long getCacheTtlHours() { return cacheTtlHours; }
}
