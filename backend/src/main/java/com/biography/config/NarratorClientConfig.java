package com.biography.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * 章节叙述协作方（OpenAI 兼容接口）配置
 */
@Configuration
public class NarratorClientConfig {

    @Value("${biography.narrator.base-url:https://api.openai.com}")
    private String baseUrl;

    @Value("${biography.narrator.api-key:}")
    private String apiKey;

    @Value("${biography.narrator.model:gpt-4o-mini}")
    private String model;

    @Value("${biography.narrator.temperature:0.7}")
    private double temperature;

    public String getBaseUrl() { return baseUrl; }
    public String getApiKey() { return apiKey; }
    public String getModel() { return model; }
    public double getTemperature() { return temperature; }

    public String getApiUrl() {
        String url = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return url + "/v1/chat/completions";
    }
}
