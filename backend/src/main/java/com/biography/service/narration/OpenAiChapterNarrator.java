package com.biography.service.narration;

import com.biography.common.NarratorException;
import com.biography.config.NarratorClientConfig;
import com.biography.model.ChapterContext;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 OpenAI 兼容接口的章节叙述（非流式）
 */
@Service
public class OpenAiChapterNarrator implements ChapterNarrator {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiChapterNarrator.class);

    @Autowired
    private NarratorClientConfig clientConfig;

    @Autowired
    private ChapterPromptBuilder promptBuilder;

    private RestTemplate restTemplate = new RestTemplate();

    @Override
    @SuppressWarnings("unchecked")
    public String generate(ChapterContext context) {
        if (StringUtils.isBlank(clientConfig.getApiKey())) {
            throw new NarratorException("叙述服务未配置API Key");
        }

        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", clientConfig.getModel());
        requestBody.put("max_tokens", promptBuilder.maxTokens(context));
        requestBody.put("temperature", clientConfig.getTemperature());
        requestBody.put("stream", false);
        requestBody.put("messages", promptBuilder.buildMessages(context));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(clientConfig.getApiKey());

        String url = clientConfig.getApiUrl();
        logger.debug("🌐 调用叙述接口: url={}, chapter={}, purpose={}", url, context.getChapterId(), context.getPurpose());

        ResponseEntity<Map> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(requestBody, headers), Map.class);
        } catch (HttpStatusCodeException e) {
            throw new NarratorException("叙述服务返回错误: " + e.getStatusCode(), e.getRawStatusCode(), e);
        } catch (ResourceAccessException e) {
            throw new NarratorException("叙述服务网络异常: " + e.getMessage(), null, e);
        }

        Map<String, Object> body = response.getBody();
        if (!response.getStatusCode().is2xxSuccessful() || body == null) {
            throw new NarratorException("叙述服务响应异常", response.getStatusCodeValue());
        }

        List<Map<String, Object>> choices = (List<Map<String, Object>>) body.get("choices");
        if (choices != null && !choices.isEmpty()) {
            Map<String, Object> messageObj = (Map<String, Object>) choices.get(0).get("message");
            if (messageObj != null) {
                String content = (String) messageObj.get("content");
                if (StringUtils.isNotBlank(content)) {
                    logger.debug("✅ 叙述生成成功: chapter={}, 长度={}", context.getChapterId(), content.length());
                    return content.trim();
                }
            }
        }

        throw new NarratorException("叙述服务返回内容为空");
    }
}
