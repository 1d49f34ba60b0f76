package com.biography.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON 文本列读写工具
 */
public final class JsonColumnUtils {

    private static final Logger logger = LoggerFactory.getLogger(JsonColumnUtils.class);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() {};

    private JsonColumnUtils() {
    }

    public static String write(ObjectMapper objectMapper, Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON序列化失败: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 读取字符串列表，空值返回空列表
     */
    public static List<String> readStringList(ObjectMapper objectMapper, String json) {
        if (StringUtils.isBlank(json)) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            logger.warn("⚠️ JSON列解析失败，按空列表处理: {}", StringUtils.abbreviate(json, 80));
            return new ArrayList<>();
        }
    }

    public static <T> T read(ObjectMapper objectMapper, String json, Class<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON反序列化失败: " + e.getOriginalMessage(), e);
        }
    }
}
