package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 传记生成范围
 */
public enum BiographyScope {

    FULL_LIFE("full_life"),
    DOMAIN("domain"),
    TIME_RANGE("time_range"),
    THEMATIC("thematic");

    private final String code;

    BiographyScope(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否按时间顺序排列章节
     */
    public boolean isChronological() {
        return this == FULL_LIFE || this == TIME_RANGE;
    }

    @JsonCreator
    public static BiographyScope fromCode(String code) {
        for (BiographyScope scope : values()) {
            if (scope.code.equalsIgnoreCase(code) || scope.name().equalsIgnoreCase(code)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("未知的传记范围: " + code);
    }
}
