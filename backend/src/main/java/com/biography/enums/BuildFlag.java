package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 构建标志（版本）：控制敏感内容过滤的严格程度
 *
 * 严格程度：SAFE > MAIN > PRIVATE = EXPLICIT
 */
public enum BuildFlag {

    MAIN("main"),
    SAFE("safe"),
    EXPLICIT("explicit"),
    PRIVATE("private");

    private final String code;

    BuildFlag(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 缺省值为 MAIN
     */
    @JsonCreator
    public static BuildFlag fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return MAIN;
        }
        for (BuildFlag flag : values()) {
            if (flag.code.equalsIgnoreCase(code) || flag.name().equalsIgnoreCase(code)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("未知的构建标志: " + code);
    }
}
