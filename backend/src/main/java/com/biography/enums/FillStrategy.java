package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 空白期填充策略
 */
public enum FillStrategy {

    ACKNOWLEDGE_VOID("acknowledge_void"),
    INFER_CONTEXT("infer_context"),
    PROMPT_USER("prompt_user");

    private final String code;

    FillStrategy(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
