package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 空白期类型
 */
public enum VoidType {

    SHORT_GAP("short_gap"),
    MEDIUM_GAP("medium_gap"),
    LONG_SILENCE("long_silence"),
    VOID("void");

    private final String code;

    VoidType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
