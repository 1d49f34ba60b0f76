package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 空白期重要程度
 */
public enum VoidSignificance {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String code;

    VoidSignificance(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 提升一级，HIGH 保持不变
     */
    public VoidSignificance escalate() {
        switch (this) {
            case LOW:
                return MEDIUM;
            case MEDIUM:
            case HIGH:
            default:
                return HIGH;
        }
    }
}
