package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 目标读者
 */
public enum BiographyAudience {

    SELF("self", "Write for personal reflection. Include authentic personal details."),
    PUBLIC("public", "Write for a general audience. Avoid overly personal details."),
    PROFESSIONAL("professional", "Write for professional context. Emphasize skills, achievements, and competence.");

    private final String code;
    private final String instructions;

    BiographyAudience(String code, String instructions) {
        this.code = code;
        this.instructions = instructions;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getInstructions() {
        return instructions;
    }

    @JsonCreator
    public static BiographyAudience fromCode(String code) {
        for (BiographyAudience audience : values()) {
            if (audience.code.equalsIgnoreCase(code) || audience.name().equalsIgnoreCase(code)) {
                return audience;
            }
        }
        return SELF;
    }
}
