package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 叙事语气
 */
public enum BiographyTone {

    NEUTRAL("neutral", "Use neutral, factual language."),
    DRAMATIC("dramatic", "Use vivid, dramatic language. Emphasize conflict, tension, and emotional intensity."),
    REFLECTIVE("reflective", "Use thoughtful, introspective language. Focus on meaning and personal growth."),
    MYTHIC("mythic", "Use elevated, archetypal language. Frame events as part of a larger narrative."),
    PROFESSIONAL("professional", "Use clear, professional language. Focus on achievements and competence.");

    private final String code;
    private final String instructions;

    BiographyTone(String code, String instructions) {
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
    public static BiographyTone fromCode(String code) {
        for (BiographyTone tone : values()) {
            if (tone.code.equalsIgnoreCase(code) || tone.name().equalsIgnoreCase(code)) {
                return tone;
            }
        }
        return NEUTRAL;
    }
}
