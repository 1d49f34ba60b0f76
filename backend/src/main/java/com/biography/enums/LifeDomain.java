package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 人生领域标签
 */
public enum LifeDomain {

    FIGHTING("fighting", "The Fighter's Journey"),
    ROBOTICS("robotics", "Building the Future"),
    RELATIONSHIPS("relationships", "Connections and Bonds"),
    CREATIVE("creative", "The Creative Path"),
    PROFESSIONAL("professional", "Professional Journey"),
    PERSONAL("personal", "My Story"),
    HEALTH("health", "Health and Wellness"),
    EDUCATION("education", "Learning Journey"),
    FAMILY("family", "Family Story"),
    FRIENDSHIP("friendship", "Friendships"),
    ROMANCE("romance", "Love Story");

    private final String code;
    private final String biographyTitle;

    LifeDomain(String code, String biographyTitle) {
        this.code = code;
        this.biographyTitle = biographyTitle;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 领域传记的默认书名
     */
    public String getBiographyTitle() {
        return biographyTitle;
    }

    @JsonCreator
    public static LifeDomain fromCode(String code) {
        for (LifeDomain domain : values()) {
            if (domain.code.equalsIgnoreCase(code) || domain.name().equalsIgnoreCase(code)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("未知的人生领域: " + code);
    }
}
