package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 叙事原子类型（封闭集合）
 */
public enum NarrativeAtomType {

    EVENT("event", "事件"),
    REFLECTION("reflection", "反思"),
    CONFLICT("conflict", "冲突"),
    ACHIEVEMENT("achievement", "成就"),
    TURNING_POINT("turning_point", "转折点"),
    RELATIONSHIP_MOMENT("relationship_moment", "关系时刻"),
    CREATIVE_OUTPUT("creative_output", "创作产出"),
    SKILL_MILESTONE("skill_milestone", "技能里程碑");

    private final String code;
    private final String displayName;

    NarrativeAtomType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static NarrativeAtomType fromCode(String code) {
        for (NarrativeAtomType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的原子类型: " + code);
    }
}
