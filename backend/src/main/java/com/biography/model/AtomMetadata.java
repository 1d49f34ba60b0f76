package com.biography.model;

import com.biography.enums.NarrativeAtomType;
import com.biography.enums.PreservedContentType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 原子元数据（按原子类型区分的变体）
 *
 * 每种 {@link NarrativeAtomType} 对应一个变体，过滤器和放置规则按类型穷举匹配，
 * 不再在任意键值包里探测可选字段。
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = AtomMetadata.Event.class, name = "event"),
    @JsonSubTypes.Type(value = AtomMetadata.Reflection.class, name = "reflection"),
    @JsonSubTypes.Type(value = AtomMetadata.Conflict.class, name = "conflict"),
    @JsonSubTypes.Type(value = AtomMetadata.Achievement.class, name = "achievement"),
    @JsonSubTypes.Type(value = AtomMetadata.TurningPoint.class, name = "turning_point"),
    @JsonSubTypes.Type(value = AtomMetadata.RelationshipMoment.class, name = "relationship_moment"),
    @JsonSubTypes.Type(value = AtomMetadata.CreativeOutput.class, name = "creative_output"),
    @JsonSubTypes.Type(value = AtomMetadata.SkillMilestone.class, name = "skill_milestone")
})
public abstract class AtomMetadata {

    @JsonIgnore
    public abstract NarrativeAtomType getKind();

    public List<String> getLocationIds() {
        return Collections.emptyList();
    }

    public List<String> getEventIds() {
        return Collections.emptyList();
    }

    public List<String> getSkillIds() {
        return Collections.emptyList();
    }

    /**
     * 需要保留原文措辞的内容类型，普通原子返回 null
     */
    public PreservedContentType getPreservedType() {
        return null;
    }

    @JsonIgnore
    public boolean isPreserved() {
        return getPreservedType() != null;
    }

    /**
     * 为指定类型创建空元数据
     */
    public static AtomMetadata empty(NarrativeAtomType type) {
        switch (type) {
            case EVENT:
                return new Event();
            case REFLECTION:
                return new Reflection();
            case CONFLICT:
                return new Conflict();
            case ACHIEVEMENT:
                return new Achievement();
            case TURNING_POINT:
                return new TurningPoint();
            case RELATIONSHIP_MOMENT:
                return new RelationshipMoment();
            case CREATIVE_OUTPUT:
                return new CreativeOutput();
            case SKILL_MILESTONE:
                return new SkillMilestone();
            default:
                throw new IllegalArgumentException("未支持的原子类型: " + type);
        }
    }

    private static List<String> safe(List<String> values) {
        return values == null ? Collections.emptyList() : Collections.unmodifiableList(values);
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class Event extends AtomMetadata {
        private List<String> locationIds;
        private List<String> eventIds;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.EVENT;
        }

        @Override
        public List<String> getLocationIds() {
            return safe(locationIds);
        }

        @Override
        public List<String> getEventIds() {
            return safe(eventIds);
        }
    }

    /**
     * 反思：证言、建议、宣言等常以反思形式出现
     */
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class Reflection extends AtomMetadata {
        private PreservedContentType preservedType;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.REFLECTION;
        }

        @Override
        public PreservedContentType getPreservedType() {
            return preservedType;
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class Conflict extends AtomMetadata {
        private List<String> locationIds;
        private List<String> eventIds;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.CONFLICT;
        }

        @Override
        public List<String> getLocationIds() {
            return safe(locationIds);
        }

        @Override
        public List<String> getEventIds() {
            return safe(eventIds);
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class Achievement extends AtomMetadata {
        private List<String> eventIds;
        private List<String> skillIds;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.ACHIEVEMENT;
        }

        @Override
        public List<String> getEventIds() {
            return safe(eventIds);
        }

        @Override
        public List<String> getSkillIds() {
            return safe(skillIds);
        }
    }

    /**
     * 转折点：誓言、承诺常伴随转折点出现
     */
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class TurningPoint extends AtomMetadata {
        private List<String> locationIds;
        private List<String> eventIds;
        private PreservedContentType preservedType;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.TURNING_POINT;
        }

        @Override
        public List<String> getLocationIds() {
            return safe(locationIds);
        }

        @Override
        public List<String> getEventIds() {
            return safe(eventIds);
        }

        @Override
        public PreservedContentType getPreservedType() {
            return preservedType;
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class RelationshipMoment extends AtomMetadata {
        private List<String> locationIds;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.RELATIONSHIP_MOMENT;
        }

        @Override
        public List<String> getLocationIds() {
            return safe(locationIds);
        }
    }

    /**
     * 创作产出：前言、献词、尾声等结构性文本
     */
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class CreativeOutput extends AtomMetadata {
        private List<String> skillIds;
        private PreservedContentType preservedType;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.CREATIVE_OUTPUT;
        }

        @Override
        public List<String> getSkillIds() {
            return safe(skillIds);
        }

        @Override
        public PreservedContentType getPreservedType() {
            return preservedType;
        }
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    @ToString
    public static class SkillMilestone extends AtomMetadata {
        private List<String> skillIds;

        @Override
        public NarrativeAtomType getKind() {
            return NarrativeAtomType.SKILL_MILESTONE;
        }

        @Override
        public List<String> getSkillIds() {
            return safe(skillIds);
        }
    }
}
