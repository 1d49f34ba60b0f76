package com.biography.model;

import com.biography.enums.BiographyAudience;
import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyScope;
import com.biography.enums.BiographyTone;
import com.biography.enums.BuildFlag;
import com.biography.enums.LifeDomain;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * 传记生成请求，单次运行内不可变
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BiographySpec {

    BiographyScope scope;

    LifeDomain domain;

    TimeSpan timeRange;

    @Builder.Default
    BiographyTone tone = BiographyTone.NEUTRAL;

    @Builder.Default
    BiographyDepth depth = BiographyDepth.DETAILED;

    @Builder.Default
    BiographyAudience audience = BiographyAudience.SELF;

    boolean includeIntrospection;

    /**
     * 构建标志，缺省为 MAIN
     */
    @Builder.Default
    BuildFlag version = BuildFlag.MAIN;

    @Singular("theme")
    List<String> themes;

    @Singular("peopleId")
    List<String> peopleIds;

    @Singular("characterId")
    List<String> characterIds;

    @Singular("locationId")
    List<String> locationIds;

    @Singular("eventId")
    List<String> eventIds;

    @Singular("skillId")
    List<String> skillIds;

    boolean coreLorebook;

    String lorebookName;

    Integer lorebookVersion;

    /**
     * 显式给定的 version 为空时仍按 MAIN 处理
     */
    public BuildFlag getVersion() {
        return version != null ? version : BuildFlag.MAIN;
    }

    public BiographyDepth getDepth() {
        return depth != null ? depth : BiographyDepth.DETAILED;
    }

    public BiographyScope getScope() {
        return scope != null ? scope : BiographyScope.FULL_LIFE;
    }
}
