package com.biography.model;

import com.biography.enums.LifeDomain;
import com.biography.enums.NarrativeAtomType;
import com.biography.enums.PreservedContentType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * 叙事原子：最小的叙事事实单元
 *
 * 由外部摄取流程创建，之后只读
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class NarrativeAtom {

    String id;

    NarrativeAtomType type;

    Instant timestamp;

    /**
     * 所属人生领域（非空）
     */
    @Singular("domain")
    Set<LifeDomain> domains;

    /**
     * 情感强度 0-1
     */
    double emotionalWeight;

    /**
     * 敏感度 0-1
     */
    double sensitivity;

    /**
     * 重要性 0-1
     */
    double significance;

    @Singular("peopleId")
    List<String> peopleIds;

    @Singular("tag")
    List<String> tags;

    /**
     * 预先摘要后的文本（非原始记录）
     */
    String content;

    @Singular("timelineId")
    List<String> timelineIds;

    @Singular("sourceRef")
    List<String> sourceRefs;

    AtomMetadata metadata;

    /**
     * 元数据缺失时按类型返回空变体
     */
    public AtomMetadata getMetadata() {
        if (metadata != null) {
            return metadata;
        }
        return type != null ? AtomMetadata.empty(type) : null;
    }

    @JsonIgnore
    public boolean isPreserved() {
        AtomMetadata meta = getMetadata();
        return meta != null && meta.isPreserved();
    }

    @JsonIgnore
    public PreservedContentType getPreservedType() {
        AtomMetadata meta = getMetadata();
        return meta != null ? meta.getPreservedType() : null;
    }

    @JsonIgnore
    public double getNarrativeWeight() {
        return significance * emotionalWeight;
    }
}
