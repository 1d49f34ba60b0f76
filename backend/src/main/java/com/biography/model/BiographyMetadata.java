package com.biography.model;

import com.biography.enums.LifeDomain;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 传记元数据：来源追溯、过滤记录、质量报告
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BiographyMetadata {

    private LifeDomain domain;

    private Instant generatedAt;

    private BiographySpec spec;

    private int atomCount;

    @Builder.Default
    private List<String> filtersApplied = new ArrayList<>();

    private boolean coreLorebook;

    private String lorebookName;

    private Integer lorebookVersion;

    /**
     * 每个入选原子的 SHA-256 摘要
     */
    @Builder.Default
    private List<String> atomHashes = new ArrayList<>();

    /**
     * 整个原子集合的快照摘要
     */
    private String atomSnapshotHash;

    /**
     * 读取原子时的时间点
     */
    private Instant memorySnapshotAt;

    @Builder.Default
    private List<TimePeriod> timePeriods = new ArrayList<>();

    private TimelineHierarchy timelineHierarchy;

    @Builder.Default
    private List<VoidPeriod> voidPeriods = new ArrayList<>();

    private int voidCount;

    private QualityReport quality;

    /**
     * 聚类丢弃或章节容量裁剪掉的原子
     */
    @Builder.Default
    private List<String> excludedAtomIds = new ArrayList<>();

    @Builder.Default
    private List<String> crossCuttingThemes = new ArrayList<>();

    private String baseBiographyId;
}
