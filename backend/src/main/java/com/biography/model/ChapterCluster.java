package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 章节簇：被分到同一章的原子
 *
 * 聚类阶段创建；下游只会补充标题和正文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterCluster {

    private String id;

    @Builder.Default
    private List<NarrativeAtom> atoms = new ArrayList<>();

    @Builder.Default
    private List<String> dominantThemes = new ArrayList<>();

    private TimeSpan timeSpan;

    /**
     * 成员原子的平均重要性
     */
    private double significance;

    private String timelineChapterId;

    private TimelineChapter timelineChapter;

    private String title;

    private String text;

    private boolean voidChapter;

    private String voidPeriodId;
}
