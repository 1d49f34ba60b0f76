package com.biography.model;

import com.biography.enums.VoidType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 传记最终章节
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BiographyChapter {

    private String id;

    private String title;

    private String text;

    private TimeSpan timeSpan;

    @Builder.Default
    private List<String> timelineChapterIds = new ArrayList<>();

    @Builder.Default
    private List<NarrativeAtom> atoms = new ArrayList<>();

    @Builder.Default
    private List<String> themes = new ArrayList<>();

    @Builder.Default
    private List<PreservedPlacement> preservedContent = new ArrayList<>();

    private String timePeriodId;

    private boolean voidChapter;

    private String voidPeriodId;

    private VoidMetadata voidMetadata;

    /**
     * 正文是否来自模板兜底
     */
    private boolean templateGenerated;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class VoidMetadata {
        private long durationDays;
        private VoidType type;
        private List<String> prompts;
    }
}
