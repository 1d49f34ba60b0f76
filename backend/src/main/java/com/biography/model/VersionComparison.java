package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 两个传记版本的比较结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionComparison {

    private String baseId;

    private String versionId;

    @Builder.Default
    private List<ChapterDifference> differences = new ArrayList<>();

    private TimeSpan sharedTimeSpan;

    @Builder.Default
    private List<TimelineChapter> sharedChapters = new ArrayList<>();

    public enum DifferenceType {
        CONTENT,
        FILTERING,
        STRUCTURE
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChapterDifference {
        private String chapterId;
        private String chapterTitle;
        private List<Difference> differences;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Difference {
        private DifferenceType type;
        private String description;
    }
}
