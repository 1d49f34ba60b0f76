package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 篇幅估算
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookCapacityEstimate {

    private int availableAtoms;

    private Range estimatedPages;

    private Range estimatedChapters;

    private int estimatedWordCount;

    private boolean canGenerate;

    private String reason;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    private Progress progressToTarget;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Range {
        private int minimum;
        private int recommended;
        private int maximum;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Progress {
        private int targetPages;
        private double currentProgress;
        private int neededEntries;
        private int neededAtoms;
    }
}
