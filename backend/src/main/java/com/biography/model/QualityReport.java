package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 质量报告（仅供参考，不阻断组装）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QualityReport {

    private double overallScore;

    private double temporalAccuracy;

    private double sourceFidelity;

    private double completeness;

    private double conflictAwareness;

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private TemporalCheck temporal;

    private FidelityCheck fidelity;

    private ConflictCheck conflicts;

    private CompletenessCheck completenessCheck;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TemporalCheck {
        private boolean valid;
        private List<String> outOfOrderChapters;
        private double score;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FidelityCheck {
        private double score;
        private List<FidelityMismatch> mismatches;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FidelityMismatch {
        private String chapterId;
        private String generatedText;
        private String sourceAtom;
        private String issue;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConflictCheck {
        private int conflictsFound;
        private List<ConflictFinding> findings;
        private double score;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConflictFinding {
        private String chapterId;
        private List<String> conflictingAtoms;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletenessCheck {
        private double score;
        private List<String> missingImportantAtoms;
        private double coverage;
    }
}
