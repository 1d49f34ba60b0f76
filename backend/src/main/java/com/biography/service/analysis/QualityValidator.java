package com.biography.service.analysis;

import com.biography.enums.LifeDomain;
import com.biography.model.BiographyChapter;
import com.biography.model.NarrativeAtom;
import com.biography.model.QualityReport;
import com.biography.util.DateTimeUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 质量校验：时间一致性、来源忠实度、完整性、冲突检测
 *
 * 结果只作为元数据附在传记上，从不阻断组装。
 */
@Component
public class QualityValidator {

    private static final Logger logger = LoggerFactory.getLogger(QualityValidator.class);

    private static final double TEMPORAL_WEIGHT = 0.25;
    private static final double FIDELITY_WEIGHT = 0.35;
    private static final double COMPLETENESS_WEIGHT = 0.25;
    private static final double CONFLICT_WEIGHT = 0.15;

    private static final double FIDELITY_THRESHOLD = 0.7;
    private static final double COVERAGE_THRESHOLD = 0.8;
    private static final double IMPORTANT_ATOM_THRESHOLD = 0.7;
    private static final int CONTENT_FRAGMENT_LENGTH = 50;
    private static final int CONFLICT_WINDOW_DAYS = 30;

    public QualityReport validate(List<BiographyChapter> chapters, List<NarrativeAtom> sourceAtoms) {
        QualityReport.TemporalCheck temporal = checkTemporalConsistency(chapters);
        QualityReport.FidelityCheck fidelity = checkSourceFidelity(chapters, sourceAtoms);
        QualityReport.CompletenessCheck completeness = checkCompleteness(chapters, sourceAtoms);
        QualityReport.ConflictCheck conflicts = detectConflicts(chapters, sourceAtoms);

        double overall = temporal.getScore() * TEMPORAL_WEIGHT
            + fidelity.getScore() * FIDELITY_WEIGHT
            + completeness.getScore() * COMPLETENESS_WEIGHT
            + conflicts.getScore() * CONFLICT_WEIGHT;

        List<String> warnings = new ArrayList<>();
        if (!temporal.isValid()) {
            warnings.add("Temporal inconsistencies detected: " + temporal.getOutOfOrderChapters().size()
                + " chapters out of order");
        }
        if (fidelity.getScore() < FIDELITY_THRESHOLD) {
            warnings.add("Source fidelity below threshold: " + percent(fidelity.getScore()) + "%");
        }
        if (completeness.getCoverage() < COVERAGE_THRESHOLD) {
            warnings.add("Completeness below threshold: " + percent(completeness.getCoverage())
                + "% of important atoms included");
        }
        if (conflicts.getConflictsFound() > 0) {
            warnings.add(conflicts.getConflictsFound() + " conflicting memories detected");
        }

        if (!warnings.isEmpty()) {
            logger.warn("⚠️ 传记质量提示: score={}, warnings={}", String.format(Locale.ROOT, "%.2f", overall), warnings);
        }

        return QualityReport.builder()
            .overallScore(overall)
            .temporalAccuracy(temporal.getScore())
            .sourceFidelity(fidelity.getScore())
            .completeness(completeness.getScore())
            .conflictAwareness(conflicts.getScore())
            .warnings(warnings)
            .temporal(temporal)
            .fidelity(fidelity)
            .conflicts(conflicts)
            .completenessCheck(completeness)
            .build();
    }

    /**
     * 相邻章节允许最多1天的重叠，超过即视为顺序错乱
     */
    public QualityReport.TemporalCheck checkTemporalConsistency(List<BiographyChapter> chapters) {
        List<String> outOfOrder = new ArrayList<>();
        for (int i = 0; i < chapters.size() - 1; i++) {
            long currentEnd = chapters.get(i).getTimeSpan().getEnd().toEpochMilli();
            long nextStart = chapters.get(i + 1).getTimeSpan().getStart().toEpochMilli();
            if (nextStart < currentEnd - DateTimeUtils.MILLIS_PER_DAY) {
                outOfOrder.add(chapters.get(i + 1).getId());
            }
        }
        double score = outOfOrder.isEmpty() ? 1.0 : Math.max(0.0, 1.0 - (double) outOfOrder.size() / chapters.size());
        return new QualityReport.TemporalCheck(outOfOrder.isEmpty(), outOfOrder, score);
    }

    /**
     * 各章节忠实度的平均值；没有章节时为1
     */
    public QualityReport.FidelityCheck checkSourceFidelity(List<BiographyChapter> chapters,
                                                           List<NarrativeAtom> sourceAtoms) {
        if (chapters.isEmpty()) {
            return new QualityReport.FidelityCheck(1.0, new ArrayList<>());
        }
        double total = 0.0;
        List<QualityReport.FidelityMismatch> mismatches = new ArrayList<>();
        for (BiographyChapter chapter : chapters) {
            total += verifyChapterFidelity(chapter, sourceAtoms, mismatches);
        }
        return new QualityReport.FidelityCheck(total / chapters.size(), mismatches);
    }

    /**
     * 逐个来源原子检查年份、领域或前50个字符是否出现在正文中（忽略大小写）
     */
    double verifyChapterFidelity(BiographyChapter chapter, List<NarrativeAtom> sourceAtoms,
                                 List<QualityReport.FidelityMismatch> mismatches) {
        if (chapter.getAtoms().isEmpty()) {
            return 1.0;
        }

        Set<String> chapterAtomIds = new HashSet<>();
        for (NarrativeAtom atom : chapter.getAtoms()) {
            chapterAtomIds.add(atom.getId());
        }
        List<NarrativeAtom> chapterSources = new ArrayList<>();
        for (NarrativeAtom atom : sourceAtoms) {
            if (chapterAtomIds.contains(atom.getId())) {
                chapterSources.add(atom);
            }
        }

        String text = StringUtils.defaultString(chapter.getText());
        String lowerText = text.toLowerCase(Locale.ROOT);
        String excerpt = StringUtils.left(text, 100);

        if (chapterSources.isEmpty()) {
            mismatches.add(new QualityReport.FidelityMismatch(chapter.getId(), excerpt,
                "No source atoms found", "Chapter has no associated source atoms"));
            return 0.5;
        }

        int matched = 0;
        for (NarrativeAtom atom : chapterSources) {
            String content = StringUtils.left(StringUtils.defaultString(atom.getContent()), 200);
            boolean hasYear = text.contains(String.valueOf(DateTimeUtils.yearOf(atom.getTimestamp())));
            boolean hasDomain = false;
            for (LifeDomain domain : atom.getDomains()) {
                if (lowerText.contains(domain.getCode().toLowerCase(Locale.ROOT))) {
                    hasDomain = true;
                    break;
                }
            }
            boolean hasContent = !content.isEmpty()
                && lowerText.contains(StringUtils.left(content, CONTENT_FRAGMENT_LENGTH).toLowerCase(Locale.ROOT));

            if (hasYear || hasDomain || hasContent) {
                matched++;
            } else {
                mismatches.add(new QualityReport.FidelityMismatch(chapter.getId(), excerpt, content,
                    "Key facts from source atom not found in generated text"));
            }
        }
        return (double) matched / chapterSources.size();
    }

    /**
     * 重要原子（重要性或情感强度 > 0.7）进入任一章节的比例
     */
    public QualityReport.CompletenessCheck checkCompleteness(List<BiographyChapter> chapters,
                                                             List<NarrativeAtom> sourceAtoms) {
        if (sourceAtoms.isEmpty()) {
            return new QualityReport.CompletenessCheck(1.0, new ArrayList<>(), 1.0);
        }

        Set<String> included = new HashSet<>();
        for (BiographyChapter chapter : chapters) {
            for (NarrativeAtom atom : chapter.getAtoms()) {
                included.add(atom.getId());
            }
        }

        int important = 0;
        int covered = 0;
        List<String> missing = new ArrayList<>();
        for (NarrativeAtom atom : sourceAtoms) {
            if (atom.getSignificance() > IMPORTANT_ATOM_THRESHOLD || atom.getEmotionalWeight() > IMPORTANT_ATOM_THRESHOLD) {
                important++;
                if (included.contains(atom.getId())) {
                    covered++;
                } else {
                    missing.add(atom.getId());
                }
            }
        }

        double coverage = important > 0 ? (double) covered / important : 1.0;
        return new QualityReport.CompletenessCheck(coverage, missing, coverage);
    }

    /**
     * 按 (人物, 领域) 分组；同组内有两种以上不同内容且时间跨度小于30天即视为潜在冲突
     */
    public QualityReport.ConflictCheck detectConflicts(List<BiographyChapter> chapters,
                                                       List<NarrativeAtom> sourceAtoms) {
        Map<String, List<NarrativeAtom>> groups = new LinkedHashMap<>();
        for (NarrativeAtom atom : sourceAtoms) {
            groups.computeIfAbsent(groupKey(atom), k -> new ArrayList<>()).add(atom);
        }

        List<QualityReport.ConflictFinding> findings = new ArrayList<>();
        for (List<NarrativeAtom> group : groups.values()) {
            if (group.size() < 2) {
                continue;
            }
            Set<String> contents = new HashSet<>();
            long min = Long.MAX_VALUE;
            long max = Long.MIN_VALUE;
            for (NarrativeAtom atom : group) {
                contents.add(StringUtils.defaultString(atom.getContent()).toLowerCase(Locale.ROOT));
                min = Math.min(min, atom.getTimestamp().toEpochMilli());
                max = Math.max(max, atom.getTimestamp().toEpochMilli());
            }
            if (contents.size() < 2) {
                continue;
            }
            double spanDays = (max - min) / (double) DateTimeUtils.MILLIS_PER_DAY;
            if (spanDays >= CONFLICT_WINDOW_DAYS) {
                continue;
            }

            BiographyChapter chapter = findChapterContaining(chapters, group);
            if (chapter != null) {
                List<String> atomIds = new ArrayList<>();
                for (NarrativeAtom atom : group) {
                    atomIds.add(atom.getId());
                }
                findings.add(new QualityReport.ConflictFinding(chapter.getId(), atomIds,
                    "Conflicting descriptions found for same time period and entities"));
            }
        }

        int total = sourceAtoms.size();
        double score = total > 0 ? Math.max(0.0, 1.0 - findings.size() / Math.max(1.0, total / 10.0)) : 1.0;
        return new QualityReport.ConflictCheck(findings.size(), findings, score);
    }

    private static String groupKey(NarrativeAtom atom) {
        String people = atom.getPeopleIds().isEmpty() ? "none" : String.join(",", atom.getPeopleIds());
        Set<String> domains = new TreeSet<>();
        for (LifeDomain domain : atom.getDomains()) {
            domains.add(domain.getCode());
        }
        return people + "-" + String.join(",", domains);
    }

    private static BiographyChapter findChapterContaining(List<BiographyChapter> chapters, List<NarrativeAtom> group) {
        Set<String> ids = new HashSet<>();
        for (NarrativeAtom atom : group) {
            ids.add(atom.getId());
        }
        for (BiographyChapter chapter : chapters) {
            for (NarrativeAtom atom : chapter.getAtoms()) {
                if (ids.contains(atom.getId())) {
                    return chapter;
                }
            }
        }
        return null;
    }

    private static String percent(double ratio) {
        return String.valueOf(Math.round(ratio * 100));
    }
}
