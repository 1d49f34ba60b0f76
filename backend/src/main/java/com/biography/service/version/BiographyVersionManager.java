package com.biography.service.version;

import com.biography.common.BiographyNotFoundException;
import com.biography.enums.BuildFlag;
import com.biography.model.Biography;
import com.biography.model.BiographyChapter;
import com.biography.model.BiographyMetadata;
import com.biography.model.BiographySpec;
import com.biography.model.BiographyVersion;
import com.biography.model.TimeSpan;
import com.biography.model.TimelineChapter;
import com.biography.model.VersionComparison;
import com.biography.service.BiographyGenerationEngine;
import com.biography.service.store.BiographyStore;
import com.biography.util.HashUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 传记版本管理：派生版本、版本比较、版本历史
 *
 * 新版本总是重新生成的新传记，通过 baseBiographyId 关联到基础版本，不修改已有传记。
 */
@Service
public class BiographyVersionManager {

    private static final Logger logger = LoggerFactory.getLogger(BiographyVersionManager.class);

    private static final int SUMMARY_LENGTH = 200;

    @Autowired
    private BiographyGenerationEngine generationEngine;

    @Autowired
    private BiographyStore biographyStore;

    /**
     * 以基础传记的规格、新的构建标志重新生成
     *
     * private 版本开启内省；沿用基础版本的记忆快照时间
     */
    public Biography generateVersion(String userId, String baseBiographyId, BuildFlag flag) {
        Biography base = getBiography(baseBiographyId, userId);
        BiographyMetadata baseMetadata = base.getMetadata();
        if (baseMetadata == null || baseMetadata.getSpec() == null) {
            throw new BiographyNotFoundException(baseBiographyId);
        }

        BiographySpec newSpec = baseMetadata.getSpec().toBuilder()
            .version(flag)
            .includeIntrospection(flag == BuildFlag.PRIVATE)
            .build();

        Biography version = generationEngine.generateBiography(userId, newSpec, baseBiographyId,
            baseMetadata.getMemorySnapshotAt());
        linkVersions(baseBiographyId, version.getId());

        logger.info("✅ 已生成派生版本: userId={}, baseId={}, version={}, newId={}",
            userId, baseBiographyId, flag, version.getId());
        return version;
    }

    /**
     * 按时间跨度完全一致匹配章节，比较正文、原子数量和主题
     */
    public VersionComparison compareVersions(String biographyId1, String biographyId2, String userId) {
        Biography first = getBiography(biographyId1, userId);
        Biography second = getBiography(biographyId2, userId);

        return VersionComparison.builder()
            .baseId(biographyId1)
            .versionId(biographyId2)
            .differences(compareChapters(first, second))
            .sharedTimeSpan(sharedTimeSpan(first, second))
            .sharedChapters(toTimelineChapters(first))
            .build();
    }

    /**
     * 指定 lorebook 的版本历史（最新在前）
     */
    public List<BiographyVersion> getVersionHistory(String lorebookName, String userId) {
        List<BiographyVersion> history = new ArrayList<>();
        for (Biography biography : biographyStore.findByLorebookName(lorebookName, userId)) {
            BiographyMetadata metadata = biography.getMetadata();
            Instant generatedAt = metadata != null ? metadata.getGeneratedAt() : null;
            history.add(BiographyVersion.builder()
                .id(biography.getId())
                .version(biography.getVersion() != null ? biography.getVersion() : BuildFlag.MAIN)
                .title(biography.getTitle())
                .generatedAt(generatedAt)
                .memorySnapshotAt(metadata != null && metadata.getMemorySnapshotAt() != null
                    ? metadata.getMemorySnapshotAt() : generatedAt)
                .atomSnapshotHash(metadata != null ? StringUtils.defaultString(metadata.getAtomSnapshotHash()) : "")
                .build());
        }
        return history;
    }

    /**
     * 基础版本及其全部派生版本（生成时间正序）
     */
    public List<Biography> getAllVersions(String baseBiographyId, String userId) {
        Biography base = biographyStore.findById(baseBiographyId, userId).orElse(null);
        if (base == null) {
            return new ArrayList<>();
        }
        List<Biography> versions = biographyStore.findVersionFamily(baseBiographyId, userId);
        if (versions.isEmpty()) {
            List<Biography> onlyBase = new ArrayList<>();
            onlyBase.add(base);
            return onlyBase;
        }
        return versions;
    }

    public void linkVersions(String baseId, String versionId) {
        biographyStore.linkVersions(baseId, versionId);
    }

    /**
     * 章节按开始时间重排，返回新实例
     */
    public Biography preserveChronology(Biography biography) {
        List<BiographyChapter> sorted = new ArrayList<>(biography.getChapters());
        sorted.sort(Comparator.comparing((BiographyChapter chapter) -> chapter.getTimeSpan().getStart()));
        return biography.toBuilder().chapters(sorted).build();
    }

    public String generateAtomSnapshotHash(Collection<String> atomIds) {
        return HashUtils.snapshotHash(atomIds);
    }

    private Biography getBiography(String biographyId, String userId) {
        return biographyStore.findById(biographyId, userId)
            .orElseThrow(() -> new BiographyNotFoundException(biographyId));
    }

    private List<VersionComparison.ChapterDifference> compareChapters(Biography first, Biography second) {
        List<VersionComparison.ChapterDifference> differences = new ArrayList<>();

        for (BiographyChapter chapter : first.getChapters()) {
            BiographyChapter match = null;
            for (BiographyChapter candidate : second.getChapters()) {
                if (sameSpan(chapter.getTimeSpan(), candidate.getTimeSpan())) {
                    match = candidate;
                    break;
                }
            }
            if (match == null) {
                continue;
            }

            List<VersionComparison.Difference> chapterDiffs = new ArrayList<>();

            String text1 = StringUtils.defaultString(chapter.getText());
            String text2 = StringUtils.defaultString(match.getText());
            if (!text1.equals(text2)) {
                chapterDiffs.add(new VersionComparison.Difference(VersionComparison.DifferenceType.CONTENT,
                    "Content length differs by " + Math.abs(text1.length() - text2.length()) + " characters"));
            }

            int atoms1 = chapter.getAtoms() != null ? chapter.getAtoms().size() : 0;
            int atoms2 = match.getAtoms() != null ? match.getAtoms().size() : 0;
            if (atoms1 != atoms2) {
                chapterDiffs.add(new VersionComparison.Difference(VersionComparison.DifferenceType.FILTERING,
                    "Atom count differs: " + atoms1 + " vs " + atoms2));
            }

            if (!Objects.equals(chapter.getThemes(), match.getThemes())) {
                chapterDiffs.add(new VersionComparison.Difference(VersionComparison.DifferenceType.STRUCTURE,
                    "Themes differ between versions"));
            }

            if (!chapterDiffs.isEmpty()) {
                differences.add(new VersionComparison.ChapterDifference(chapter.getId(), chapter.getTitle(), chapterDiffs));
            }
        }
        return differences;
    }

    private boolean sameSpan(TimeSpan a, TimeSpan b) {
        return a != null && b != null
            && Objects.equals(a.getStart(), b.getStart())
            && Objects.equals(a.getEnd(), b.getEnd());
    }

    /**
     * 两个版本全部章节覆盖的最早到最晚时间；都没有章节时为 null
     */
    private TimeSpan sharedTimeSpan(Biography first, Biography second) {
        Instant start = null;
        Instant end = null;
        List<BiographyChapter> all = new ArrayList<>(first.getChapters());
        all.addAll(second.getChapters());
        for (BiographyChapter chapter : all) {
            TimeSpan span = chapter.getTimeSpan();
            if (span == null) {
                continue;
            }
            if (span.getStart() != null && (start == null || span.getStart().isBefore(start))) {
                start = span.getStart();
            }
            if (span.getEnd() != null && (end == null || span.getEnd().isAfter(end))) {
                end = span.getEnd();
            }
        }
        return start != null && end != null ? TimeSpan.of(start, end) : null;
    }

    private List<TimelineChapter> toTimelineChapters(Biography biography) {
        List<TimelineChapter> chapters = new ArrayList<>();
        for (BiographyChapter chapter : biography.getChapters()) {
            chapters.add(TimelineChapter.builder()
                .id(chapter.getId())
                .title(chapter.getTitle())
                .startDate(chapter.getTimeSpan() != null ? chapter.getTimeSpan().getStart() : null)
                .endDate(chapter.getTimeSpan() != null ? chapter.getTimeSpan().getEnd() : null)
                .description(String.join(", ", chapter.getThemes()))
                .summary(StringUtils.left(chapter.getText(), SUMMARY_LENGTH))
                .build());
        }
        return chapters;
    }
}
