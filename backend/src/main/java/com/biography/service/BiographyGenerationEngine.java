package com.biography.service;

import com.biography.common.InsufficientDataException;
import com.biography.enums.BiographyScope;
import com.biography.model.Biography;
import com.biography.model.BiographyChapter;
import com.biography.model.BiographyMetadata;
import com.biography.model.BiographySpec;
import com.biography.model.ChapterCluster;
import com.biography.model.ChapterContext;
import com.biography.model.ClusteringResult;
import com.biography.model.NarrativeAtom;
import com.biography.model.NarrativeGraph;
import com.biography.model.PreservedPlacement;
import com.biography.model.QualityReport;
import com.biography.model.TimePeriod;
import com.biography.model.TimeSpan;
import com.biography.model.TimelineHierarchy;
import com.biography.model.VoidPeriod;
import com.biography.service.analysis.QualityValidator;
import com.biography.service.analysis.ThemeAnalyzer;
import com.biography.service.analysis.TimePeriodAnalyzer;
import com.biography.service.cluster.PreservedContentPlacer;
import com.biography.service.cluster.TimelineClusterer;
import com.biography.service.filter.SpecFilter;
import com.biography.service.filter.VersionFilter;
import com.biography.service.graph.NarrativeGraphBuilder;
import com.biography.service.narration.FallbackGenerator;
import com.biography.service.narration.NarrationResult;
import com.biography.service.narration.NarratorCircuitBreaker;
import com.biography.service.narration.NarratorCircuitBreakerRegistry;
import com.biography.service.store.BiographyStore;
import com.biography.service.store.TimelineStore;
import com.biography.service.voids.VoidAwarenessService;
import com.biography.util.DateTimeUtils;
import com.biography.util.HashUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 传记生成引擎
 *
 * 流程：叙事图 -> 规格过滤 -> 版本过滤 -> 空白期检测 -> 聚类 -> 标题/正文 -> 保留内容/时间段 -> 质量校验 -> 保存。
 * 先定结构，再写叙事；单次运行内按章节顺序串行调用文本生成服务。
 */
@Service
public class BiographyGenerationEngine {

    private static final Logger logger = LoggerFactory.getLogger(BiographyGenerationEngine.class);

    static final String DEFAULT_TITLE = "My Life Story";

    @Autowired
    private NarrativeGraphBuilder graphBuilder;

    @Autowired
    private SpecFilter specFilter;

    @Autowired
    private VersionFilter versionFilter;

    @Autowired
    private TimelineStore timelineStore;

    @Autowired
    private VoidAwarenessService voidAwarenessService;

    @Autowired
    private TimelineClusterer timelineClusterer;

    @Autowired
    private FallbackGenerator fallbackGenerator;

    @Autowired
    private NarratorCircuitBreakerRegistry narratorCircuitBreakerRegistry;

    @Autowired
    private PreservedContentPlacer preservedContentPlacer;

    @Autowired
    private TimePeriodAnalyzer timePeriodAnalyzer;

    @Autowired
    private ThemeAnalyzer themeAnalyzer;

    @Autowired
    private QualityValidator qualityValidator;

    @Autowired
    private BiographyStore biographyStore;

    @Autowired
    private Clock clock;

    public Biography generateBiography(String userId, BiographySpec spec) {
        return generateBiography(userId, spec, null, null);
    }

    /**
     * 生成传记
     *
     * @param baseBiographyId  派生版本时的基础传记id，可为 null
     * @param memorySnapshotAt 沿用的记忆快照时间，为 null 时取叙事图的构建时间
     */
    public Biography generateBiography(String userId, BiographySpec spec,
                                       String baseBiographyId, Instant memorySnapshotAt) {
        logger.info("🔍 开始生成传记: userId={}, scope={}, depth={}, version={}",
            userId, spec.getScope(), spec.getDepth(), spec.getVersion());

        // 1. 叙事图（失败直接向上抛出）
        NarrativeGraph graph = graphBuilder.loadOrBuild(userId);

        // 2. 规格过滤 + 版本过滤
        List<NarrativeAtom> ranked = specFilter.filter(graph, spec);
        List<NarrativeAtom> filtered = versionFilter.apply(ranked, spec.getVersion(), spec.getAudience());
        if (filtered.isEmpty()) {
            logger.warn("⚠️ 没有符合规格的原子: userId={}, 图中原子={}, 规格过滤后={}",
                userId, graph.getAtoms().size(), ranked.size());
            throw new InsufficientDataException("没有符合传记规格的原子: userId=" + userId);
        }
        logger.info("✅ 过滤完成: 图中原子={}, 规格过滤后={}, 版本过滤后={}",
            graph.getAtoms().size(), ranked.size(), filtered.size());

        // 3. 时间线层级（缺失时退化为纯聚类）
        TimelineHierarchy hierarchy = loadHierarchy(userId, spec);

        // 4. 空白期 + 聚类
        TimeSpan timelineSpan = spec.getTimeRange() != null ? spec.getTimeRange() : hierarchy.getOverallSpan();
        List<VoidPeriod> voids = voidAwarenessService.detectVoids(filtered, timelineSpan);
        List<ChapterCluster> voidChapters = voidAwarenessService.createVoidChapters(voids);
        ClusteringResult clustering = timelineClusterer.cluster(filtered, hierarchy, spec, voidChapters);
        List<ChapterCluster> clusters = clustering.getChapters();
        int voidChapterCount = countVoidChapters(clusters);

        // 5. 标题与正文
        NarratorCircuitBreaker breaker = narratorCircuitBreakerRegistry.forUser(userId);
        Map<String, VoidPeriod> voidsById = new HashMap<>();
        for (VoidPeriod voidPeriod : voids) {
            voidsById.put(voidPeriod.getId(), voidPeriod);
        }
        Map<String, Boolean> templateFlags = narrateChapters(userId, spec, clusters, voidsById, breaker);

        // 6. 保留内容、时间段、跨章主题
        List<NarrativeAtom> preserved = new ArrayList<>();
        for (NarrativeAtom atom : filtered) {
            if (atom.isPreserved()) {
                preserved.add(atom);
            }
        }
        List<PreservedPlacement> placements = preservedContentPlacer.place(preserved, clusters);
        List<TimePeriod> timePeriods = timePeriodAnalyzer.detectTimePeriods(clusters, hierarchy, voids);
        Map<String, String> periodByChapter = periodByChapter(clusters, timePeriods);
        List<String> crossCuttingThemes = themeAnalyzer.findCrossCuttingThemes(clusters);

        // 7. 组装
        List<BiographyChapter> chapters = new ArrayList<>(clusters.size());
        for (ChapterCluster cluster : clusters) {
            chapters.add(toChapter(cluster, placements, periodByChapter, voidsById,
                Boolean.TRUE.equals(templateFlags.get(cluster.getId()))));
        }

        QualityReport quality = qualityValidator.validate(chapters, filtered);

        BiographyMetadata metadata = BiographyMetadata.builder()
            .domain(spec.getDomain())
            .generatedAt(clock.instant())
            .spec(spec)
            .atomCount(filtered.size())
            .filtersApplied(describeFilters(spec))
            .coreLorebook(spec.isCoreLorebook())
            .lorebookName(spec.getLorebookName())
            .lorebookVersion(spec.getLorebookVersion() != null ? spec.getLorebookVersion() : 1)
            .atomHashes(atomHashes(filtered))
            .atomSnapshotHash(HashUtils.snapshotHash(atomIds(filtered)))
            .memorySnapshotAt(memorySnapshotAt != null ? memorySnapshotAt : graph.getLastUpdated())
            .timePeriods(timePeriods)
            .timelineHierarchy(hierarchy)
            .voidPeriods(voids)
            .voidCount(voidChapterCount)
            .quality(quality)
            .excludedAtomIds(clustering.getExcludedAtomIds())
            .crossCuttingThemes(crossCuttingThemes)
            .baseBiographyId(baseBiographyId)
            .build();

        Biography biography = Biography.builder()
            .id(UUID.randomUUID().toString())
            .title(generateTitle(spec))
            .subtitle(generateSubtitle(spec))
            .version(spec.getVersion())
            .chapters(chapters)
            .metadata(metadata)
            .build();

        // 8. 保存（尽力而为）
        save(userId, biography);

        logger.info("✅ 传记生成完成: id={}, 章节={}, 空白章节={}, 质量分={}", biography.getId(),
            chapters.size(), voidChapterCount, String.format("%.2f", quality.getOverallScore()));
        return biography;
    }

    String generateTitle(BiographySpec spec) {
        if (spec.getScope() == BiographyScope.DOMAIN && spec.getDomain() != null) {
            return spec.getDomain().getBiographyTitle();
        }
        return DEFAULT_TITLE;
    }

    String generateSubtitle(BiographySpec spec) {
        if (spec.getTimeRange() == null) {
            return null;
        }
        return DateTimeUtils.yearOf(spec.getTimeRange().getStart()) + " - "
            + DateTimeUtils.yearOf(spec.getTimeRange().getEnd());
    }

    private TimelineHierarchy loadHierarchy(String userId, BiographySpec spec) {
        try {
            TimelineHierarchy hierarchy = timelineStore.getHierarchy(userId, spec);
            return hierarchy != null ? hierarchy : TimelineHierarchy.empty();
        } catch (RuntimeException e) {
            logger.warn("⚠️ 读取时间线层级失败，改用纯聚类: userId={}, error={}", userId, e.getMessage());
            return TimelineHierarchy.empty();
        }
    }

    /**
     * 为每个章节生成标题和正文，返回 章节id -> 是否使用了模板
     */
    private Map<String, Boolean> narrateChapters(String userId, BiographySpec spec, List<ChapterCluster> clusters,
                                                 Map<String, VoidPeriod> voidsById, NarratorCircuitBreaker breaker) {
        Map<String, Boolean> templateFlags = new HashMap<>();
        for (int i = 0; i < clusters.size(); i++) {
            ChapterCluster cluster = clusters.get(i);
            int chapterNumber = i + 1;

            if (cluster.isVoidChapter()) {
                VoidPeriod voidPeriod = voidsById.get(cluster.getVoidPeriodId());
                cluster.setText(voidPeriod != null ? voidAwarenessService.describeVoid(voidPeriod) : "");
                templateFlags.put(cluster.getId(), false);
                continue;
            }

            boolean template = false;
            if (cluster.getTimelineChapter() != null && StringUtils.isNotBlank(cluster.getTimelineChapter().getTitle())) {
                cluster.setTitle(cluster.getTimelineChapter().getTitle());
            } else {
                NarrationResult title = fallbackGenerator.generate(
                    buildContext(userId, spec, cluster, chapterNumber, ChapterContext.Purpose.TITLE), breaker);
                cluster.setTitle(cleanTitle(title.getText(), chapterNumber));
                template = title.isTemplateGenerated();
            }

            NarrationResult narrative = fallbackGenerator.generate(
                buildContext(userId, spec, cluster, chapterNumber, ChapterContext.Purpose.NARRATIVE), breaker);
            cluster.setText(narrative.getText());
            templateFlags.put(cluster.getId(), template || narrative.isTemplateGenerated());
        }
        return templateFlags;
    }

    private ChapterContext buildContext(String userId, BiographySpec spec, ChapterCluster cluster,
                                        int chapterNumber, ChapterContext.Purpose purpose) {
        return ChapterContext.builder()
            .purpose(purpose)
            .userId(userId)
            .chapterId(cluster.getId())
            .chapterNumber(chapterNumber)
            .title(cluster.getTitle())
            .atoms(cluster.getAtoms())
            .themes(cluster.getDominantThemes())
            .timeSpan(cluster.getTimeSpan())
            .tone(spec.getTone())
            .audience(spec.getAudience())
            .depth(spec.getDepth())
            .includeIntrospection(spec.isIncludeIntrospection())
            .build();
    }

    /**
     * 去掉模型常带的引号；为空时退回 "Chapter N"
     */
    private String cleanTitle(String raw, int chapterNumber) {
        String title = StringUtils.strip(StringUtils.trimToEmpty(raw), "\"'");
        return StringUtils.isNotBlank(title) ? title : "Chapter " + chapterNumber;
    }

    private Map<String, String> periodByChapter(List<ChapterCluster> clusters, List<TimePeriod> periods) {
        Map<String, String> result = new HashMap<>();
        Map<String, List<ChapterCluster>> grouped = timePeriodAnalyzer.groupChaptersByPeriod(clusters, periods);
        for (Map.Entry<String, List<ChapterCluster>> entry : grouped.entrySet()) {
            if (TimePeriodAnalyzer.UNASSIGNED.equals(entry.getKey())) {
                continue;
            }
            for (ChapterCluster cluster : entry.getValue()) {
                result.put(cluster.getId(), entry.getKey());
            }
        }
        return result;
    }

    private BiographyChapter toChapter(ChapterCluster cluster, List<PreservedPlacement> placements,
                                       Map<String, String> periodByChapter, Map<String, VoidPeriod> voidsById,
                                       boolean templateGenerated) {
        List<PreservedPlacement> chapterPlacements = new ArrayList<>();
        for (PreservedPlacement placement : placements) {
            if (cluster.getId().equals(placement.getChapterId())) {
                chapterPlacements.add(placement);
            }
        }

        BiographyChapter.BiographyChapterBuilder builder = BiographyChapter.builder()
            .id(cluster.getId())
            .title(cluster.getTitle())
            .text(cluster.getText())
            .timeSpan(cluster.getTimeSpan())
            .timelineChapterIds(cluster.getTimelineChapterId() != null
                ? new ArrayList<>(Collections.singletonList(cluster.getTimelineChapterId()))
                : new ArrayList<>())
            .atoms(new ArrayList<>(cluster.getAtoms()))
            .themes(new ArrayList<>(cluster.getDominantThemes()))
            .preservedContent(chapterPlacements)
            .timePeriodId(periodByChapter.get(cluster.getId()))
            .voidChapter(cluster.isVoidChapter())
            .voidPeriodId(cluster.getVoidPeriodId())
            .templateGenerated(templateGenerated);

        if (cluster.isVoidChapter()) {
            VoidPeriod voidPeriod = voidsById.get(cluster.getVoidPeriodId());
            if (voidPeriod != null) {
                builder.voidMetadata(new BiographyChapter.VoidMetadata(voidPeriod.getDurationDays(),
                    voidPeriod.getType(), voidAwarenessService.generateVoidPrompts(voidPeriod)));
            }
        }
        return builder.build();
    }

    private List<String> describeFilters(BiographySpec spec) {
        List<String> filters = new ArrayList<>(versionFilter.describeFilters(spec.getVersion()));
        filters.addAll(specFilter.describeActiveFilters(spec));
        return filters;
    }

    private int countVoidChapters(List<ChapterCluster> clusters) {
        int count = 0;
        for (ChapterCluster cluster : clusters) {
            if (cluster.isVoidChapter()) {
                count++;
            }
        }
        return count;
    }

    private List<String> atomIds(List<NarrativeAtom> atoms) {
        List<String> ids = new ArrayList<>(atoms.size());
        for (NarrativeAtom atom : atoms) {
            ids.add(atom.getId());
        }
        return ids;
    }

    private List<String> atomHashes(List<NarrativeAtom> atoms) {
        List<String> hashes = new ArrayList<>(atoms.size());
        for (NarrativeAtom atom : atoms) {
            hashes.add(HashUtils.sha256Hex(atom.getId()));
        }
        return hashes;
    }

    private void save(String userId, Biography biography) {
        try {
            biographyStore.save(userId, biography);
        } catch (RuntimeException e) {
            logger.error("❌ 保存传记失败，仍返回生成结果: userId={}, id={}", userId, biography.getId(), e);
        }
    }
}
