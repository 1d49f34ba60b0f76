package com.biography.service;

import com.biography.common.InsufficientDataException;
import com.biography.config.FallbackPolicyConfig;
import com.biography.config.GraphCacheConfig;
import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyScope;
import com.biography.enums.LifeDomain;
import com.biography.enums.VoidSignificance;
import com.biography.enums.VoidType;
import com.biography.model.Biography;
import com.biography.model.BiographyChapter;
import com.biography.model.BiographyMetadata;
import com.biography.model.BiographySpec;
import com.biography.model.ChapterContext;
import com.biography.model.NarrativeAtom;
import com.biography.model.TimeSpan;
import com.biography.model.TimelineChapter;
import com.biography.model.TimelineHierarchy;
import com.biography.service.analysis.QualityValidator;
import com.biography.service.analysis.ThemeAnalyzer;
import com.biography.service.analysis.TimePeriodAnalyzer;
import com.biography.service.cluster.AtomPrioritizer;
import com.biography.service.cluster.PreservedContentPlacer;
import com.biography.service.cluster.TimelineClusterer;
import com.biography.service.filter.SpecFilter;
import com.biography.service.filter.VersionFilter;
import com.biography.service.graph.NarrativeGraphBuilder;
import com.biography.service.narration.BackoffSleeper;
import com.biography.service.narration.ChapterNarrator;
import com.biography.service.narration.FallbackGenerator;
import com.biography.service.narration.NarratorCircuitBreakerRegistry;
import com.biography.service.narration.TemplateNarrator;
import com.biography.service.performance.NarrativeGraphCache;
import com.biography.service.store.AtomStore;
import com.biography.service.store.BiographyStore;
import com.biography.service.store.TimelineStore;
import com.biography.service.voids.VoidAwarenessService;
import com.biography.support.AtomFixtures;
import com.biography.support.MutableClock;
import com.biography.util.HashUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BiographyGenerationEngineTest {

    private static final String USER_ID = "user-1";

    @Mock
    private AtomStore atomStore;

    @Mock
    private TimelineStore timelineStore;

    @Mock
    private BiographyStore biographyStore;

    private BiographyGenerationEngine engine;
    private FallbackGenerator fallbackGenerator;
    private MutableClock clock;

    private final List<ChapterContext> narratorCalls = new ArrayList<>();

    private final ChapterNarrator recordingNarrator = context -> {
        narratorCalls.add(context);
        if (context.getPurpose() == ChapterContext.Purpose.TITLE) {
            return "\"Winter Training\"";
        }
        return "Narrative for " + context.getChapterId() + " in 2025";
    };

    private final BiographySpec summarySpec = BiographySpec.builder()
        .scope(BiographyScope.FULL_LIFE)
        .depth(BiographyDepth.SUMMARY)
        .build();

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-06-01T00:00:00Z");

        GraphCacheConfig cacheConfig = new GraphCacheConfig();
        ReflectionTestUtils.setField(cacheConfig, "cacheTtlHours", 24L);
        NarrativeGraphCache cache = new NarrativeGraphCache();
        ReflectionTestUtils.setField(cache, "graphCacheConfig", cacheConfig);
        ReflectionTestUtils.setField(cache, "clock", clock);
        NarrativeGraphBuilder graphBuilder = new NarrativeGraphBuilder();
        ReflectionTestUtils.setField(graphBuilder, "atomStore", atomStore);
        ReflectionTestUtils.setField(graphBuilder, "graphCache", cache);
        ReflectionTestUtils.setField(graphBuilder, "clock", clock);

        ThemeAnalyzer themeAnalyzer = new ThemeAnalyzer();

        VoidAwarenessService voidAwarenessService = new VoidAwarenessService();
        ReflectionTestUtils.setField(voidAwarenessService, "themeAnalyzer", themeAnalyzer);

        TimelineClusterer clusterer = new TimelineClusterer();
        ReflectionTestUtils.setField(clusterer, "atomPrioritizer", new AtomPrioritizer());
        ReflectionTestUtils.setField(clusterer, "themeAnalyzer", themeAnalyzer);
        ReflectionTestUtils.setField(clusterer, "clock", clock);

        FallbackPolicyConfig policyConfig = new FallbackPolicyConfig();
        ReflectionTestUtils.setField(policyConfig, "maxRetries", 3);
        ReflectionTestUtils.setField(policyConfig, "baseBackoffMs", 1000L);
        ReflectionTestUtils.setField(policyConfig, "maxBackoffMs", 30000L);
        fallbackGenerator = new FallbackGenerator();
        ReflectionTestUtils.setField(fallbackGenerator, "chapterNarrator", recordingNarrator);
        ReflectionTestUtils.setField(fallbackGenerator, "templateNarrator", new TemplateNarrator());
        ReflectionTestUtils.setField(fallbackGenerator, "backoffSleeper", (BackoffSleeper) millis -> { });
        ReflectionTestUtils.setField(fallbackGenerator, "policyConfig", policyConfig);

        TimePeriodAnalyzer timePeriodAnalyzer = new TimePeriodAnalyzer();
        ReflectionTestUtils.setField(timePeriodAnalyzer, "clock", clock);

        engine = new BiographyGenerationEngine();
        ReflectionTestUtils.setField(engine, "graphBuilder", graphBuilder);
        ReflectionTestUtils.setField(engine, "specFilter", new SpecFilter());
        ReflectionTestUtils.setField(engine, "versionFilter", new VersionFilter());
        ReflectionTestUtils.setField(engine, "timelineStore", timelineStore);
        ReflectionTestUtils.setField(engine, "voidAwarenessService", voidAwarenessService);
        ReflectionTestUtils.setField(engine, "timelineClusterer", clusterer);
        ReflectionTestUtils.setField(engine, "fallbackGenerator", fallbackGenerator);
        ReflectionTestUtils.setField(engine, "narratorCircuitBreakerRegistry",
            new NarratorCircuitBreakerRegistry(NarratorCircuitBreakerRegistry.Scope.GLOBAL, 5, 300000L, clock));
        ReflectionTestUtils.setField(engine, "preservedContentPlacer", new PreservedContentPlacer());
        ReflectionTestUtils.setField(engine, "timePeriodAnalyzer", timePeriodAnalyzer);
        ReflectionTestUtils.setField(engine, "themeAnalyzer", themeAnalyzer);
        ReflectionTestUtils.setField(engine, "qualityValidator", new QualityValidator());
        ReflectionTestUtils.setField(engine, "biographyStore", biographyStore);
        ReflectionTestUtils.setField(engine, "clock", clock);
    }

    /**
     * 1月连续15天 + 3月连续10天，中间隔了45天
     */
    private static List<NarrativeAtom> winterAndSpring() {
        List<NarrativeAtom> atoms = new ArrayList<>(AtomFixtures.daily("jan", "2025-01-01", 15));
        atoms.addAll(AtomFixtures.daily("mar", "2025-03-01", 10));
        return atoms;
    }

    private static List<String> chapterIds(Biography biography) {
        List<String> ids = new ArrayList<>();
        for (BiographyChapter chapter : biography.getChapters()) {
            ids.add(chapter.getId());
        }
        return ids;
    }

    private int countCalls(ChapterContext.Purpose purpose) {
        int count = 0;
        for (ChapterContext call : narratorCalls) {
            if (call.getPurpose() == purpose) {
                count++;
            }
        }
        return count;
    }

    // ========== PIPELINE TESTS ==========

    @Test
    @DisplayName("完整流程：按深度截断、检测空白期并插入空白章节")
    void compilesChaptersAndVoidChapter() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        assertNotNull(biography.getId());
        assertEquals("My Life Story", biography.getTitle());
        assertNull(biography.getSubtitle());
        assertEquals(Arrays.asList("cluster-0", "void-chapter-void-14-15", "cluster-1"), chapterIds(biography));

        BiographyChapter winter = biography.getChapters().get(0);
        assertEquals(15, winter.getAtoms().size());
        assertEquals("Winter Training", winter.getTitle());
        assertEquals("Narrative for cluster-0 in 2025", winter.getText());
        assertFalse(winter.isTemplateGenerated());
        assertEquals(Collections.singletonList("personal"), winter.getThemes());

        BiographyChapter gap = biography.getChapters().get(1);
        assertTrue(gap.isVoidChapter());
        assertTrue(gap.getAtoms().isEmpty());
        assertEquals("The Missing Months: Jan 2025 - Mar 2025", gap.getTitle());
        assertTrue(gap.getText().startsWith("There are no records from 2025-01-15 to 2025-03-01, a span of 45 days."));
        assertEquals(45, gap.getVoidMetadata().getDurationDays());
        assertEquals(VoidType.MEDIUM_GAP, gap.getVoidMetadata().getType());
        // 位于原子序列后段（14/20），不提升重要度
        assertEquals(VoidSignificance.MEDIUM, biography.getMetadata().getVoidPeriods().get(0).getSignificance());
        assertFalse(gap.getVoidMetadata().getPrompts().isEmpty());

        BiographyChapter spring = biography.getChapters().get(2);
        assertEquals(AtomFixtures.ids(AtomFixtures.daily("mar", "2025-03-01", 5)), AtomFixtures.ids(spring.getAtoms()));

        // 空白章节不调用生成服务
        assertEquals(2, countCalls(ChapterContext.Purpose.TITLE));
        assertEquals(2, countCalls(ChapterContext.Purpose.NARRATIVE));
    }

    @Test
    @DisplayName("元数据记录原子数、过滤器、摘要与记忆快照时间")
    void recordsProvenanceMetadata() {
        Instant buildTime = clock.instant();
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        BiographyMetadata metadata = biography.getMetadata();
        assertEquals(20, metadata.getAtomCount());
        assertEquals(1, metadata.getVoidCount());
        assertEquals(1, metadata.getVoidPeriods().size());
        assertTrue(metadata.getExcludedAtomIds().isEmpty());
        assertEquals(Collections.singletonList("extreme-sensitivity-filter"), metadata.getFiltersApplied());
        assertEquals(Integer.valueOf(1), metadata.getLorebookVersion());
        assertEquals(buildTime, metadata.getMemorySnapshotAt());
        assertEquals(summarySpec, metadata.getSpec());
        assertNull(metadata.getBaseBiographyId());

        assertEquals(20, metadata.getAtomHashes().size());
        assertTrue(metadata.getAtomHashes().contains(HashUtils.sha256Hex("jan-1")));
        assertFalse(metadata.getAtomHashes().contains(HashUtils.sha256Hex("mar-6")));

        List<String> includedIds = new ArrayList<>(AtomFixtures.ids(AtomFixtures.daily("jan", "2025-01-01", 15)));
        includedIds.addAll(AtomFixtures.ids(AtomFixtures.daily("mar", "2025-03-01", 5)));
        assertEquals(HashUtils.snapshotHash(includedIds), metadata.getAtomSnapshotHash());

        assertNotNull(metadata.getQuality());
        assertEquals(1, metadata.getTimePeriods().size());
        String periodId = metadata.getTimePeriods().get(0).getId();
        for (BiographyChapter chapter : biography.getChapters()) {
            assertEquals(periodId, chapter.getTimePeriodId());
        }
    }

    @Test
    @DisplayName("相同输入两次生成的结构一致")
    void sameInputProducesSameStructure() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());

        Biography first = engine.generateBiography(USER_ID, summarySpec);
        Biography second = engine.generateBiography(USER_ID, summarySpec);

        assertNotEquals(first.getId(), second.getId());
        assertEquals(chapterIds(first), chapterIds(second));
        for (int i = 0; i < first.getChapters().size(); i++) {
            assertEquals(AtomFixtures.ids(first.getChapters().get(i).getAtoms()),
                AtomFixtures.ids(second.getChapters().get(i).getAtoms()));
        }
        assertEquals(first.getMetadata().getAtomSnapshotHash(), second.getMetadata().getAtomSnapshotHash());
    }

    @Test
    @DisplayName("生成结果被保存")
    void savesGeneratedBiography() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        ArgumentCaptor<Biography> captor = ArgumentCaptor.forClass(Biography.class);
        verify(biographyStore).save(eq(USER_ID), captor.capture());
        assertEquals(biography.getId(), captor.getValue().getId());
    }

    @Test
    @DisplayName("领域范围使用领域标题，时间范围生成副标题")
    void domainTitleAndYearSubtitle() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());
        BiographySpec spec = BiographySpec.builder()
            .scope(BiographyScope.DOMAIN)
            .domain(LifeDomain.PERSONAL)
            .timeRange(TimeSpan.of(AtomFixtures.day("2025-01-01"), AtomFixtures.day("2025-12-31")))
            .depth(BiographyDepth.SUMMARY)
            .build();

        Biography biography = engine.generateBiography(USER_ID, spec);

        assertEquals(LifeDomain.PERSONAL.getBiographyTitle(), biography.getTitle());
        assertEquals("2025 - 2025", biography.getSubtitle());
        assertEquals(LifeDomain.PERSONAL, biography.getMetadata().getDomain());
        assertTrue(biography.getMetadata().getFiltersApplied().contains("domain-filter"));
        assertTrue(biography.getMetadata().getFiltersApplied().contains("time-range-filter"));
    }

    @Test
    @DisplayName("相隔正好30天的两个原子：空白期只记录在元数据中，不与章节重叠成章")
    void thirtyDayGapIsNarratedByItsChapter() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(Arrays.asList(
            AtomFixtures.simple("a", "2025-01-01"),
            AtomFixtures.simple("b", "2025-01-31")));

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        assertEquals(Collections.singletonList("cluster-0"), chapterIds(biography));
        assertEquals(Arrays.asList("a", "b"), AtomFixtures.ids(biography.getChapters().get(0).getAtoms()));
        assertEquals(0, biography.getMetadata().getVoidCount());
        assertEquals(1, biography.getMetadata().getVoidPeriods().size());
        assertEquals(30, biography.getMetadata().getVoidPeriods().get(0).getDurationDays());
        assertEquals(VoidSignificance.HIGH, biography.getMetadata().getVoidPeriods().get(0).getSignificance());
        assertTrue(biography.getMetadata().getQuality().getTemporal().isValid());
    }

    // ========== TIMELINE TESTS ==========

    @Test
    @DisplayName("时间线章节自带标题时不再请求生成标题")
    void usesTimelineChapterTitle() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());
        TimelineChapter january = TimelineChapter.builder()
            .id("tl-jan")
            .title("Winter Camp")
            .startDate(AtomFixtures.day("2025-01-01"))
            .endDate(AtomFixtures.day("2025-01-31"))
            .build();
        TimelineHierarchy.Arc arc = TimelineHierarchy.Arc.builder()
            .id("arc-1")
            .chapters(new ArrayList<>(Collections.singletonList(january)))
            .build();
        TimelineHierarchy.Saga saga = TimelineHierarchy.Saga.builder()
            .id("saga-1")
            .title("First Season")
            .startDate(AtomFixtures.day("2025-01-01"))
            .endDate(AtomFixtures.day("2025-03-31"))
            .arcs(new ArrayList<>(Collections.singletonList(arc)))
            .build();
        BiographySpec spec = BiographySpec.builder()
            .scope(BiographyScope.FULL_LIFE)
            .depth(BiographyDepth.DETAILED)
            .build();
        when(timelineStore.getHierarchy(USER_ID, spec))
            .thenReturn(new TimelineHierarchy(new ArrayList<>(Collections.singletonList(saga))));

        Biography biography = engine.generateBiography(USER_ID, spec);

        BiographyChapter winter = biography.getChapters().get(0);
        assertEquals("Winter Camp", winter.getTitle());
        assertEquals(Collections.singletonList("tl-jan"), winter.getTimelineChapterIds());
        assertEquals(15, winter.getAtoms().size());
        assertEquals(1, countCalls(ChapterContext.Purpose.TITLE));
        assertEquals(2, countCalls(ChapterContext.Purpose.NARRATIVE));

        // 3月10日到时间线结束的21天空白重要度低，不生成章节
        assertEquals(2, biography.getMetadata().getVoidPeriods().size());
        assertEquals(1, biography.getMetadata().getVoidCount());
        assertEquals("period-saga-1", winter.getTimePeriodId());
    }

    @Test
    @DisplayName("读取时间线失败时退回纯聚类")
    void timelineFailureFallsBackToClustering() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());
        when(timelineStore.getHierarchy(eq(USER_ID), any(BiographySpec.class)))
            .thenThrow(new IllegalStateException("timeline offline"));

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        assertEquals(Arrays.asList("cluster-0", "void-chapter-void-14-15", "cluster-1"), chapterIds(biography));
        assertTrue(biography.getMetadata().getTimelineHierarchy().isEmpty());
    }

    // ========== FAILURE TESTS ==========

    @Test
    @DisplayName("没有可用原子时抛出数据不足异常且不保存")
    void throwsWhenNothingSurvivesFiltering() {
        List<NarrativeAtom> secrets = Arrays.asList(
            AtomFixtures.atom("s-1", "2025-01-01").sensitivity(0.95).build(),
            AtomFixtures.atom("s-2", "2025-01-02").sensitivity(0.99).build());
        when(atomStore.getAtoms(USER_ID)).thenReturn(secrets);

        assertThrows(InsufficientDataException.class, () -> engine.generateBiography(USER_ID, summarySpec));
        verify(biographyStore, never()).save(anyString(), any(Biography.class));
    }

    @Test
    @DisplayName("保存失败不影响返回结果")
    void saveFailureIsNotFatal() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());
        doThrow(new IllegalStateException("db down")).when(biographyStore).save(anyString(), any(Biography.class));

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        assertEquals(3, biography.getChapters().size());
    }

    @Test
    @DisplayName("生成服务不可用时用模板兜底，标题为 Chapter N")
    void narratorFailureFallsBackToTemplates() {
        when(atomStore.getAtoms(USER_ID)).thenReturn(winterAndSpring());
        ReflectionTestUtils.setField(fallbackGenerator, "chapterNarrator",
            (ChapterNarrator) context -> {
                throw new IllegalStateException("model unavailable");
            });

        Biography biography = engine.generateBiography(USER_ID, summarySpec);

        BiographyChapter winter = biography.getChapters().get(0);
        BiographyChapter spring = biography.getChapters().get(2);
        assertEquals("Chapter 1", winter.getTitle());
        assertEquals("Chapter 3", spring.getTitle());
        assertTrue(winter.isTemplateGenerated());
        assertTrue(spring.isTemplateGenerated());
        assertFalse(winter.getText().isEmpty());
        assertFalse(biography.getChapters().get(1).isTemplateGenerated());

        List<String> atomIds = new ArrayList<>();
        for (BiographyChapter chapter : biography.getChapters()) {
            atomIds.addAll(AtomFixtures.ids(chapter.getAtoms()));
        }
        assertEquals(20, new HashSet<>(atomIds).size());
    }
}
