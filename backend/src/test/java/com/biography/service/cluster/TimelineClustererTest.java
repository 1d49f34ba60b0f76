package com.biography.service.cluster;

import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyScope;
import com.biography.enums.LifeDomain;
import com.biography.model.BiographySpec;
import com.biography.model.ChapterCluster;
import com.biography.model.ClusteringResult;
import com.biography.model.NarrativeAtom;
import com.biography.model.TimeSpan;
import com.biography.model.TimelineChapter;
import com.biography.model.TimelineHierarchy;
import com.biography.service.analysis.ThemeAnalyzer;
import com.biography.support.AtomFixtures;
import com.biography.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TimelineClustererTest {

    private TimelineClusterer clusterer;

    private final BiographySpec fullLife = BiographySpec.builder()
        .scope(BiographyScope.FULL_LIFE)
        .depth(BiographyDepth.SUMMARY)
        .build();

    @BeforeEach
    void setUp() {
        clusterer = new TimelineClusterer();
        ReflectionTestUtils.setField(clusterer, "atomPrioritizer", new AtomPrioritizer());
        ReflectionTestUtils.setField(clusterer, "themeAnalyzer", new ThemeAnalyzer());
        ReflectionTestUtils.setField(clusterer, "clock", MutableClock.at("2025-12-01T00:00:00Z"));
    }

    private static ChapterCluster chapter(String id, String start, double significance) {
        return ChapterCluster.builder()
            .id(id)
            .timeSpan(TimeSpan.of(AtomFixtures.day(start), AtomFixtures.day(start)))
            .significance(significance)
            .build();
    }

    private static ChapterCluster voidChapter(String id, String start, String end) {
        return ChapterCluster.builder()
            .id(id)
            .timeSpan(TimeSpan.of(AtomFixtures.day(start), AtomFixtures.day(end)))
            .significance(0.3)
            .voidChapter(true)
            .voidPeriodId(id)
            .build();
    }

    private static List<String> chapterIds(List<ChapterCluster> chapters) {
        List<String> ids = new ArrayList<>();
        for (ChapterCluster chapter : chapters) {
            ids.add(chapter.getId());
        }
        return ids;
    }

    private static void assertCoveredExactlyOnce(List<NarrativeAtom> atoms, ClusteringResult result) {
        List<String> seen = new ArrayList<>(result.getExcludedAtomIds());
        for (ChapterCluster chapter : result.getChapters()) {
            seen.addAll(AtomFixtures.ids(chapter.getAtoms()));
        }
        assertEquals(atoms.size(), seen.size());
        assertEquals(new HashSet<>(AtomFixtures.ids(atoms)), new HashSet<>(seen));
    }

    // ========== SEED-ABSORB TESTS ==========

    @Test
    @DisplayName("30天内共享领域的原子归为一章")
    void absorbsNearbyAtomsSharingDomain() {
        List<NarrativeAtom> atoms = new ArrayList<>(AtomFixtures.daily("jan", "2025-01-01", 5));
        atoms.addAll(AtomFixtures.daily("jun", "2025-06-01", 3));

        ClusteringResult result = clusterer.cluster(atoms, TimelineHierarchy.empty(), fullLife, null);

        assertEquals(2, result.getChapters().size());
        assertEquals(5, result.getChapters().get(0).getAtoms().size());
        assertEquals(3, result.getChapters().get(1).getAtoms().size());
        assertEquals(Collections.singletonList("personal"), result.getChapters().get(0).getDominantThemes());
        assertTrue(result.getExcludedAtomIds().isEmpty());
    }

    @Test
    @DisplayName("种子原子涉及人物时，不同领域的邻近原子也被吸收")
    void seedWithPeopleAbsorbsAcrossDomains() {
        List<NarrativeAtom> withPeople = Arrays.asList(
            AtomFixtures.atom("seed", "2025-01-01").clearDomains().domain(LifeDomain.FIGHTING).peopleId("coach").build(),
            AtomFixtures.atom("other", "2025-01-10").clearDomains().domain(LifeDomain.ROBOTICS).build());

        ClusteringResult absorbed = clusterer.cluster(withPeople, TimelineHierarchy.empty(), fullLife, null);
        assertEquals(1, absorbed.getChapters().size());
        assertEquals(2, absorbed.getChapters().get(0).getAtoms().size());

        List<NarrativeAtom> withoutPeople = Arrays.asList(
            AtomFixtures.atom("seed", "2025-01-01").clearDomains().domain(LifeDomain.ROBOTICS).build(),
            AtomFixtures.atom("other", "2025-01-10").clearDomains().domain(LifeDomain.FIGHTING).peopleId("coach").build());

        ClusteringResult separate = clusterer.cluster(withoutPeople, TimelineHierarchy.empty(), fullLife, null);
        assertTrue(separate.getChapters().isEmpty());
        assertEquals(Arrays.asList("seed", "other"), separate.getExcludedAtomIds());
    }

    @Test
    @DisplayName("单原子簇只有重要性高于0.7时保留")
    void singletonsKeptOnlyWhenSignificant() {
        List<NarrativeAtom> atoms = new ArrayList<>(AtomFixtures.daily("jan", "2025-01-01", 5));
        atoms.add(AtomFixtures.atom("lonely", "2025-03-01").significance(0.7).build());
        atoms.add(AtomFixtures.atom("landmark", "2025-06-01").significance(0.8).build());

        ClusteringResult result = clusterer.cluster(atoms, TimelineHierarchy.empty(), fullLife, null);

        assertEquals(Arrays.asList("cluster-0", "cluster-1"), chapterIds(result.getChapters()));
        assertEquals(Collections.singletonList("landmark"), AtomFixtures.ids(result.getChapters().get(1).getAtoms()));
        assertEquals(Collections.singletonList("lonely"), result.getExcludedAtomIds());
        assertCoveredExactlyOnce(atoms, result);
    }

    // ========== TIMELINE CHAPTER TESTS ==========

    @Test
    @DisplayName("时间线章节认领范围内原子，超出容量的被裁剪并记入排除列表")
    void timelineChapterClaimsAndTrims() {
        TimelineChapter january = TimelineChapter.builder()
            .id("tl-jan")
            .title("Winter Camp")
            .startDate(AtomFixtures.day("2025-01-01"))
            .endDate(AtomFixtures.day("2025-01-31"))
            .build();
        TimelineHierarchy hierarchy = TimelineHierarchy.builder()
            .sagas(Collections.singletonList(TimelineHierarchy.Saga.builder()
                .id("saga-1")
                .arcs(Collections.singletonList(TimelineHierarchy.Arc.builder()
                    .id("arc-1")
                    .chapters(Collections.singletonList(january))
                    .build()))
                .build()))
            .build();

        List<NarrativeAtom> atoms = new ArrayList<>(AtomFixtures.daily("jan", "2025-01-01", 15));
        atoms.addAll(AtomFixtures.daily("apr", "2025-04-01", 2));

        ClusteringResult result = clusterer.cluster(atoms, hierarchy, fullLife, null);

        ChapterCluster claimed = result.getChapters().get(0);
        assertEquals("tl-jan", claimed.getTimelineChapterId());
        assertSame(january, claimed.getTimelineChapter());
        assertEquals(BiographyDepth.SUMMARY.getChapterCapacity(), claimed.getAtoms().size());
        assertEquals(5, result.getExcludedAtomIds().size());
        assertEquals(2, result.getChapters().get(1).getAtoms().size());
        assertNull(result.getChapters().get(1).getTimelineChapterId());
        assertCoveredExactlyOnce(atoms, result);
    }

    @Test
    @DisplayName("未结束的时间线章节以当前时间为结束")
    void openTimelineChapterRunsUntilNow() {
        TimelineChapter ongoing = TimelineChapter.builder()
            .id("tl-now")
            .startDate(AtomFixtures.day("2025-11-01"))
            .build();
        TimelineHierarchy hierarchy = TimelineHierarchy.builder()
            .sagas(Collections.singletonList(TimelineHierarchy.Saga.builder()
                .arcs(Collections.singletonList(TimelineHierarchy.Arc.builder()
                    .chapters(Collections.singletonList(ongoing))
                    .build()))
                .build()))
            .build();

        ClusteringResult result = clusterer.cluster(
            Collections.singletonList(AtomFixtures.simple("recent", "2025-11-20")), hierarchy, fullLife, null);

        assertEquals(1, result.getChapters().size());
        assertEquals("tl-now", result.getChapters().get(0).getTimelineChapterId());
    }

    // ========== ORDERING TESTS ==========

    @Test
    @DisplayName("full_life 按开始时间，thematic 按重要性降序")
    void ordersByScope() {
        List<ChapterCluster> clusters = Arrays.asList(
            chapter("b", "2025-03-01", 0.9),
            chapter("a", "2025-01-01", 0.2),
            chapter("c", "2025-05-01", 0.5));

        assertEquals(Arrays.asList("a", "b", "c"), chapterIds(clusterer.order(clusters, BiographyScope.FULL_LIFE)));
        assertEquals(Arrays.asList("a", "b", "c"), chapterIds(clusterer.order(clusters, BiographyScope.TIME_RANGE)));
        assertEquals(Arrays.asList("b", "c", "a"), chapterIds(clusterer.order(clusters, BiographyScope.THEMATIC)));
    }

    @Test
    @DisplayName("domain 范围：30天内的相邻章节按重要性重排")
    void domainOrderIsHybrid() {
        List<ChapterCluster> clusters = Arrays.asList(
            chapter("a", "2025-01-01", 0.3),
            chapter("b", "2025-01-20", 0.9),
            chapter("c", "2025-04-01", 0.5),
            chapter("d", "2025-04-10", 0.2));

        assertEquals(Arrays.asList("b", "a", "c", "d"), chapterIds(clusterer.order(clusters, BiographyScope.DOMAIN)));
    }

    @Test
    @DisplayName("空白章节按开始时间插入，同时间排在普通章节之后")
    void mergesVoidChaptersByStart() {
        List<ChapterCluster> ordered = Arrays.asList(
            chapter("jan", "2025-01-01", 0.5),
            chapter("mar", "2025-03-01", 0.5));

        List<ChapterCluster> merged = clusterer.mergeVoidChapters(ordered, Arrays.asList(
            voidChapter("void-tie", "2025-03-01", "2025-04-15"),
            voidChapter("void-feb", "2025-02-01", "2025-02-28")));

        assertEquals(Arrays.asList("jan", "void-feb", "mar", "void-tie"), chapterIds(merged));
    }

    @Test
    @DisplayName("空章节列表时空白章节依次排列")
    void mergesVoidChaptersIntoEmptyList() {
        List<ChapterCluster> merged = clusterer.mergeVoidChapters(new ArrayList<ChapterCluster>(),
            Collections.singletonList(voidChapter("void-complete", "2025-01-01", "2025-12-31")));

        assertEquals(Collections.singletonList("void-complete"), chapterIds(merged));
    }

    @Test
    @DisplayName("落在普通章节跨度内的空白不单独成章")
    void voidInsideChapterSpanIsNotMerged() {
        ChapterCluster january = ChapterCluster.builder()
            .id("jan")
            .timeSpan(TimeSpan.of(AtomFixtures.day("2025-01-01"), AtomFixtures.day("2025-01-31")))
            .significance(0.5)
            .build();

        List<ChapterCluster> merged = clusterer.mergeVoidChapters(Collections.singletonList(january),
            Arrays.asList(
                voidChapter("void-inside", "2025-01-01", "2025-01-31"),
                voidChapter("void-after", "2025-01-31", "2025-03-15")));

        assertEquals(Arrays.asList("jan", "void-after"), chapterIds(merged));
    }

    @Test
    @DisplayName("相隔正好30天的两个原子合为一章，中间的空白不再单独成章")
    void thirtyDayGapStaysInsideOneChapter() {
        List<NarrativeAtom> atoms = Arrays.asList(
            AtomFixtures.simple("a", "2025-01-01"),
            AtomFixtures.simple("b", "2025-01-31"));
        ChapterCluster gap = voidChapter("void-chapter-void-0-1", "2025-01-01", "2025-01-31");

        ClusteringResult result = clusterer.cluster(atoms, TimelineHierarchy.empty(), fullLife,
            Collections.singletonList(gap));

        assertEquals(Collections.singletonList("cluster-0"), chapterIds(result.getChapters()));
        assertEquals(Arrays.asList("a", "b"), AtomFixtures.ids(result.getChapters().get(0).getAtoms()));
    }

    @Test
    @DisplayName("每个原子恰好出现在一个章节或排除列表中")
    void everyAtomAccountedForOnce() {
        List<NarrativeAtom> atoms = new ArrayList<>();
        LifeDomain[] domains = LifeDomain.values();
        for (int i = 0; i < 40; i++) {
            String date = AtomFixtures.day("2024-01-01").plusSeconds(i * 9L * 86400).toString().substring(0, 10);
            atoms.add(AtomFixtures.atom("a" + i, date)
                .clearDomains()
                .domain(domains[i % domains.length])
                .significance((i % 10) / 10.0)
                .build());
        }

        ClusteringResult result = clusterer.cluster(atoms, TimelineHierarchy.empty(), fullLife, null);

        assertCoveredExactlyOnce(atoms, result);
        Set<String> chapterIds = new HashSet<>(chapterIds(result.getChapters()));
        assertEquals(result.getChapters().size(), chapterIds.size());
    }
}
