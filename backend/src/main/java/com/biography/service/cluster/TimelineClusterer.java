package com.biography.service.cluster;

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
import com.biography.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 时间线聚类：把原子分配到章节簇
 *
 * 第一轮按外部时间线章节的时间范围认领原子（超出单章容量时按优先级裁剪）；
 * 第二轮对未认领的原子做"播种-吸收"聚类：30天内且共享领域（或种子原子涉及人物）。
 * 单原子且重要性不高于0.7的簇会被丢弃，丢弃和裁剪的原子都记入 excludedAtomIds。
 */
@Service
public class TimelineClusterer {

    private static final Logger logger = LoggerFactory.getLogger(TimelineClusterer.class);

    private static final long PROXIMITY_MILLIS = 30 * DateTimeUtils.MILLIS_PER_DAY;
    private static final double SINGLETON_SIGNIFICANCE = 0.7;
    private static final int MAX_CLUSTER_THEMES = 5;

    private static final Comparator<NarrativeAtom> BY_TIME = Comparator.comparing(NarrativeAtom::getTimestamp);
    private static final Comparator<ChapterCluster> BY_START =
        Comparator.comparing((ChapterCluster c) -> c.getTimeSpan().getStart());
    private static final Comparator<ChapterCluster> BY_SIGNIFICANCE_DESC =
        Comparator.comparingDouble(ChapterCluster::getSignificance).reversed();

    @Autowired
    private AtomPrioritizer atomPrioritizer;

    @Autowired
    private ThemeAnalyzer themeAnalyzer;

    @Autowired
    private Clock clock;

    /**
     * 聚类、排序并并入空白章节
     *
     * @param voidChapters 由空白期生成的章节（已排除低重要度空白）
     */
    public ClusteringResult cluster(List<NarrativeAtom> atoms, TimelineHierarchy hierarchy,
                                    BiographySpec spec, List<ChapterCluster> voidChapters) {
        Instant now = clock.instant();
        int capacity = spec.getDepth().getChapterCapacity();

        List<NarrativeAtom> chronological = new ArrayList<>(atoms);
        chronological.sort(BY_TIME);

        List<ChapterCluster> clusters = new ArrayList<>();
        List<String> excluded = new ArrayList<>();
        Set<String> claimed = new HashSet<>();

        // 第一轮：外部时间线章节
        List<TimelineChapter> timelineChapters = hierarchy != null
            ? hierarchy.getAllChapters() : Collections.<TimelineChapter>emptyList();
        for (TimelineChapter timelineChapter : timelineChapters) {
            if (timelineChapter.getStartDate() == null) {
                continue;
            }
            TimeSpan span = timelineChapter.spanOrUntil(now);

            List<NarrativeAtom> members = new ArrayList<>();
            for (NarrativeAtom atom : chronological) {
                if (!claimed.contains(atom.getId()) && span.contains(atom.getTimestamp())) {
                    members.add(atom);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            for (NarrativeAtom member : members) {
                claimed.add(member.getId());
            }

            List<NarrativeAtom> selected = atomPrioritizer.select(members, capacity, now);
            if (selected.size() < members.size()) {
                Set<String> selectedIds = new HashSet<>();
                for (NarrativeAtom atom : selected) {
                    selectedIds.add(atom.getId());
                }
                for (NarrativeAtom member : members) {
                    if (!selectedIds.contains(member.getId())) {
                        excluded.add(member.getId());
                    }
                }
                logger.info("✂️ 时间线章节超出容量: chapter={}, {} -> {}", timelineChapter.getId(),
                    members.size(), selected.size());
            }

            ChapterCluster cluster = newCluster("cluster-" + clusters.size(), selected);
            cluster.setTimelineChapterId(timelineChapter.getId());
            cluster.setTimelineChapter(timelineChapter);
            clusters.add(cluster);
        }

        // 第二轮：播种-吸收
        List<NarrativeAtom> unclaimed = new ArrayList<>();
        for (NarrativeAtom atom : chronological) {
            if (!claimed.contains(atom.getId())) {
                unclaimed.add(atom);
            }
        }
        Set<String> used = new HashSet<>();
        for (int i = 0; i < unclaimed.size(); i++) {
            NarrativeAtom seed = unclaimed.get(i);
            if (used.contains(seed.getId())) {
                continue;
            }
            used.add(seed.getId());

            List<NarrativeAtom> members = new ArrayList<>();
            members.add(seed);
            for (int j = i + 1; j < unclaimed.size(); j++) {
                NarrativeAtom other = unclaimed.get(j);
                if (!used.contains(other.getId()) && canAbsorb(seed, other)) {
                    members.add(other);
                    used.add(other.getId());
                }
            }

            ChapterCluster cluster = newCluster("cluster-" + clusters.size(), members);
            if (members.size() > 1 || cluster.getSignificance() > SINGLETON_SIGNIFICANCE) {
                clusters.add(cluster);
            } else {
                excluded.add(seed.getId());
                logger.debug("丢弃低重要度的单原子簇: atomId={}", seed.getId());
            }
        }

        List<ChapterCluster> ordered = order(clusters, spec.getScope());
        List<ChapterCluster> merged = mergeVoidChapters(ordered,
            voidChapters != null ? voidChapters : Collections.<ChapterCluster>emptyList());

        logger.info("✅ 聚类完成: 章节={}, 空白章节={}, 排除原子={}", clusters.size(),
            merged.size() - clusters.size(), excluded.size());
        return new ClusteringResult(merged, excluded);
    }

    /**
     * 按范围排序：
     * full_life/time_range 按开始时间；thematic 按重要性降序；
     * domain 先按时间，再把开始时间彼此相距30天内的相邻簇按重要性降序
     */
    public List<ChapterCluster> order(List<ChapterCluster> clusters, BiographyScope scope) {
        List<ChapterCluster> ordered = new ArrayList<>(clusters);
        switch (scope) {
            case FULL_LIFE:
            case TIME_RANGE:
                ordered.sort(BY_START);
                return ordered;
            case THEMATIC:
                ordered.sort(BY_SIGNIFICANCE_DESC);
                return ordered;
            case DOMAIN:
            default:
                ordered.sort(BY_START);
                return orderHybrid(ordered);
        }
    }

    /**
     * 空白章节按开始时间插入：排在第一个开始时间晚于它的章节之前。
     * 整段落在某个普通章节时间跨度内的空白由该章节叙述，不再单独成章。
     */
    public List<ChapterCluster> mergeVoidChapters(List<ChapterCluster> ordered, List<ChapterCluster> voidChapters) {
        List<ChapterCluster> sortedVoids = new ArrayList<>(voidChapters);
        sortedVoids.sort(BY_START);

        List<ChapterCluster> merged = new ArrayList<>(ordered);
        for (ChapterCluster voidChapter : sortedVoids) {
            ChapterCluster covering = findCoveringChapter(ordered, voidChapter.getTimeSpan());
            if (covering != null) {
                logger.debug("空白期落在章节内，不单独成章: void={}, chapter={}",
                    voidChapter.getVoidPeriodId(), covering.getId());
                continue;
            }
            Instant start = voidChapter.getTimeSpan().getStart();
            int position = merged.size();
            for (int i = 0; i < merged.size(); i++) {
                if (merged.get(i).getTimeSpan().getStart().isAfter(start)) {
                    position = i;
                    break;
                }
            }
            merged.add(position, voidChapter);
        }
        return merged;
    }

    private ChapterCluster findCoveringChapter(List<ChapterCluster> chapters, TimeSpan span) {
        for (ChapterCluster chapter : chapters) {
            TimeSpan chapterSpan = chapter.getTimeSpan();
            if (!chapter.isVoidChapter()
                && !chapterSpan.getStart().isAfter(span.getStart())
                && !chapterSpan.getEnd().isBefore(span.getEnd())) {
                return chapter;
            }
        }
        return null;
    }

    private List<ChapterCluster> orderHybrid(List<ChapterCluster> chronological) {
        List<ChapterCluster> result = new ArrayList<>();
        List<ChapterCluster> group = new ArrayList<>();
        for (ChapterCluster cluster : chronological) {
            if (!group.isEmpty()) {
                ChapterCluster previous = group.get(group.size() - 1);
                long gap = cluster.getTimeSpan().getStart().toEpochMilli()
                    - previous.getTimeSpan().getStart().toEpochMilli();
                if (gap > PROXIMITY_MILLIS) {
                    group.sort(BY_SIGNIFICANCE_DESC);
                    result.addAll(group);
                    group.clear();
                }
            }
            group.add(cluster);
        }
        group.sort(BY_SIGNIFICANCE_DESC);
        result.addAll(group);
        return result;
    }

    private boolean canAbsorb(NarrativeAtom seed, NarrativeAtom other) {
        long timeDiff = Math.abs(seed.getTimestamp().toEpochMilli() - other.getTimestamp().toEpochMilli());
        if (timeDiff > PROXIMITY_MILLIS) {
            return false;
        }
        for (LifeDomain domain : other.getDomains()) {
            if (seed.getDomains().contains(domain)) {
                return true;
            }
        }
        return !seed.getPeopleIds().isEmpty();
    }

    private ChapterCluster newCluster(String id, List<NarrativeAtom> members) {
        List<NarrativeAtom> sorted = new ArrayList<>(members);
        sorted.sort(BY_TIME);

        double significance = 0.0;
        for (NarrativeAtom atom : sorted) {
            significance += atom.getSignificance();
        }
        significance /= sorted.size();

        return ChapterCluster.builder()
            .id(id)
            .atoms(sorted)
            .dominantThemes(themeAnalyzer.extractDominantThemes(sorted, MAX_CLUSTER_THEMES))
            .timeSpan(TimeSpan.of(sorted.get(0).getTimestamp(), sorted.get(sorted.size() - 1).getTimestamp()))
            .significance(significance)
            .build();
    }
}
