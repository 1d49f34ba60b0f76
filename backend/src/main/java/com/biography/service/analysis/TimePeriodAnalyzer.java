package com.biography.service.analysis;

import com.biography.model.ChapterCluster;
import com.biography.model.TimePeriod;
import com.biography.model.TimeSpan;
import com.biography.model.TimelineHierarchy;
import com.biography.model.VoidPeriod;
import com.biography.util.DateTimeUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 时间段分析：把章节归入更高层的时间段
 *
 * 有传奇（saga）时按传奇划分；否则按章节之间超过90天的间隔切分。
 */
@Component
public class TimePeriodAnalyzer {

    public static final String UNASSIGNED = "unassigned";

    private static final double PERIOD_GAP_DAYS = 90;

    @Autowired
    private Clock clock;

    public List<TimePeriod> detectTimePeriods(List<ChapterCluster> chapters, TimelineHierarchy hierarchy,
                                              List<VoidPeriod> voids) {
        List<TimePeriod> periods = new ArrayList<>();
        if (chapters.isEmpty()) {
            return periods;
        }

        if (hierarchy != null && !hierarchy.isEmpty()) {
            for (TimelineHierarchy.Saga saga : hierarchy.getSagas()) {
                if (saga.getStartDate() == null) {
                    continue;
                }
                Instant sagaEnd = saga.getEndDate() != null ? saga.getEndDate() : clock.instant();
                TimeSpan sagaSpan = TimeSpan.of(saga.getStartDate(), sagaEnd);

                List<ChapterCluster> sagaChapters = new ArrayList<>();
                for (ChapterCluster chapter : chapters) {
                    if (sagaSpan.overlaps(chapter.getTimeSpan())) {
                        sagaChapters.add(chapter);
                    }
                }
                if (sagaChapters.isEmpty()) {
                    continue;
                }

                StringBuilder summary = new StringBuilder("Period covering ").append(saga.getTitle());
                int voidChapterCount = countVoidChapters(sagaChapters);
                if (voidChapterCount > 0 && voids != null) {
                    int gapCount = 0;
                    for (VoidPeriod voidPeriod : voids) {
                        if (sagaSpan.overlaps(voidPeriod.toTimeSpan())) {
                            gapCount++;
                        }
                    }
                    if (gapCount > 0) {
                        summary.append(". Contains ").append(plural(voidChapterCount, "void chapter"))
                            .append(" (").append(plural(gapCount, "gap")).append(" in timeline)");
                    }
                }

                periods.add(TimePeriod.builder()
                    .id("period-" + saga.getId())
                    .title(saga.getTitle())
                    .start(saga.getStartDate())
                    .end(sagaEnd)
                    .chapterIds(idsOf(sagaChapters))
                    .themes(themesOf(sagaChapters))
                    .summary(summary.toString())
                    .build());
            }
        }

        if (!periods.isEmpty()) {
            return periods;
        }

        // 没有可用的传奇：按间隔切分
        List<ChapterCluster> sorted = new ArrayList<>(chapters);
        sorted.sort(Comparator.comparing((ChapterCluster c) -> c.getTimeSpan().getStart()));

        List<ChapterCluster> current = new ArrayList<>();
        Instant currentEnd = null;
        for (ChapterCluster chapter : sorted) {
            if (!current.isEmpty()) {
                double gapDays = (chapter.getTimeSpan().getStart().toEpochMilli() - currentEnd.toEpochMilli())
                    / (double) DateTimeUtils.MILLIS_PER_DAY;
                if (gapDays > PERIOD_GAP_DAYS) {
                    periods.add(gapPeriod(periods.size() + 1, current, currentEnd));
                    current = new ArrayList<>();
                }
            }
            current.add(chapter);
            currentEnd = chapter.getTimeSpan().getEnd();
        }
        if (!current.isEmpty()) {
            periods.add(gapPeriod(periods.size() + 1, current, currentEnd));
        }

        return periods;
    }

    /**
     * 按时间段分组，未归入任何时间段的章节放在 "unassigned"
     */
    public Map<String, List<ChapterCluster>> groupChaptersByPeriod(List<ChapterCluster> chapters,
                                                                   List<TimePeriod> periods) {
        Map<String, List<ChapterCluster>> grouped = new LinkedHashMap<>();
        Set<String> assigned = new HashSet<>();

        for (TimePeriod period : periods) {
            List<ChapterCluster> periodChapters = new ArrayList<>();
            for (ChapterCluster chapter : chapters) {
                if (period.getChapterIds().contains(chapter.getId())) {
                    periodChapters.add(chapter);
                }
            }
            if (!periodChapters.isEmpty()) {
                grouped.put(period.getId(), periodChapters);
            }
            assigned.addAll(period.getChapterIds());
        }

        List<ChapterCluster> unassigned = new ArrayList<>();
        for (ChapterCluster chapter : chapters) {
            if (!assigned.contains(chapter.getId())) {
                unassigned.add(chapter);
            }
        }
        if (!unassigned.isEmpty()) {
            grouped.put(UNASSIGNED, unassigned);
        }
        return grouped;
    }

    private TimePeriod gapPeriod(int number, List<ChapterCluster> chapters, Instant end) {
        return TimePeriod.builder()
            .id("period-" + number)
            .title(periodTitle(chapters))
            .start(chapters.get(0).getTimeSpan().getStart())
            .end(end)
            .chapterIds(idsOf(chapters))
            .themes(themesOf(chapters))
            .summary(periodSummary(chapters))
            .build();
    }

    private String periodTitle(List<ChapterCluster> chapters) {
        if (chapters.size() == 1) {
            return chapters.get(0).getTitle();
        }
        int startYear = DateTimeUtils.yearOf(chapters.get(0).getTimeSpan().getStart());
        int endYear = DateTimeUtils.yearOf(chapters.get(chapters.size() - 1).getTimeSpan().getEnd());
        return startYear == endYear ? String.valueOf(startYear) : startYear + " - " + endYear;
    }

    private String periodSummary(List<ChapterCluster> chapters) {
        List<String> themes = themesOf(chapters);
        String themeList = themes.isEmpty()
            ? "various themes"
            : String.join(", ", themes.subList(0, Math.min(3, themes.size())));

        StringBuilder summary = new StringBuilder("A period of ")
            .append(plural(chapters.size(), "chapter"))
            .append(" focusing on ")
            .append(themeList);
        int voidCount = countVoidChapters(chapters);
        if (voidCount > 0) {
            summary.append(". Includes ").append(plural(voidCount, "void chapter"))
                .append(" (periods with missing content)");
        }
        return summary.append('.').toString();
    }

    private static int countVoidChapters(List<ChapterCluster> chapters) {
        int count = 0;
        for (ChapterCluster chapter : chapters) {
            if (chapter.isVoidChapter()) {
                count++;
            }
        }
        return count;
    }

    private static List<String> idsOf(List<ChapterCluster> chapters) {
        List<String> ids = new ArrayList<>();
        for (ChapterCluster chapter : chapters) {
            ids.add(chapter.getId());
        }
        return ids;
    }

    private static List<String> themesOf(List<ChapterCluster> chapters) {
        Set<String> themes = new LinkedHashSet<>();
        for (ChapterCluster chapter : chapters) {
            themes.addAll(chapter.getDominantThemes());
        }
        return new ArrayList<>(themes);
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count > 1 ? "s" : "");
    }
}
