package com.biography.service.voids;

import com.biography.enums.FillStrategy;
import com.biography.enums.VoidSignificance;
import com.biography.enums.VoidType;
import com.biography.model.ChapterCluster;
import com.biography.model.NarrativeAtom;
import com.biography.model.TimeSpan;
import com.biography.model.VoidPeriod;
import com.biography.service.analysis.ThemeAnalyzer;
import com.biography.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 空白期感知服务
 *
 * 检测相邻原子之间的时间空白，按时长与位置分类，分析前后语境，
 * 并为重要的空白期生成空白章节。
 */
@Service
public class VoidAwarenessService {

    private static final Logger logger = LoggerFactory.getLogger(VoidAwarenessService.class);

    static final int MIN_GAP_DAYS = 3;
    static final int SHORT_GAP_DAYS = 30;
    static final int MEDIUM_GAP_DAYS = 180;

    private static final int CONTEXT_ATOMS = 5;
    private static final double EARLY_POSITION_RATIO = 0.2;

    private static final Comparator<NarrativeAtom> BY_TIME = Comparator.comparing(NarrativeAtom::getTimestamp);

    @Autowired
    private ThemeAnalyzer themeAnalyzer;

    /**
     * 检测所有空白期
     *
     * @param atoms        过滤后的原子（任意顺序）
     * @param timelineSpan 外部时间线的整体范围，可为 null
     */
    public List<VoidPeriod> detectVoids(List<NarrativeAtom> atoms, TimeSpan timelineSpan) {
        if (atoms.isEmpty()) {
            if (timelineSpan == null) {
                return new ArrayList<>();
            }
            // 整个时间线范围内没有任何原子
            long durationDays = DateTimeUtils.daysBetweenCeil(timelineSpan.getStart(), timelineSpan.getEnd());
            VoidPeriod complete = VoidPeriod.builder()
                .id("void-complete")
                .start(timelineSpan.getStart())
                .end(timelineSpan.getEnd())
                .durationDays(durationDays)
                .type(VoidType.VOID)
                .significance(VoidSignificance.HIGH)
                .fillStrategy(FillStrategy.PROMPT_USER)
                .build();
            return new ArrayList<>(Collections.singletonList(complete));
        }

        List<NarrativeAtom> sorted = new ArrayList<>(atoms);
        sorted.sort(BY_TIME);
        int total = sorted.size();

        List<VoidPeriod> voids = new ArrayList<>();

        for (int i = 0; i < total - 1; i++) {
            Instant current = sorted.get(i).getTimestamp();
            Instant next = sorted.get(i + 1).getTimestamp();
            long diffDays = DateTimeUtils.daysBetweenCeil(current, next);

            if (diffDays > MIN_GAP_DAYS) {
                voids.add(newVoid("void-" + i + "-" + (i + 1), current, next, diffDays, i, total));
            }
        }

        if (timelineSpan != null) {
            Instant first = sorted.get(0).getTimestamp();
            Instant last = sorted.get(total - 1).getTimestamp();

            if (first.isAfter(timelineSpan.getStart())) {
                long gapDays = DateTimeUtils.daysBetweenCeil(timelineSpan.getStart(), first);
                if (gapDays > MIN_GAP_DAYS) {
                    voids.add(newVoid("void-before-start", timelineSpan.getStart(), first, gapDays, 0, total));
                }
            }

            if (last.isBefore(timelineSpan.getEnd())) {
                long gapDays = DateTimeUtils.daysBetweenCeil(last, timelineSpan.getEnd());
                if (gapDays > MIN_GAP_DAYS) {
                    voids.add(newVoid("void-after-end", last, timelineSpan.getEnd(), gapDays, total - 1, total));
                }
            }
        }

        List<VoidPeriod> analyzed = new ArrayList<>(voids.size());
        for (VoidPeriod voidPeriod : voids) {
            analyzed.add(analyzeVoidContext(voidPeriod, atoms));
        }

        if (!analyzed.isEmpty()) {
            logger.info("🕳️ 检测到{}个空白期（原子数={}）", analyzed.size(), total);
        }
        return analyzed;
    }

    public VoidType categorizeVoidType(long durationDays) {
        if (durationDays < SHORT_GAP_DAYS) {
            return VoidType.SHORT_GAP;
        } else if (durationDays < MEDIUM_GAP_DAYS) {
            return VoidType.MEDIUM_GAP;
        }
        return VoidType.LONG_SILENCE;
    }

    /**
     * 按时长定基础级别；位于原子序列前20%且不短于30天的空白再提升一级
     */
    public VoidSignificance calculateSignificance(long durationDays, int position, int totalAtoms) {
        VoidSignificance significance = VoidSignificance.LOW;
        if (durationDays >= MEDIUM_GAP_DAYS) {
            significance = VoidSignificance.HIGH;
        } else if (durationDays >= SHORT_GAP_DAYS) {
            significance = VoidSignificance.MEDIUM;
        }

        double positionRatio = totalAtoms > 0 ? (double) position / totalAtoms : 0.0;
        if (positionRatio < EARLY_POSITION_RATIO && durationDays >= SHORT_GAP_DAYS) {
            significance = significance.escalate();
        }
        return significance;
    }

    public FillStrategy determineFillStrategy(long durationDays) {
        if (durationDays >= MEDIUM_GAP_DAYS) {
            return FillStrategy.PROMPT_USER;
        } else if (durationDays >= SHORT_GAP_DAYS) {
            return FillStrategy.INFER_CONTEXT;
        }
        return FillStrategy.ACKNOWLEDGE_VOID;
    }

    /**
     * 分析空白期前后各最多5个原子，得出周边主题、前后时期概述和活动推测
     */
    public VoidPeriod analyzeVoidContext(VoidPeriod voidPeriod, List<NarrativeAtom> atoms) {
        List<NarrativeAtom> before = new ArrayList<>();
        List<NarrativeAtom> after = new ArrayList<>();
        for (NarrativeAtom atom : atoms) {
            // 边界上的原子就是紧邻空白期的原子
            if (!atom.getTimestamp().isAfter(voidPeriod.getStart())) {
                before.add(atom);
            } else if (!atom.getTimestamp().isBefore(voidPeriod.getEnd())) {
                after.add(atom);
            }
        }

        // 紧邻空白期的原子：之前的取最近5个，之后的取最早5个
        before.sort(BY_TIME.reversed());
        before = new ArrayList<>(before.subList(0, Math.min(CONTEXT_ATOMS, before.size())));
        Collections.reverse(before);
        after.sort(BY_TIME);
        after = new ArrayList<>(after.subList(0, Math.min(CONTEXT_ATOMS, after.size())));

        List<NarrativeAtom> surrounding = new ArrayList<>(before);
        surrounding.addAll(after);
        List<String> themes = themeAnalyzer.extractDominantThemes(surrounding, 5, 1);

        VoidPeriod.Context context = VoidPeriod.Context.builder()
            .beforePeriod(before.isEmpty() ? null : summarizePeriod(before, "before"))
            .afterPeriod(after.isEmpty() ? null : summarizePeriod(after, "after"))
            .estimatedActivity(estimateActivity(before, after, themes))
            .surroundingThemes(themes)
            .build();

        return voidPeriod.toBuilder().context(context).build();
    }

    /**
     * 为非低重要度的空白期创建空白章节
     */
    public List<ChapterCluster> createVoidChapters(List<VoidPeriod> voids) {
        List<ChapterCluster> chapters = new ArrayList<>();
        for (VoidPeriod voidPeriod : voids) {
            if (voidPeriod.getSignificance() == VoidSignificance.LOW) {
                continue;
            }
            List<String> themes = voidPeriod.getContext() != null
                ? new ArrayList<>(voidPeriod.getContext().getSurroundingThemes())
                : new ArrayList<>();

            chapters.add(ChapterCluster.builder()
                .id("void-chapter-" + voidPeriod.getId())
                .title(generateVoidChapterTitle(voidPeriod))
                .atoms(new ArrayList<>())
                .dominantThemes(themes)
                .timeSpan(voidPeriod.toTimeSpan())
                .significance(voidPeriod.getSignificance() == VoidSignificance.HIGH ? 0.5 : 0.3)
                .voidChapter(true)
                .voidPeriodId(voidPeriod.getId())
                .build());
        }
        return chapters;
    }

    public String generateVoidChapterTitle(VoidPeriod voidPeriod) {
        String startMonth = DateTimeUtils.formatMonthYear(voidPeriod.getStart());
        String endMonth = DateTimeUtils.formatMonthYear(voidPeriod.getEnd());
        int startYear = DateTimeUtils.yearOf(voidPeriod.getStart());
        int endYear = DateTimeUtils.yearOf(voidPeriod.getEnd());

        long months = (long) Math.ceil(voidPeriod.getDurationDays() / 30.0);
        long years = voidPeriod.getDurationDays() / 365;

        switch (voidPeriod.getType()) {
            case SHORT_GAP:
                return "The Missing Weeks: " + startMonth;
            case MEDIUM_GAP:
                if (months < 12) {
                    return "The Missing Months: " + startMonth + " - " + endMonth;
                }
                return "The Missing Year: " + startYear;
            case LONG_SILENCE:
                if (years > 0) {
                    return "The Silent Years: " + startYear + " - " + endYear;
                }
                return "The Silent Period: " + startMonth + " - " + endMonth;
            case VOID:
            default:
                return "Unknown Period: " + startMonth + " - " + endMonth;
        }
    }

    /**
     * 引导用户补充内容的问题
     */
    public List<String> generateVoidPrompts(VoidPeriod voidPeriod) {
        List<String> prompts = new ArrayList<>();

        switch (voidPeriod.getType()) {
            case LONG_SILENCE:
            case VOID:
                prompts.add("What major life changes occurred during this period?");
                prompts.add("Were there significant events or milestones you experienced?");
                prompts.add("Did any important relationships begin, develop, or end?");
                prompts.add("What challenges or growth did you face?");
                prompts.add("Were there any creative projects, work changes, or personal transformations?");
                break;
            case MEDIUM_GAP:
                prompts.add("What happened during these months?");
                prompts.add("Were there any notable events or experiences?");
                prompts.add("Did any relationships or projects develop?");
                break;
            case SHORT_GAP:
            default:
                prompts.add("What occurred during this period?");
                break;
        }

        VoidPeriod.Context context = voidPeriod.getContext();
        if (context != null && !context.getSurroundingThemes().isEmpty()) {
            prompts.add("How did this period relate to " + context.getSurroundingThemes().get(0) + "?");
        }

        return prompts;
    }

    /**
     * 空白章节正文：不调用生成服务，直接陈述空白及其语境
     */
    public String describeVoid(VoidPeriod voidPeriod) {
        StringBuilder text = new StringBuilder();
        text.append("There are no records from ")
            .append(DateTimeUtils.formatDate(voidPeriod.getStart()))
            .append(" to ")
            .append(DateTimeUtils.formatDate(voidPeriod.getEnd()))
            .append(", a span of ")
            .append(voidPeriod.getDurationDays())
            .append(" days.");

        VoidPeriod.Context context = voidPeriod.getContext();
        if (context != null) {
            if (context.getBeforePeriod() != null) {
                text.append("\n\n").append(context.getBeforePeriod()).append('.');
            }
            if (context.getAfterPeriod() != null) {
                text.append("\n\n").append(context.getAfterPeriod()).append('.');
            }
            if (context.getEstimatedActivity() != null) {
                text.append("\n\n").append(context.getEstimatedActivity()).append('.');
            }
        }
        return text.toString();
    }

    private VoidPeriod newVoid(String id, Instant start, Instant end, long durationDays, int position, int total) {
        return VoidPeriod.builder()
            .id(id)
            .start(start)
            .end(end)
            .durationDays(durationDays)
            .type(categorizeVoidType(durationDays))
            .significance(calculateSignificance(durationDays, position, total))
            .fillStrategy(determineFillStrategy(durationDays))
            .build();
    }

    private String estimateActivity(List<NarrativeAtom> before, List<NarrativeAtom> after, List<String> themes) {
        if (before.isEmpty() && after.isEmpty()) {
            return "Unknown period with no surrounding context";
        }

        List<String> beforeThemes = themeAnalyzer.extractDominantThemes(before, 3);
        List<String> afterThemes = themeAnalyzer.extractDominantThemes(after, 3);

        List<String> common = new ArrayList<>();
        for (String theme : beforeThemes) {
            if (afterThemes.contains(theme)) {
                common.add(theme);
            }
        }

        if (!common.isEmpty()) {
            return "Likely continuation of " + String.join(", ", common) + " themes";
        }
        if (!beforeThemes.isEmpty() && !afterThemes.isEmpty()) {
            return "Transition from " + beforeThemes.get(0) + " to " + afterThemes.get(0);
        }
        if (!themes.isEmpty()) {
            return "Period related to " + String.join(" and ", themes.subList(0, Math.min(2, themes.size())));
        }
        return "Period of unknown activity";
    }

    private String summarizePeriod(List<NarrativeAtom> chronological, String direction) {
        List<String> themes = themeAnalyzer.extractDominantThemes(chronological, 3);
        String range = DateTimeUtils.formatDate(chronological.get(0).getTimestamp()) + " to "
            + DateTimeUtils.formatDate(chronological.get(chronological.size() - 1).getTimestamp());
        return "The period " + direction + " this gap (" + range + ") was characterized by "
            + (themes.isEmpty() ? "no recurring themes" : String.join(", ", themes));
    }
}
