package com.biography.service.cluster;

import com.biography.enums.ChapterPosition;
import com.biography.enums.LifeDomain;
import com.biography.enums.PreservedContentType;
import com.biography.model.ChapterCluster;
import com.biography.model.NarrativeAtom;
import com.biography.model.PreservedPlacement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 保留内容放置
 *
 * 前言、献词、致谢放在首章开头（按此顺序），尾声放在末章结尾；
 * 其余保留内容按相关性选择章节：时间包含0.4、领域重合0.3、共享人物0.2、重要性匹配0.1，
 * 得分需高于0.3，否则不放置。
 */
@Component
public class PreservedContentPlacer {

    private static final Logger logger = LoggerFactory.getLogger(PreservedContentPlacer.class);

    private static final double PLACEMENT_THRESHOLD = 0.3;
    private static final double HIGH_SIGNIFICANCE = 0.7;

    public List<PreservedPlacement> place(List<NarrativeAtom> preservedAtoms, List<ChapterCluster> chapters) {
        List<PreservedPlacement> placements = new ArrayList<>();

        List<ChapterCluster> regular = new ArrayList<>();
        for (ChapterCluster chapter : chapters) {
            if (!chapter.isVoidChapter()) {
                regular.add(chapter);
            }
        }
        if (preservedAtoms.isEmpty() || regular.isEmpty()) {
            return placements;
        }

        List<NarrativeAtom> opening = new ArrayList<>();
        List<NarrativeAtom> closing = new ArrayList<>();
        List<NarrativeAtom> contextual = new ArrayList<>();
        for (NarrativeAtom atom : preservedAtoms) {
            PreservedContentType type = atom.getPreservedType();
            if (type == null) {
                continue;
            }
            if (type == PreservedContentType.EPILOGUE) {
                closing.add(atom);
            } else if (type.isStructural()) {
                opening.add(atom);
            } else {
                contextual.add(atom);
            }
        }

        ChapterCluster first = regular.get(0);
        ChapterCluster last = regular.get(regular.size() - 1);

        opening.sort(Comparator.comparingInt(a -> a.getPreservedType().getPriority()));
        for (NarrativeAtom atom : opening) {
            placements.add(placement(atom, first, ChapterPosition.OPENING, "结构性内容放在首章开头"));
        }
        for (NarrativeAtom atom : closing) {
            placements.add(placement(atom, last, ChapterPosition.CLOSING, "尾声放在末章结尾"));
        }

        for (NarrativeAtom atom : contextual) {
            ChapterCluster best = null;
            double bestScore = 0.0;
            for (ChapterCluster chapter : regular) {
                double score = scoreChapter(atom, chapter);
                if (score > bestScore) {
                    best = chapter;
                    bestScore = score;
                }
            }
            if (best == null || bestScore <= PLACEMENT_THRESHOLD) {
                logger.debug("保留内容没有足够相关的章节，跳过: atomId={}, score={}", atom.getId(), bestScore);
                continue;
            }
            ChapterPosition position = determinePosition(atom, best);
            placements.add(placement(atom, best, position,
                String.format(Locale.ROOT, "相关性得分 %.2f", bestScore)));
        }

        logger.info("📌 保留内容放置完成: {}/{}", placements.size(), preservedAtoms.size());
        return placements;
    }

    /**
     * 章节相关性得分
     */
    public double scoreChapter(NarrativeAtom atom, ChapterCluster chapter) {
        double score = 0.0;

        if (chapter.getTimeSpan() != null && chapter.getTimeSpan().contains(atom.getTimestamp())) {
            score += 0.4;
        }

        List<String> chapterThemes = chapter.getDominantThemes();
        if (!chapterThemes.isEmpty()) {
            Set<String> atomThemes = new HashSet<>();
            for (LifeDomain domain : atom.getDomains()) {
                atomThemes.add(domain.getCode());
            }
            for (String tag : atom.getTags()) {
                atomThemes.add(tag.toLowerCase(Locale.ROOT));
            }
            int shared = 0;
            for (String theme : chapterThemes) {
                if (atomThemes.contains(theme)) {
                    shared++;
                }
            }
            score += (shared / (double) chapterThemes.size()) * 0.3;
        }

        if (!atom.getPeopleIds().isEmpty() && sharesPeople(atom, chapter)) {
            score += 0.2;
        }

        if (chapter.getSignificance() > HIGH_SIGNIFICANCE && atom.getSignificance() > HIGH_SIGNIFICANCE) {
            score += 0.1;
        }

        return score;
    }

    /**
     * 按类型取默认位置；默认在中间的内容若位于章节时间跨度前20%/后20%，改为开头/结尾
     */
    public ChapterPosition determinePosition(NarrativeAtom atom, ChapterCluster chapter) {
        PreservedContentType type = atom.getPreservedType();
        ChapterPosition position = type != null ? type.getDefaultPosition() : ChapterPosition.MIDDLE;

        if (position != ChapterPosition.MIDDLE || chapter.getTimeSpan() == null) {
            return position;
        }

        long duration = chapter.getTimeSpan().durationMillis();
        if (duration > 0) {
            Instant start = chapter.getTimeSpan().getStart();
            double relative = (atom.getTimestamp().toEpochMilli() - start.toEpochMilli()) / (double) duration;
            if (relative < 0.2) {
                return ChapterPosition.OPENING;
            }
            if (relative > 0.8) {
                return ChapterPosition.CLOSING;
            }
        }
        return position;
    }

    private static boolean sharesPeople(NarrativeAtom atom, ChapterCluster chapter) {
        for (NarrativeAtom member : chapter.getAtoms()) {
            if (member.getId().equals(atom.getId())) {
                continue;
            }
            for (String personId : member.getPeopleIds()) {
                if (atom.getPeopleIds().contains(personId)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static PreservedPlacement placement(NarrativeAtom atom, ChapterCluster chapter,
                                                ChapterPosition position, String reasoning) {
        return PreservedPlacement.builder()
            .atomId(atom.getId())
            .chapterId(chapter.getId())
            .position(position)
            .contentType(atom.getPreservedType())
            .reasoning(reasoning)
            .build();
    }
}
