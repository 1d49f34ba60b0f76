package com.biography.service.cluster;

import com.biography.enums.LifeDomain;
import com.biography.enums.NarrativeAtomType;
import com.biography.model.NarrativeAtom;
import com.biography.model.PrioritizedAtom;
import com.biography.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 章节内原子优先级排序与选择
 *
 * 得分 = 0.4×重要性 + 0.3×情感强度 + 0.2×时近性 + 0.1×独特性；
 * 保留内容（证言、誓言等）固定得分1.0且永不丢弃。
 */
@Component
public class AtomPrioritizer {

    private static final Logger logger = LoggerFactory.getLogger(AtomPrioritizer.class);

    private static final double SIGNIFICANCE_WEIGHT = 0.4;
    private static final double EMOTION_WEIGHT = 0.3;
    private static final double RECENCY_WEIGHT = 0.2;
    private static final double UNIQUENESS_WEIGHT = 0.1;

    /**
     * 计算每个原子的优先级，按得分降序返回（同分保持原顺序）
     */
    public List<PrioritizedAtom> prioritize(List<NarrativeAtom> atoms, Instant now) {
        Map<NarrativeAtomType, Integer> typeCounts = new EnumMap<>(NarrativeAtomType.class);
        Map<LifeDomain, Integer> domainCounts = new EnumMap<>(LifeDomain.class);
        for (NarrativeAtom atom : atoms) {
            typeCounts.merge(atom.getType(), 1, Integer::sum);
            for (LifeDomain domain : atom.getDomains()) {
                domainCounts.merge(domain, 1, Integer::sum);
            }
        }

        List<PrioritizedAtom> prioritized = new ArrayList<>(atoms.size());
        for (NarrativeAtom atom : atoms) {
            double recency = recencyScore(atom, now);
            double uniqueness = uniquenessScore(atom, typeCounts, domainCounts, atoms.size());
            boolean preserved = atom.isPreserved();

            double score = preserved
                ? 1.0
                : SIGNIFICANCE_WEIGHT * atom.getSignificance()
                    + EMOTION_WEIGHT * atom.getEmotionalWeight()
                    + RECENCY_WEIGHT * recency
                    + UNIQUENESS_WEIGHT * uniqueness;

            prioritized.add(new PrioritizedAtom(atom, score, recency, uniqueness, preserved));
        }

        // 保留内容排在最前
        prioritized.sort(Comparator.comparing((PrioritizedAtom p) -> !p.isPreserved())
            .thenComparing(Comparator.comparingDouble(PrioritizedAtom::getPriorityScore).reversed()));
        return prioritized;
    }

    /**
     * 选出不超过容量的多样化子集（保留内容不受容量限制）
     *
     * 1. 全部保留内容
     * 2. 多样性筛选：前一半容量无条件接收，之后只接收引入新类型或新领域的原子
     * 3. 剩余容量按得分回填
     */
    public List<NarrativeAtom> select(List<NarrativeAtom> atoms, int capacity, Instant now) {
        if (atoms.size() <= capacity) {
            return new ArrayList<>(atoms);
        }

        List<PrioritizedAtom> ranked = prioritize(atoms, now);

        List<NarrativeAtom> selected = new ArrayList<>();
        List<PrioritizedAtom> candidates = new ArrayList<>();
        Set<NarrativeAtomType> seenTypes = EnumSet.noneOf(NarrativeAtomType.class);
        Set<LifeDomain> seenDomains = EnumSet.noneOf(LifeDomain.class);

        for (PrioritizedAtom p : ranked) {
            if (p.isPreserved()) {
                selected.add(p.getAtom());
                seenTypes.add(p.getAtom().getType());
                seenDomains.addAll(p.getAtom().getDomains());
            } else {
                candidates.add(p);
            }
        }

        int remaining = Math.max(0, capacity - selected.size());
        int unconditional = remaining / 2;

        Set<NarrativeAtom> picked = new LinkedHashSet<>();
        for (PrioritizedAtom candidate : candidates) {
            if (picked.size() >= remaining) {
                break;
            }
            NarrativeAtom atom = candidate.getAtom();
            boolean newType = !seenTypes.contains(atom.getType());
            boolean newDomain = !seenDomains.containsAll(atom.getDomains());
            if (picked.size() < unconditional || newType || newDomain) {
                picked.add(atom);
                seenTypes.add(atom.getType());
                seenDomains.addAll(atom.getDomains());
            }
        }

        for (PrioritizedAtom candidate : candidates) {
            if (picked.size() >= remaining) {
                break;
            }
            picked.add(candidate.getAtom());
        }

        selected.addAll(picked);
        logger.debug("章节原子选择: {} -> {}（保留内容{}个）", atoms.size(), selected.size(),
            selected.size() - picked.size());
        return selected;
    }

    private static double recencyScore(NarrativeAtom atom, Instant now) {
        double daysSince = Math.max(0.0,
            (now.toEpochMilli() - atom.getTimestamp().toEpochMilli()) / (double) DateTimeUtils.MILLIS_PER_DAY);
        double recency = 1.0 / (1.0 + daysSince / 365.0);
        return Math.max(0.0, Math.min(1.0, recency));
    }

    /**
     * 类型与领域的逆频率各占一半
     */
    private static double uniquenessScore(NarrativeAtom atom,
                                          Map<NarrativeAtomType, Integer> typeCounts,
                                          Map<LifeDomain, Integer> domainCounts,
                                          int total) {
        if (total == 0) {
            return 0.0;
        }
        double typeFrequency = typeCounts.getOrDefault(atom.getType(), 0) / (double) total;

        double domainFrequency = 0.0;
        if (!atom.getDomains().isEmpty()) {
            for (LifeDomain domain : atom.getDomains()) {
                domainFrequency += domainCounts.getOrDefault(domain, 0) / (double) total;
            }
            domainFrequency /= atom.getDomains().size();
        }

        return 0.5 * (1.0 - typeFrequency) + 0.5 * (1.0 - domainFrequency);
    }
}
