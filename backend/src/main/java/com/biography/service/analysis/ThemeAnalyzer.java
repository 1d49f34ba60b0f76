package com.biography.service.analysis;

import com.biography.enums.LifeDomain;
import com.biography.model.ChapterCluster;
import com.biography.model.NarrativeAtom;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 主题分析：主导主题与跨章节主题
 */
@Component
public class ThemeAnalyzer {

    private static final int DOMAIN_WEIGHT = 2;
    private static final int TAG_WEIGHT = 1;

    public List<String> extractDominantThemes(List<NarrativeAtom> atoms, int maxThemes) {
        return extractDominantThemes(atoms, maxThemes, 1);
    }

    /**
     * 统计领域与标签出现次数（领域权重高于标签），
     * 过滤掉出现次数低于 minFrequency 的主题，按得分降序、名称升序返回
     */
    public List<String> extractDominantThemes(List<NarrativeAtom> atoms, int maxThemes, int minFrequency) {
        Map<String, Integer> scores = new HashMap<>();
        Map<String, Integer> frequencies = new HashMap<>();

        for (NarrativeAtom atom : atoms) {
            Set<String> seen = new LinkedHashSet<>();
            for (LifeDomain domain : atom.getDomains()) {
                String theme = domain.getCode();
                scores.merge(theme, DOMAIN_WEIGHT, Integer::sum);
                seen.add(theme);
            }
            for (String tag : atom.getTags()) {
                if (StringUtils.isBlank(tag)) {
                    continue;
                }
                String theme = tag.trim().toLowerCase(Locale.ROOT);
                scores.merge(theme, TAG_WEIGHT, Integer::sum);
                seen.add(theme);
            }
            for (String theme : seen) {
                frequencies.merge(theme, 1, Integer::sum);
            }
        }

        List<String> themes = new ArrayList<>();
        for (String theme : scores.keySet()) {
            if (frequencies.get(theme) >= minFrequency) {
                themes.add(theme);
            }
        }
        themes.sort(Comparator.<String>comparingInt(scores::get).reversed().thenComparing(Comparator.naturalOrder()));

        return themes.size() > maxThemes ? new ArrayList<>(themes.subList(0, maxThemes)) : themes;
    }

    /**
     * 至少出现在两个章节中的主题
     */
    public List<String> findCrossCuttingThemes(List<ChapterCluster> chapters) {
        Map<String, Integer> chapterCounts = new HashMap<>();
        for (ChapterCluster chapter : chapters) {
            for (String theme : new LinkedHashSet<>(chapter.getDominantThemes())) {
                chapterCounts.merge(theme, 1, Integer::sum);
            }
        }

        List<String> themes = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : chapterCounts.entrySet()) {
            if (entry.getValue() >= 2) {
                themes.add(entry.getKey());
            }
        }
        themes.sort(Comparator.<String>comparingInt(chapterCounts::get).reversed().thenComparing(Comparator.naturalOrder()));
        return themes;
    }
}
