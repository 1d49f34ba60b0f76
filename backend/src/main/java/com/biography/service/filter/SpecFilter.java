package com.biography.service.filter;

import com.biography.enums.BiographyScope;
import com.biography.enums.LifeDomain;
import com.biography.model.AtomMetadata;
import com.biography.model.BiographySpec;
import com.biography.model.NarrativeAtom;
import com.biography.model.NarrativeGraph;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 规格过滤：按范围、领域、时间、主题、人物及实体筛选原子，并按叙事权重排序截断
 *
 * 输出按 significance × emotionalWeight 降序（同分保持原顺序），是后续各阶段的工作集。
 */
@Component
public class SpecFilter {

    private static final Logger logger = LoggerFactory.getLogger(SpecFilter.class);

    private static final Comparator<NarrativeAtom> BY_NARRATIVE_WEIGHT =
        Comparator.comparingDouble(NarrativeAtom::getNarrativeWeight).reversed();

    /**
     * 过滤、排序并按深度截断
     */
    public List<NarrativeAtom> filter(NarrativeGraph graph, BiographySpec spec) {
        List<NarrativeAtom> atoms = match(graph, spec);

        atoms.sort(BY_NARRATIVE_WEIGHT);

        int ceiling = spec.getDepth().getAtomCeiling();
        if (atoms.size() > ceiling) {
            logger.debug("按深度截断原子: depth={}, {} -> {}", spec.getDepth().getCode(), atoms.size(), ceiling);
            atoms = new ArrayList<>(atoms.subList(0, ceiling));
        }

        logger.info("🔍 规格过滤完成: scope={}, 原子 {} -> {}", spec.getScope().getCode(),
            graph.getAtoms().size(), atoms.size());
        return atoms;
    }

    /**
     * 只做条件筛选，不排序不截断（保持图中原顺序）
     */
    public List<NarrativeAtom> match(NarrativeGraph graph, BiographySpec spec) {
        List<NarrativeAtom> atoms = selectByDomain(graph, spec);

        if (spec.getTimeRange() != null) {
            atoms = retain(atoms, a -> spec.getTimeRange().contains(a.getTimestamp()));
        }

        if (!spec.getThemes().isEmpty()) {
            atoms = retain(atoms, a -> matchesAnyTheme(a, spec.getThemes()));
        }

        if (!spec.getPeopleIds().isEmpty()) {
            atoms = retain(atoms, a -> intersects(a.getPeopleIds(), spec.getPeopleIds()));
        }

        if (!spec.getCharacterIds().isEmpty()) {
            atoms = retain(atoms, a -> intersects(a.getPeopleIds(), spec.getCharacterIds()));
        }

        if (!spec.getLocationIds().isEmpty()) {
            atoms = retain(atoms, metadataMatch(AtomMetadata::getLocationIds, spec.getLocationIds()));
        }

        if (!spec.getEventIds().isEmpty()) {
            atoms = retain(atoms, metadataMatch(AtomMetadata::getEventIds, spec.getEventIds()));
        }

        if (!spec.getSkillIds().isEmpty()) {
            atoms = retain(atoms, metadataMatch(AtomMetadata::getSkillIds, spec.getSkillIds()));
        }

        return atoms;
    }

    /**
     * 当前规格启用的过滤器名称
     */
    public List<String> describeActiveFilters(BiographySpec spec) {
        List<String> names = new ArrayList<>();
        if (spec.getScope() == BiographyScope.DOMAIN && spec.getDomain() != null) {
            names.add("domain-filter");
        }
        if (spec.getTimeRange() != null) {
            names.add("time-range-filter");
        }
        if (!spec.getThemes().isEmpty()) {
            names.add("theme-filter");
        }
        if (!spec.getPeopleIds().isEmpty()) {
            names.add("people-filter");
        }
        if (!spec.getCharacterIds().isEmpty()) {
            names.add("character-filter");
        }
        if (!spec.getLocationIds().isEmpty()) {
            names.add("location-filter");
        }
        if (!spec.getEventIds().isEmpty()) {
            names.add("event-filter");
        }
        if (!spec.getSkillIds().isEmpty()) {
            names.add("skill-filter");
        }
        return names;
    }

    /**
     * 领域范围优先走索引（O(k)），索引缺少该领域时线性扫描
     */
    private List<NarrativeAtom> selectByDomain(NarrativeGraph graph, BiographySpec spec) {
        LifeDomain domain = spec.getDomain();
        if (spec.getScope() != BiographyScope.DOMAIN || domain == null) {
            return new ArrayList<>(graph.getAtoms());
        }

        Map<LifeDomain, List<String>> byDomain = graph.getIndex() != null ? graph.getIndex().getByDomain() : null;
        if (byDomain != null && byDomain.containsKey(domain)) {
            Map<String, NarrativeAtom> atomsById = graph.getAtomsById();
            List<NarrativeAtom> atoms = new ArrayList<>();
            for (String atomId : byDomain.get(domain)) {
                NarrativeAtom atom = atomsById.get(atomId);
                if (atom != null) {
                    atoms.add(atom);
                }
            }
            return atoms;
        }

        return retain(graph.getAtoms(), a -> a.getDomains().contains(domain));
    }

    private static List<NarrativeAtom> retain(List<NarrativeAtom> atoms, Predicate<NarrativeAtom> predicate) {
        List<NarrativeAtom> result = new ArrayList<>();
        for (NarrativeAtom atom : atoms) {
            if (predicate.test(atom)) {
                result.add(atom);
            }
        }
        return result;
    }

    private static boolean matchesAnyTheme(NarrativeAtom atom, List<String> themes) {
        // 只匹配正文，标签不参与
        String text = StringUtils.defaultString(atom.getContent()).toLowerCase(Locale.ROOT);
        for (String theme : themes) {
            if (StringUtils.isNotBlank(theme) && text.contains(theme.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static Predicate<NarrativeAtom> metadataMatch(
            Function<AtomMetadata, List<String>> extractor, List<String> wanted) {
        return atom -> atom.getMetadata() != null && intersects(extractor.apply(atom.getMetadata()), wanted);
    }

    private static boolean intersects(Collection<String> values, Collection<String> wanted) {
        for (String value : values) {
            if (wanted.contains(value)) {
                return true;
            }
        }
        return false;
    }
}
