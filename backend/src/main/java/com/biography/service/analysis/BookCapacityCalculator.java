package com.biography.service.analysis;

import com.biography.common.BiographyException;
import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyScope;
import com.biography.model.BiographySpec;
import com.biography.model.BookCapacityEstimate;
import com.biography.model.NarrativeAtom;
import com.biography.model.NarrativeGraph;
import com.biography.service.filter.SpecFilter;
import com.biography.service.filter.VersionFilter;
import com.biography.service.graph.NarrativeGraphBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 篇幅估算：根据符合规格的原子数估算页数、章节数与字数
 */
@Service
public class BookCapacityCalculator {

    private static final Logger logger = LoggerFactory.getLogger(BookCapacityCalculator.class);

    public static final int MINIMUM_VIABLE_ATOMS = 20;

    @Autowired
    private NarrativeGraphBuilder graphBuilder;

    @Autowired
    private SpecFilter specFilter;

    @Autowired
    private VersionFilter versionFilter;

    /**
     * @param targetPages 目标页数，可为 null
     */
    public BookCapacityEstimate calculateBookCapacity(String userId, BiographySpec spec, Integer targetPages) {
        int availableAtoms = countAvailableAtoms(userId, spec);
        BookCapacityEstimate estimate = estimate(availableAtoms, spec, targetPages);
        logger.info("📏 篇幅估算: userId={}, atoms={}, 建议页数={}", userId, availableAtoms,
            estimate.getEstimatedPages().getRecommended());
        return estimate;
    }

    public BookCapacityEstimate estimate(int availableAtoms, BiographySpec spec, Integer targetPages) {
        BiographyDepth depth = spec.getDepth();
        int atomsPerPage = depth.getAtomsPerPage();

        BookCapacityEstimate.Range pages = new BookCapacityEstimate.Range(
            Math.max(1, (int) Math.floor(availableAtoms / (atomsPerPage * 1.5))),
            (int) Math.floor((double) availableAtoms / atomsPerPage),
            (int) Math.floor(availableAtoms / (atomsPerPage * 0.8)));

        BookCapacityEstimate.Range chapters = new BookCapacityEstimate.Range(
            Math.max(1, (int) Math.ceil(pages.getMinimum() / 10.0)),
            (int) Math.ceil(pages.getRecommended() / 7.0),
            (int) Math.ceil(pages.getMaximum() / 5.0));

        boolean canGenerate = availableAtoms >= MINIMUM_VIABLE_ATOMS;

        BookCapacityEstimate.BookCapacityEstimateBuilder builder = BookCapacityEstimate.builder()
            .availableAtoms(availableAtoms)
            .estimatedPages(pages)
            .estimatedChapters(chapters)
            .estimatedWordCount(pages.getRecommended() * depth.getWordsPerPage())
            .canGenerate(canGenerate)
            .reason(canGenerate ? null : "Insufficient content. Need at least " + MINIMUM_VIABLE_ATOMS
                + " narrative atoms, but only have " + availableAtoms + ".")
            .recommendations(recommendations(availableAtoms, pages.getRecommended(), spec, canGenerate));

        if (targetPages != null && targetPages > 0) {
            int targetAtoms = targetPages * atomsPerPage;
            int neededAtoms = Math.max(0, targetAtoms - availableAtoms);
            builder.progressToTarget(new BookCapacityEstimate.Progress(
                targetPages,
                Math.min(1.0, (double) availableAtoms / targetAtoms),
                (int) Math.ceil(neededAtoms / 2.0),
                neededAtoms));
        }

        return builder.build();
    }

    public int estimatePages(int atomCount, BiographyDepth depth) {
        return atomCount / depth.getAtomsPerPage();
    }

    /**
     * 符合规格与版本过滤的原子数（不按深度截断）；读取失败按0处理
     */
    int countAvailableAtoms(String userId, BiographySpec spec) {
        try {
            NarrativeGraph graph = graphBuilder.loadOrBuild(userId);
            List<NarrativeAtom> matched = specFilter.match(graph, spec);
            return versionFilter.apply(matched, spec.getVersion(), spec.getAudience()).size();
        } catch (BiographyException e) {
            logger.warn("⚠️ 读取可用原子失败，按0处理: userId={}, error={}", userId, e.getMessage());
            return 0;
        }
    }

    private List<String> recommendations(int availableAtoms, int estimatedPages, BiographySpec spec,
                                         boolean canGenerate) {
        List<String> recommendations = new ArrayList<>();

        if (!canGenerate) {
            recommendations.add("Add approximately " + (MINIMUM_VIABLE_ATOMS - availableAtoms)
                + " more narrative atoms to generate a basic book.");
            recommendations.add("Try adding more journal entries or chat messages to increase your content.");
        } else if (estimatedPages < 10) {
            recommendations.add("You can generate a " + estimatedPages
                + "-page book. Consider adding more content for a longer book.");
            recommendations.add("Try covering more time periods or domains to expand your story.");
        } else if (estimatedPages < 50) {
            recommendations.add("You can generate a " + estimatedPages + "-page book. Great start!");
            recommendations.add("Consider adding more detailed entries to expand specific chapters.");
        } else {
            recommendations.add("You have enough content for a " + estimatedPages + "-page book!");
            recommendations.add("Consider generating domain-specific books to focus on particular areas of your life.");
        }

        if (spec.getScope() == BiographyScope.DOMAIN && spec.getDomain() != null) {
            recommendations.add("Focusing on " + spec.getDomain().getCode()
                + " domain. Consider adding more entries in this area.");
        }
        if (spec.getScope() == BiographyScope.TIME_RANGE) {
            recommendations.add("Time-range books work best with dense content in that period.");
        }

        return recommendations;
    }
}
