package com.biography.service.graph;

import com.biography.common.GraphBuildException;
import com.biography.enums.LifeDomain;
import com.biography.model.GraphIndex;
import com.biography.model.NarrativeAtom;
import com.biography.model.NarrativeEdge;
import com.biography.model.NarrativeGraph;
import com.biography.service.performance.NarrativeGraphCache;
import com.biography.service.store.AtomStore;
import com.biography.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 叙事图构建服务
 *
 * 边：7天内的时间边、共享领域的主题边、共享人物的关系边。
 * 索引：领域 -> 原子、人物 -> 原子、按时间升序的原子列表。
 * 边的构建是 O(n²)，依赖缓存摊销。
 */
@Service
public class NarrativeGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(NarrativeGraphBuilder.class);

    private static final long TEMPORAL_WINDOW_MILLIS = 7 * DateTimeUtils.MILLIS_PER_DAY;

    @Autowired
    private AtomStore atomStore;

    @Autowired
    private NarrativeGraphCache graphCache;

    @Autowired
    private Clock clock;

    /**
     * 复用未过期且索引完整的图，否则整体重建
     */
    public NarrativeGraph loadOrBuild(String userId) {
        Optional<NarrativeGraph> cached = graphCache.get(userId);
        if (cached.isPresent() && cached.get().isWellFormed()) {
            logger.info("📦 复用缓存的叙事图: userId={}, atoms={}", userId, cached.get().getAtoms().size());
            return cached.get();
        }

        List<NarrativeAtom> atoms;
        try {
            atoms = atomStore.getAtoms(userId);
        } catch (RuntimeException e) {
            logger.error("❌ 读取叙事原子失败: userId={}", userId, e);
            throw new GraphBuildException("叙事图构建失败: " + e.getMessage(), e);
        }

        NarrativeGraph graph = build(userId, atoms != null ? atoms : Collections.<NarrativeAtom>emptyList());
        graphCache.put(userId, graph);
        return graph;
    }

    public NarrativeGraph build(String userId, List<NarrativeAtom> atoms) {
        long start = System.currentTimeMillis();

        List<NarrativeEdge> edges = buildEdges(atoms);
        GraphIndex index = buildIndex(atoms);

        NarrativeGraph graph = NarrativeGraph.builder()
            .userId(userId)
            .atoms(new ArrayList<>(atoms))
            .edges(edges)
            .index(index)
            .lastUpdated(clock.instant())
            .build();

        logger.info("✅ 叙事图构建完成: userId={}, atoms={}, edges={}, 耗时={}ms",
            userId, atoms.size(), edges.size(), System.currentTimeMillis() - start);
        return graph;
    }

    /**
     * 两两比较原子生成边
     */
    public List<NarrativeEdge> buildEdges(List<NarrativeAtom> atoms) {
        List<NarrativeEdge> edges = new ArrayList<>();

        for (int i = 0; i < atoms.size(); i++) {
            for (int j = i + 1; j < atoms.size(); j++) {
                NarrativeAtom a = atoms.get(i);
                NarrativeAtom b = atoms.get(j);

                long timeDiff = Math.abs(a.getTimestamp().toEpochMilli() - b.getTimestamp().toEpochMilli());
                if (timeDiff <= TEMPORAL_WINDOW_MILLIS) {
                    double weight = 1.0 - (double) timeDiff / TEMPORAL_WINDOW_MILLIS;
                    edges.add(new NarrativeEdge(a.getId(), b.getId(), NarrativeEdge.Relation.TEMPORAL, weight));
                }

                int sharedDomains = countShared(a.getDomains(), b.getDomains());
                if (sharedDomains > 0) {
                    double weight = (double) sharedDomains / Math.max(a.getDomains().size(), b.getDomains().size());
                    edges.add(new NarrativeEdge(a.getId(), b.getId(), NarrativeEdge.Relation.THEMATIC, weight));
                }

                int sharedPeople = countShared(a.getPeopleIds(), b.getPeopleIds());
                if (sharedPeople > 0) {
                    double weight = (double) sharedPeople
                        / Math.max(1, Math.max(a.getPeopleIds().size(), b.getPeopleIds().size()));
                    edges.add(new NarrativeEdge(a.getId(), b.getId(), NarrativeEdge.Relation.RELATIONAL, weight));
                }
            }
        }

        return edges;
    }

    public GraphIndex buildIndex(List<NarrativeAtom> atoms) {
        Map<LifeDomain, List<String>> byDomain = new EnumMap<>(LifeDomain.class);
        Map<String, List<String>> byPerson = new LinkedHashMap<>();
        List<GraphIndex.TimeEntry> byTime = new ArrayList<>(atoms.size());

        for (NarrativeAtom atom : atoms) {
            for (LifeDomain domain : atom.getDomains()) {
                byDomain.computeIfAbsent(domain, k -> new ArrayList<>()).add(atom.getId());
            }
            for (String personId : atom.getPeopleIds()) {
                byPerson.computeIfAbsent(personId, k -> new ArrayList<>()).add(atom.getId());
            }
            byTime.add(new GraphIndex.TimeEntry(atom.getId(), atom.getTimestamp()));
        }

        byTime.sort(Comparator.comparing(GraphIndex.TimeEntry::getTimestamp));

        return GraphIndex.builder()
            .byDomain(byDomain)
            .byPerson(byPerson)
            .byTime(byTime)
            .build();
    }

    private static int countShared(Collection<?> left, Collection<?> right) {
        int shared = 0;
        for (Object value : left) {
            if (right.contains(value)) {
                shared++;
            }
        }
        return shared;
    }
}
