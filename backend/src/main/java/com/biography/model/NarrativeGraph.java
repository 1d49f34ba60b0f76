package com.biography.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 叙事图：原子 + 边 + 查找索引
 *
 * 每个用户一张，由该用户的流水线独占
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeGraph {

    private String userId;

    private List<NarrativeAtom> atoms;

    private List<NarrativeEdge> edges;

    private GraphIndex index;

    private Instant lastUpdated;

    @JsonIgnore
    public boolean isWellFormed() {
        return atoms != null && index != null && index.isWellFormed();
    }

    /**
     * id -> 原子（保持原始顺序）
     */
    @JsonIgnore
    public Map<String, NarrativeAtom> getAtomsById() {
        if (atoms == null) {
            return Collections.emptyMap();
        }
        Map<String, NarrativeAtom> byId = new LinkedHashMap<>();
        for (NarrativeAtom atom : atoms) {
            byId.put(atom.getId(), atom);
        }
        return byId;
    }
}
