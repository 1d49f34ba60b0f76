package com.biography.model;

import com.biography.enums.LifeDomain;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 叙事图索引：按领域、按时间（升序）、按人物
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphIndex {

    private Map<LifeDomain, List<String>> byDomain;

    private List<TimeEntry> byTime;

    private Map<String, List<String>> byPerson;

    /**
     * 三类索引均存在才视为结构完整
     */
    public boolean isWellFormed() {
        return byDomain != null && byTime != null && byPerson != null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimeEntry {
        private String atomId;
        private Instant timestamp;
    }
}
