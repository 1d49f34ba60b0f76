package com.biography.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 时间线层级：sagas -> arcs -> chapters
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineHierarchy {

    @Builder.Default
    private List<Saga> sagas = new ArrayList<>();

    public static TimelineHierarchy empty() {
        return new TimelineHierarchy(new ArrayList<>());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sagas == null || sagas.isEmpty();
    }

    /**
     * 按层级顺序展开全部章节
     */
    @JsonIgnore
    public List<TimelineChapter> getAllChapters() {
        if (isEmpty()) {
            return Collections.emptyList();
        }
        List<TimelineChapter> chapters = new ArrayList<>();
        for (Saga saga : sagas) {
            if (saga.getArcs() == null) {
                continue;
            }
            for (Arc arc : saga.getArcs()) {
                if (arc.getChapters() != null) {
                    chapters.addAll(arc.getChapters());
                }
            }
        }
        return chapters;
    }

    /**
     * 层级覆盖的总体时间范围；无法确定时返回 null
     */
    @JsonIgnore
    public TimeSpan getOverallSpan() {
        Instant start = null;
        Instant end = null;
        if (isEmpty()) {
            return null;
        }
        for (Saga saga : sagas) {
            if (saga.getStartDate() != null && (start == null || saga.getStartDate().isBefore(start))) {
                start = saga.getStartDate();
            }
            if (saga.getEndDate() != null && (end == null || saga.getEndDate().isAfter(end))) {
                end = saga.getEndDate();
            }
        }
        if (start == null || end == null) {
            return null;
        }
        return TimeSpan.of(start, end);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Saga {
        private String id;
        private String title;
        private String description;
        private Instant startDate;
        private Instant endDate;
        @Builder.Default
        private List<Arc> arcs = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Arc {
        private String id;
        private String title;
        private String description;
        private Instant startDate;
        private Instant endDate;
        @Builder.Default
        private List<TimelineChapter> chapters = new ArrayList<>();
    }
}
