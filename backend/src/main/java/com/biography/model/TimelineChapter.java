package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 外部时间线中的章节（传记章节的骨架）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimelineChapter {

    private String id;

    private String title;

    private Instant startDate;

    /**
     * 未结束的章节为 null
     */
    private Instant endDate;

    private String description;

    private String summary;

    /**
     * 所属篇章弧
     */
    private String parentId;

    /**
     * 结束时间缺省时用给定时间兜底
     */
    public TimeSpan spanOrUntil(Instant fallbackEnd) {
        return TimeSpan.of(startDate, endDate != null ? endDate : fallbackEnd);
    }
}
