package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 时间段：由若干章节组成的更高层分组
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimePeriod {

    private String id;

    private String title;

    private Instant start;

    private Instant end;

    @Builder.Default
    private List<String> chapterIds = new ArrayList<>();

    @Builder.Default
    private List<String> themes = new ArrayList<>();

    private String summary;
}
