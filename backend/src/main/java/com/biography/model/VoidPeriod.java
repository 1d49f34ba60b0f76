package com.biography.model;

import com.biography.enums.FillStrategy;
import com.biography.enums.VoidSignificance;
import com.biography.enums.VoidType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 空白期：相邻原子之间没有任何记录的时间段
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VoidPeriod {

    private String id;

    private Instant start;

    private Instant end;

    private long durationDays;

    private VoidType type;

    private VoidSignificance significance;

    private Context context;

    private FillStrategy fillStrategy;

    public TimeSpan toTimeSpan() {
        return TimeSpan.of(start, end);
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Context {
        private String beforePeriod;
        private String afterPeriod;
        private String estimatedActivity;
        @Builder.Default
        private List<String> surroundingThemes = new ArrayList<>();
    }
}
