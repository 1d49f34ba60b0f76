package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * 时间跨度（闭区间）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSpan {

    private Instant start;

    private Instant end;

    public static TimeSpan of(Instant start, Instant end) {
        return new TimeSpan(start, end);
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }

    public boolean overlaps(TimeSpan other) {
        return other != null && !other.getEnd().isBefore(start) && !other.getStart().isAfter(end);
    }

    public long durationMillis() {
        return Duration.between(start, end).toMillis();
    }
}
