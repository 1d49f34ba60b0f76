package com.biography.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * 时间工具类（统一按UTC处理）
 */
public final class DateTimeUtils {

    public static final long MILLIS_PER_DAY = 24L * 60 * 60 * 1000;

    private static final DateTimeFormatter MONTH_YEAR =
        DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter ISO_DATE =
        DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private DateTimeUtils() {
    }

    public static Instant toInstant(LocalDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant(ZoneOffset.UTC);
    }

    public static LocalDateTime toLocalDateTime(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    /**
     * 两个时间点相差的天数，向上取整
     */
    public static long daysBetweenCeil(Instant from, Instant to) {
        long millis = to.toEpochMilli() - from.toEpochMilli();
        return (long) Math.ceil((double) millis / MILLIS_PER_DAY);
    }

    /**
     * 两个时间点相差的天数（绝对值，带小数）
     */
    public static double daysBetween(Instant a, Instant b) {
        return Math.abs(a.toEpochMilli() - b.toEpochMilli()) / (double) MILLIS_PER_DAY;
    }

    public static int yearOf(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).getYear();
    }

    /**
     * 例如 "Feb 2025"
     */
    public static String formatMonthYear(Instant instant) {
        return MONTH_YEAR.format(instant);
    }

    /**
     * 例如 "2025-02-14"
     */
    public static String formatDate(Instant instant) {
        return ISO_DATE.format(instant);
    }

    public static ZoneId utc() {
        return ZoneOffset.UTC;
    }
}
