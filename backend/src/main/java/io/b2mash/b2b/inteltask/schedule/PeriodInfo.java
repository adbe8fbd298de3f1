package io.b2mash.b2b.inteltask.schedule;

import java.time.ZonedDateTime;

/**
 * Calendar window a generated task represents, with its computed due timestamp and period key
 * ({@code YYYY-MM-DD}, {@code YYYY-Www} or {@code YYYY-MM}).
 */
public record PeriodInfo(
    ZonedDateTime periodStart,
    ZonedDateTime periodEnd,
    ZonedDateTime dueAt,
    String periodKey,
    int runAtMinute) {}
