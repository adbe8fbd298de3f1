package io.b2mash.b2b.inteltask.schedule;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/** Clamping and wall-clock helpers shared by the period and next-run calculators. */
final class CycleMath {

  static final int MINUTES_IN_DAY = 24 * 60;

  private CycleMath() {}

  static int clampMinute(Integer value, int fallback) {
    if (value == null) {
      return fallback;
    }
    return Math.min(Math.max(0, value), MINUTES_IN_DAY - 1);
  }

  /** Maps a 1=Monday..7=Sunday value onto a 0..6 offset from Monday. */
  static int weekdayOffset(Integer dayOfWeek, int fallback) {
    int day = dayOfWeek != null ? dayOfWeek : fallback;
    return Math.max(0, Math.min(6, day - 1));
  }

  /** Day of month clamped to the month's length; 0 or an overflowing day selects the last day. */
  static LocalDate dayInMonth(YearMonth month, int dayOfMonth) {
    int lastDay = month.lengthOfMonth();
    int day = dayOfMonth <= 0 || dayOfMonth > lastDay ? lastDay : dayOfMonth;
    return month.atDay(day);
  }

  static ZonedDateTime atMinute(LocalDate date, int minuteOfDay, ZoneId zone) {
    int safeMinute = clampMinute(minuteOfDay, 0);
    return date.atTime(LocalTime.of(safeMinute / 60, safeMinute % 60)).atZone(zone);
  }
}
