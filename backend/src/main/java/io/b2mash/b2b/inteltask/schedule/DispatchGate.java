package io.b2mash.b2b.inteltask.schedule;

import java.time.YearMonth;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Day and minute gate used by rules and collection point schedules. Weekdays are
 * 1=Monday..7=Sunday; a month day of 0 means the last day of the month. An empty list places no
 * restriction.
 */
public final class DispatchGate {

  private DispatchGate() {}

  public static boolean isOpen(
      List<Integer> weekdays, List<Integer> monthDays, int dispatchAtMinute, ZonedDateTime now) {
    return matchesDay(weekdays, monthDays, now) && reachedMinute(dispatchAtMinute, now);
  }

  public static boolean matchesDay(
      List<Integer> weekdays, List<Integer> monthDays, ZonedDateTime now) {
    if (weekdays != null && !weekdays.isEmpty()) {
      if (!weekdays.contains(now.getDayOfWeek().getValue())) {
        return false;
      }
    }
    if (monthDays != null && !monthDays.isEmpty()) {
      int dayOfMonth = now.getDayOfMonth();
      boolean lastDay = dayOfMonth == YearMonth.from(now).lengthOfMonth();
      return monthDays.contains(dayOfMonth) || (lastDay && monthDays.contains(0));
    }
    return true;
  }

  public static boolean reachedMinute(int dispatchAtMinute, ZonedDateTime now) {
    int minuteOfDay = now.getHour() * 60 + now.getMinute();
    return minuteOfDay >= CycleMath.clampMinute(dispatchAtMinute, 0);
  }
}
