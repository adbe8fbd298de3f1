package io.b2mash.b2b.inteltask.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import org.springframework.stereotype.Component;

/**
 * Maps a cycle definition and an anchor timestamp to the period the anchor falls in. Inputs are
 * clamped and unknown cycle types take the ONE_TIME branch.
 */
@Component
public class PeriodCalculator {

  private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);
  private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

  public PeriodInfo compute(CycleSpec cycle, ZonedDateTime anchor) {
    return compute(cycle, anchor, null);
  }

  /**
   * Computes period boundaries, due timestamp and period key for the period containing {@code
   * anchor}.
   *
   * @param dueOverride when non-null, replaces the computed due timestamp unconditionally
   */
  public PeriodInfo compute(CycleSpec cycle, ZonedDateTime anchor, ZonedDateTime dueOverride) {
    ZoneId zone = anchor.getZone();
    int runAtMinute = CycleMath.clampMinute(cycle.getRunAtMinute(), 0);
    int dueAtMinute = CycleMath.clampMinute(cycle.getDueAtMinute(), runAtMinute);
    LocalDate day = anchor.toLocalDate();
    CycleType cycleType = cycle.getCycleType() != null ? cycle.getCycleType() : CycleType.ONE_TIME;

    LocalDate startDay;
    LocalDate endDay;
    ZonedDateTime dueAt;
    String periodKey;

    switch (cycleType) {
      case DAILY -> {
        startDay = day;
        endDay = day;
        dueAt = CycleMath.atMinute(day, dueAtMinute, zone);
        periodKey = dateKey(day);
      }
      case WEEKLY -> {
        startDay = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        endDay = startDay.plusDays(6);
        LocalDate dueDay = startDay.plusDays(CycleMath.weekdayOffset(cycle.getDueDayOfWeek(), 7));
        dueAt = CycleMath.atMinute(dueDay, dueAtMinute, zone);
        periodKey = weekKey(startDay);
      }
      case MONTHLY -> {
        YearMonth month = YearMonth.from(day);
        startDay = month.atDay(1);
        endDay = month.atEndOfMonth();
        int dueDayOfMonth = cycle.getDueDayOfMonth() != null ? cycle.getDueDayOfMonth() : 0;
        dueAt = CycleMath.atMinute(CycleMath.dayInMonth(month, dueDayOfMonth), dueAtMinute, zone);
        periodKey = month.format(MONTH_KEY);
      }
      default -> {
        startDay = day;
        endDay = day;
        Integer offsetHours = cycle.getDeadlineOffsetHours();
        dueAt =
            offsetHours != null && offsetHours != 0
                ? anchor.plusHours(offsetHours)
                : CycleMath.atMinute(day, dueAtMinute, zone);
        periodKey = dateKey(day);
      }
    }

    if (dueOverride != null) {
      dueAt = dueOverride;
    }

    return new PeriodInfo(
        startDay.atStartOfDay(zone),
        endDay.atTime(END_OF_DAY).atZone(zone),
        dueAt,
        periodKey,
        runAtMinute);
  }

  /**
   * Parses a period key back to the start of the period it names.
   *
   * @throws IllegalArgumentException if the key does not match the cycle type's key format
   */
  public ZonedDateTime parsePeriodKey(CycleType cycleType, String periodKey, ZoneId zone) {
    try {
      LocalDate start =
          switch (cycleType) {
            case WEEKLY -> {
              String[] parts = periodKey.split("-W");
              if (parts.length != 2) {
                throw new IllegalArgumentException("Invalid week key: " + periodKey);
              }
              yield LocalDate.of(Integer.parseInt(parts[0]), 1, 4)
                  .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, Integer.parseInt(parts[1]))
                  .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            }
            case MONTHLY -> YearMonth.parse(periodKey, MONTH_KEY).atDay(1);
            default -> LocalDate.parse(periodKey);
          };
      return start.atStartOfDay(zone);
    } catch (RuntimeException e) {
      if (e instanceof IllegalArgumentException iae) {
        throw iae;
      }
      throw new IllegalArgumentException("Invalid period key: " + periodKey, e);
    }
  }

  private static String dateKey(LocalDate day) {
    return day.toString();
  }

  private static String weekKey(LocalDate monday) {
    int year = monday.get(IsoFields.WEEK_BASED_YEAR);
    int week = monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    return "%d-W%02d".formatted(year, week);
  }
}
