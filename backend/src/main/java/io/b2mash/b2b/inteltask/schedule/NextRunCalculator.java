package io.b2mash.b2b.inteltask.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import org.springframework.stereotype.Component;

/**
 * Computes the next firing time of a cycle. The result is always strictly after {@code now}, or
 * {@code null} when the cycle has no further runs.
 */
@Component
public class NextRunCalculator {

  public ZonedDateTime nextRunAt(CycleSpec cycle, ZonedDateTime now) {
    ZoneId zone = now.getZone();
    ZonedDateTime base = now;
    if (cycle.getActiveFrom() != null) {
      ZonedDateTime activeFrom = cycle.getActiveFrom().atZone(zone);
      if (activeFrom.isAfter(base)) {
        base = activeFrom;
      }
    }

    int runAtMinute = CycleMath.clampMinute(cycle.getRunAtMinute(), 0);
    CycleType cycleType = cycle.getCycleType() != null ? cycle.getCycleType() : CycleType.ONE_TIME;

    return switch (cycleType) {
      case DAILY -> nextDaily(base, runAtMinute);
      case WEEKLY -> nextWeekly(base, runAtMinute, cycle.getRunDayOfWeek());
      case MONTHLY -> nextMonthly(base, runAtMinute, cycle.getRunDayOfMonth());
      default -> nextOneTime(cycle, base, runAtMinute);
    };
  }

  private ZonedDateTime nextDaily(ZonedDateTime base, int runAtMinute) {
    LocalDate day = base.toLocalDate();
    ZonedDateTime candidate = CycleMath.atMinute(day, runAtMinute, base.getZone());
    if (!candidate.isAfter(base)) {
      candidate = CycleMath.atMinute(day.plusDays(1), runAtMinute, base.getZone());
    }
    return candidate;
  }

  private ZonedDateTime nextWeekly(ZonedDateTime base, int runAtMinute, Integer runDayOfWeek) {
    int offset = CycleMath.weekdayOffset(runDayOfWeek, 1);
    LocalDate monday = base.toLocalDate().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    ZonedDateTime candidate =
        CycleMath.atMinute(monday.plusDays(offset), runAtMinute, base.getZone());
    if (!candidate.isAfter(base)) {
      LocalDate nextMonday = monday.plusWeeks(1);
      candidate = CycleMath.atMinute(nextMonday.plusDays(offset), runAtMinute, base.getZone());
    }
    return candidate;
  }

  private ZonedDateTime nextMonthly(ZonedDateTime base, int runAtMinute, Integer runDayOfMonth) {
    int dayOfMonth = runDayOfMonth != null ? runDayOfMonth : 1;
    YearMonth month = YearMonth.from(base.toLocalDate());
    ZonedDateTime candidate =
        CycleMath.atMinute(CycleMath.dayInMonth(month, dayOfMonth), runAtMinute, base.getZone());
    if (!candidate.isAfter(base)) {
      YearMonth next = month.plusMonths(1);
      candidate =
          CycleMath.atMinute(CycleMath.dayInMonth(next, dayOfMonth), runAtMinute, base.getZone());
    }
    return candidate;
  }

  private ZonedDateTime nextOneTime(CycleSpec cycle, ZonedDateTime base, int runAtMinute) {
    if (cycle.getActiveFrom() == null) {
      return null;
    }
    LocalDate day = cycle.getActiveFrom().atZone(base.getZone()).toLocalDate();
    ZonedDateTime candidate = CycleMath.atMinute(day, runAtMinute, base.getZone());
    return candidate.isAfter(base) ? candidate : null;
  }
}
