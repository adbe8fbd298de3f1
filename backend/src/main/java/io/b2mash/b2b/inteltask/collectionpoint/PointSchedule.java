package io.b2mash.b2b.inteltask.collectionpoint;

import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.schedule.DispatchGate;
import java.time.ZonedDateTime;
import java.util.List;

/** Evaluates a collection point's own dispatch schedule for point-default templates. */
public final class PointSchedule {

  private PointSchedule() {}

  /** Whether the point dispatches on {@code now}'s day and its dispatch minute has passed. */
  public static boolean isDue(CollectionPoint point, ZonedDateTime now) {
    var frequency =
        point.getFrequencyType() != null ? point.getFrequencyType() : PointFrequencyType.DAILY;
    return switch (frequency) {
      case DAILY -> DispatchGate.reachedMinute(point.getDispatchAtMinute(), now);
      case WEEKLY ->
          DispatchGate.isOpen(
              orDefault(point.getWeekdays(), 1), List.of(), point.getDispatchAtMinute(), now);
      case MONTHLY ->
          DispatchGate.isOpen(
              List.of(), orDefault(point.getMonthDays(), 1), point.getDispatchAtMinute(), now);
      case CUSTOM ->
          DispatchGate.isOpen(
              point.getWeekdays(), point.getMonthDays(), point.getDispatchAtMinute(), now);
    };
  }

  /**
   * Cycle used to compute the period of a point-default task. The point's frequency selects the
   * period length; due minute and due day come from the template's cycle.
   */
  public static CycleSpec cycleFor(CollectionPoint point, CycleSpec templateCycle) {
    int runAt = point.getDispatchAtMinute();
    int dueAt = templateCycle.getDueAtMinute() != null ? templateCycle.getDueAtMinute() : runAt;
    var frequency =
        point.getFrequencyType() != null ? point.getFrequencyType() : PointFrequencyType.DAILY;
    return switch (frequency) {
      case WEEKLY ->
          CycleSpec.weekly(1, runAt, valueOr(templateCycle.getDueDayOfWeek(), 7), dueAt);
      case MONTHLY ->
          CycleSpec.monthly(1, runAt, valueOr(templateCycle.getDueDayOfMonth(), 0), dueAt);
      case DAILY, CUSTOM -> CycleSpec.daily(runAt, dueAt);
    };
  }

  private static List<Integer> orDefault(List<Integer> days, int fallback) {
    return days == null || days.isEmpty() ? List.of(fallback) : days;
  }

  private static int valueOr(Integer value, int fallback) {
    return value != null ? value : fallback;
  }
}
