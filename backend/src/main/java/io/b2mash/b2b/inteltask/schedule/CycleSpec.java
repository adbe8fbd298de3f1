package io.b2mash.b2b.inteltask.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import java.time.Instant;

/**
 * Cycle configuration embedded in a task template. Minute values are minute-of-day (0..1439), day
 * of week values run 1=Monday..7=Sunday, and a day of month of 0 (or absent) means the last day of
 * the month. All values are stored as entered and normalized by {@link PeriodCalculator} and
 * {@link NextRunCalculator} at use.
 */
@Embeddable
public class CycleSpec {

  @Enumerated(EnumType.STRING)
  @Column(name = "cycle_type", nullable = false, length = 20)
  private CycleType cycleType;

  @Column(name = "run_at_minute")
  private Integer runAtMinute;

  @Column(name = "due_at_minute")
  private Integer dueAtMinute;

  @Column(name = "run_day_of_week")
  private Integer runDayOfWeek;

  @Column(name = "due_day_of_week")
  private Integer dueDayOfWeek;

  @Column(name = "run_day_of_month")
  private Integer runDayOfMonth;

  @Column(name = "due_day_of_month")
  private Integer dueDayOfMonth;

  // Legacy hours-after-anchor deadline, only honoured for ONE_TIME cycles
  @Column(name = "deadline_offset_hours")
  private Integer deadlineOffsetHours;

  @Column(name = "active_from")
  private Instant activeFrom;

  @Column(name = "active_until")
  private Instant activeUntil;

  @Column(name = "max_backfill_periods", nullable = false)
  private int maxBackfillPeriods = 1;

  protected CycleSpec() {}

  public CycleSpec(CycleType cycleType) {
    this.cycleType = cycleType;
  }

  public static CycleSpec daily(int runAtMinute, int dueAtMinute) {
    var cycle = new CycleSpec(CycleType.DAILY);
    cycle.runAtMinute = runAtMinute;
    cycle.dueAtMinute = dueAtMinute;
    return cycle;
  }

  public static CycleSpec weekly(
      int runDayOfWeek, int runAtMinute, int dueDayOfWeek, int dueAtMinute) {
    var cycle = new CycleSpec(CycleType.WEEKLY);
    cycle.runDayOfWeek = runDayOfWeek;
    cycle.runAtMinute = runAtMinute;
    cycle.dueDayOfWeek = dueDayOfWeek;
    cycle.dueAtMinute = dueAtMinute;
    return cycle;
  }

  public static CycleSpec monthly(
      int runDayOfMonth, int runAtMinute, int dueDayOfMonth, int dueAtMinute) {
    var cycle = new CycleSpec(CycleType.MONTHLY);
    cycle.runDayOfMonth = runDayOfMonth;
    cycle.runAtMinute = runAtMinute;
    cycle.dueDayOfMonth = dueDayOfMonth;
    cycle.dueAtMinute = dueAtMinute;
    return cycle;
  }

  public static CycleSpec oneTime(Instant activeFrom, int runAtMinute, int dueAtMinute) {
    var cycle = new CycleSpec(CycleType.ONE_TIME);
    cycle.activeFrom = activeFrom;
    cycle.runAtMinute = runAtMinute;
    cycle.dueAtMinute = dueAtMinute;
    return cycle;
  }

  public CycleSpec withActiveWindow(Instant activeFrom, Instant activeUntil) {
    this.activeFrom = activeFrom;
    this.activeUntil = activeUntil;
    return this;
  }

  public CycleSpec withMaxBackfillPeriods(int maxBackfillPeriods) {
    this.maxBackfillPeriods = Math.max(0, maxBackfillPeriods);
    return this;
  }

  public CycleSpec withDeadlineOffsetHours(Integer deadlineOffsetHours) {
    this.deadlineOffsetHours = deadlineOffsetHours;
    return this;
  }

  public CycleType getCycleType() {
    return cycleType;
  }

  public Integer getRunAtMinute() {
    return runAtMinute;
  }

  public Integer getDueAtMinute() {
    return dueAtMinute;
  }

  public Integer getRunDayOfWeek() {
    return runDayOfWeek;
  }

  public Integer getDueDayOfWeek() {
    return dueDayOfWeek;
  }

  public Integer getRunDayOfMonth() {
    return runDayOfMonth;
  }

  public Integer getDueDayOfMonth() {
    return dueDayOfMonth;
  }

  public Integer getDeadlineOffsetHours() {
    return deadlineOffsetHours;
  }

  public Instant getActiveFrom() {
    return activeFrom;
  }

  public Instant getActiveUntil() {
    return activeUntil;
  }

  public int getMaxBackfillPeriods() {
    return maxBackfillPeriods;
  }

  public boolean isOneTime() {
    return cycleType == CycleType.ONE_TIME;
  }
}
