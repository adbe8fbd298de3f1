package io.b2mash.b2b.inteltask.collectionpoint;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.schedule.CycleType;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class PointScheduleTest {

  @Test
  void dailyPoint_dueOnceDispatchMinutePassed() {
    var point = point(PointFrequencyType.DAILY, List.of(), List.of(), 600);

    assertThat(PointSchedule.isDue(point, at(2024, 3, 6, 9, 59))).isFalse();
    assertThat(PointSchedule.isDue(point, at(2024, 3, 6, 10, 0))).isTrue();
  }

  @Test
  void weeklyPoint_withoutWeekdays_dispatchesOnMonday() {
    var point = point(PointFrequencyType.WEEKLY, List.of(), List.of(), 540);

    assertThat(PointSchedule.isDue(point, at(2024, 3, 4, 9, 30))).isTrue();
    assertThat(PointSchedule.isDue(point, at(2024, 3, 6, 9, 30))).isFalse();
  }

  @Test
  void monthlyPoint_followsConfiguredDays() {
    var point = point(PointFrequencyType.MONTHLY, List.of(), List.of(15, 0), 540);

    assertThat(PointSchedule.isDue(point, at(2024, 4, 15, 12, 0))).isTrue();
    assertThat(PointSchedule.isDue(point, at(2024, 4, 30, 12, 0))).isTrue();
    assertThat(PointSchedule.isDue(point, at(2024, 4, 16, 12, 0))).isFalse();
  }

  @Test
  void cycleFor_weeklyPointUsesTemplateDueSettings() {
    var point = point(PointFrequencyType.WEEKLY, List.of(2), List.of(), 480);
    var templateCycle = CycleSpec.daily(540, 1020);

    var cycle = PointSchedule.cycleFor(point, templateCycle);

    assertThat(cycle.getCycleType()).isEqualTo(CycleType.WEEKLY);
    assertThat(cycle.getRunAtMinute()).isEqualTo(480);
    assertThat(cycle.getDueAtMinute()).isEqualTo(1020);
    assertThat(cycle.getDueDayOfWeek()).isEqualTo(7);
  }

  @Test
  void cycleFor_customPointIssuesDailyPeriods() {
    var point = point(PointFrequencyType.CUSTOM, List.of(1, 3), List.of(), 480);

    var cycle = PointSchedule.cycleFor(point, new CycleSpec(CycleType.MONTHLY));

    assertThat(cycle.getCycleType()).isEqualTo(CycleType.DAILY);
    assertThat(cycle.getDueAtMinute()).isEqualTo(480);
  }

  private static CollectionPoint point(
      PointFrequencyType frequency, List<Integer> weekdays, List<Integer> monthDays, int minute) {
    var point = new CollectionPoint("CP-1", "Harbour market", "MARKET", List.of("rice"));
    point.updateSchedule(frequency, weekdays, monthDays, minute);
    return point;
  }

  private static ZonedDateTime at(int year, int month, int day, int hour, int minute) {
    return LocalDateTime.of(year, month, day, hour, minute).atZone(ZoneOffset.UTC);
  }
}
