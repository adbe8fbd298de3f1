package io.b2mash.b2b.inteltask.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.template.AssigneeMode;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.template.TaskTemplateRepository;
import io.b2mash.b2b.inteltask.testutil.TestTemplates;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.scheduling.annotation.Scheduled;

@ExtendWith(MockitoExtension.class)
class DistributionSchedulerTest {

  private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

  @Mock private TaskTemplateRepository templateRepository;
  @Mock private TemplateRunService templateRunService;

  private DistributionScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = schedulerWith(true);
  }

  @Test
  void tick_failingTemplateDoesNotStopTheOthers() {
    var first = template();
    var failing = template();
    var last = template();
    when(templateRepository.findSchedulable(NOW)).thenReturn(List.of(first, failing, last));
    when(templateRunService.runTemplate(first.getId(), NOW)).thenReturn(tasks(2));
    when(templateRunService.runTemplate(failing.getId(), NOW))
        .thenThrow(new IllegalStateException("boom"));
    when(templateRunService.runTemplate(last.getId(), NOW)).thenReturn(tasks(3));

    var summary = scheduler.tick(NOW);

    assertThat(summary.skipped()).isFalse();
    assertThat(summary.templatesProcessed()).isEqualTo(2);
    assertThat(summary.failures()).isEqualTo(1);
    assertThat(summary.tasksCreated()).isEqualTo(5);
    verify(templateRunService).runTemplate(last.getId(), NOW);
    assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
  }

  @Test
  void tick_vanishedTemplateIsNotAFailure() {
    var vanished = template();
    when(templateRepository.findSchedulable(NOW)).thenReturn(List.of(vanished));
    when(templateRunService.runTemplate(vanished.getId(), NOW))
        .thenThrow(new ResourceNotFoundException("TaskTemplate", vanished.getId()));

    var summary = scheduler.tick(NOW);

    assertThat(summary.failures()).isZero();
    assertThat(summary.templatesProcessed()).isZero();
  }

  @Test
  void tick_overlappingTickIsSkipped() {
    var nested = new AtomicReference<TickSummary>();
    when(templateRepository.findSchedulable(NOW))
        .thenAnswer(
            invocation -> {
              assertThat(scheduler.state()).isEqualTo(SchedulerState.RUNNING);
              nested.set(scheduler.tick(NOW));
              return List.of();
            });

    var outer = scheduler.tick(NOW);

    assertThat(outer.skipped()).isFalse();
    assertThat(nested.get().skipped()).isTrue();
    assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
  }

  @Test
  void tick_releasesGuardWhenLoadingFails() {
    when(templateRepository.findSchedulable(NOW)).thenThrow(new IllegalStateException("db down"));

    assertThatThrownBy(() -> scheduler.tick(NOW)).isInstanceOf(IllegalStateException.class);

    assertThat(scheduler.state()).isEqualTo(SchedulerState.IDLE);
  }

  @Test
  void scheduledTick_firstTickFiresRightAfterStartupByDefault() throws Exception {
    var trigger =
        DistributionScheduler.class.getMethod("scheduledTick").getAnnotation(Scheduled.class);
    var defaults =
        new Binder(new MapConfigurationPropertySource(Map.of()))
            .bindOrCreate("intel.task-scheduler", TaskSchedulerProperties.class);

    assertThat(trigger.initialDelayString())
        .isEqualTo("${intel.task-scheduler.initial-delay-ms:0}");
    assertThat(defaults.initialDelayMs()).isZero();
    assertThat(defaults.intervalMs()).isEqualTo(300_000);
  }

  @Test
  void scheduledTick_disabled_doesNothing() {
    schedulerWith(false).scheduledTick();

    verifyNoInteractions(templateRepository, templateRunService);
  }

  private DistributionScheduler schedulerWith(boolean enabled) {
    var properties = new TaskSchedulerProperties(enabled, 300_000, "UTC", 600_000, 0);
    return new DistributionScheduler(
        templateRepository, templateRunService, properties, new ScheduleClock(properties));
  }

  private static TaskTemplate template() {
    return TestTemplates.template(CycleSpec.daily(540, 600), AssigneeMode.MANUAL);
  }

  private static InstantiationResult tasks(int count) {
    return new InstantiationResult(count, List.of(UUID.randomUUID()), 0);
  }
}
