package io.b2mash.b2b.inteltask.schedule;

import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.template.TaskTemplateRepository;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic driver of template distribution. A tick that finds the previous one still running
 * returns without doing any work.
 *
 * <p>The loop lives here rather than in {@link TemplateRunService} so that each {@code
 * runTemplate} call goes through the Spring proxy and gets its own {@code REQUIRES_NEW}
 * transaction.
 */
@Component
public class DistributionScheduler {

  private static final Logger log = LoggerFactory.getLogger(DistributionScheduler.class);

  private final AtomicReference<SchedulerState> state =
      new AtomicReference<>(SchedulerState.IDLE);

  private final TaskTemplateRepository templateRepository;
  private final TemplateRunService templateRunService;
  private final TaskSchedulerProperties properties;
  private final ScheduleClock clock;

  public DistributionScheduler(
      TaskTemplateRepository templateRepository,
      TemplateRunService templateRunService,
      TaskSchedulerProperties properties,
      ScheduleClock clock) {
    this.templateRepository = templateRepository;
    this.templateRunService = templateRunService;
    this.properties = properties;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${intel.task-scheduler.interval-ms:300000}",
      initialDelayString = "${intel.task-scheduler.initial-delay-ms:0}")
  public void scheduledTick() {
    if (!properties.enabled()) {
      return;
    }
    try {
      tick(clock.now());
    } catch (Exception e) {
      log.error("Scheduler tick failed", e);
    }
  }

  public TickSummary tick(Instant now) {
    if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
      log.debug("Previous scheduler tick still running, skipping tick at {}", now);
      return TickSummary.skippedTick();
    }

    int processed = 0;
    int failures = 0;
    int created = 0;
    try {
      log.debug("Scheduler tick started at {}", now);
      var templateIds =
          templateRepository.findSchedulable(now).stream().map(TaskTemplate::getId).toList();

      for (UUID templateId : templateIds) {
        try {
          created += templateRunService.runTemplate(templateId, now).count();
          processed++;
        } catch (ResourceNotFoundException e) {
          log.debug("Template {} disappeared during tick, skipping", templateId);
        } catch (Exception e) {
          log.error("Failed to run template {}: {}", templateId, e.getMessage(), e);
          failures++;
        }
      }

      log.info(
          "Scheduler tick completed: {} templates processed, {} tasks created, {} failures",
          processed,
          created,
          failures);
      return new TickSummary(false, processed, failures, created);
    } finally {
      state.set(SchedulerState.IDLE);
    }
  }

  public SchedulerState state() {
    return state.get();
  }
}
