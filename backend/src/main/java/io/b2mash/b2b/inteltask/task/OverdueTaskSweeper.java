package io.b2mash.b2b.inteltask.task;

import io.b2mash.b2b.inteltask.schedule.TaskSchedulerProperties;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically moves PENDING tasks past their due time to OVERDUE. */
@Component
public class OverdueTaskSweeper {

  private static final Logger log = LoggerFactory.getLogger(OverdueTaskSweeper.class);

  private final TaskService taskService;
  private final TaskSchedulerProperties properties;

  public OverdueTaskSweeper(TaskService taskService, TaskSchedulerProperties properties) {
    this.taskService = taskService;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${intel.task-scheduler.overdue-sweep-interval-ms:600000}",
      initialDelayString = "${intel.task-scheduler.overdue-sweep-interval-ms:600000}")
  public void sweep() {
    if (!properties.enabled()) {
      return;
    }
    try {
      int updated = taskService.markOverdue(Instant.now());
      log.debug("Overdue sweep completed: {} tasks updated", updated);
    } catch (Exception e) {
      log.error("Overdue sweep failed", e);
    }
  }
}
