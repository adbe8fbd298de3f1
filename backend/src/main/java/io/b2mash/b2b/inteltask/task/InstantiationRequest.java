package io.b2mash.b2b.inteltask.task;

import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.schedule.PeriodInfo;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Everything needed to issue one batch of tasks for a template.
 *
 * @param period period and due time shared by every task of the batch
 * @param runAt the run instant recorded as the template's {@code lastRunAt}
 * @param ruleId rule that produced the batch, or null
 * @param taskGroupId group the tasks join, or null
 * @param triggeredBy operator who triggered a manual run, null for the scheduler
 */
public record InstantiationRequest(
    TaskTemplate template,
    List<AssignmentTarget> targets,
    PeriodInfo period,
    Instant runAt,
    UUID ruleId,
    UUID taskGroupId,
    UUID triggeredBy) {

  public static InstantiationRequest of(
      TaskTemplate template,
      List<AssignmentTarget> targets,
      PeriodInfo period,
      Instant runAt,
      UUID triggeredBy) {
    return new InstantiationRequest(template, targets, period, runAt, null, null, triggeredBy);
  }
}
