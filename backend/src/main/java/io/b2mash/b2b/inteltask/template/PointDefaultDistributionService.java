package io.b2mash.b2b.inteltask.template;

import io.b2mash.b2b.inteltask.assignment.AssigneeResolver;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPoint;
import io.b2mash.b2b.inteltask.collectionpoint.PointSchedule;
import io.b2mash.b2b.inteltask.schedule.PeriodCalculator;
import io.b2mash.b2b.inteltask.schedule.ScheduleClock;
import io.b2mash.b2b.inteltask.task.InstantiationRequest;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.task.TaskInstantiationService;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues tasks for templates in point-default schedule mode. Each matching point follows its own
 * frequency and dispatch minute instead of the template's cycle, so the backfill loop never runs
 * for these templates.
 */
@Service
public class PointDefaultDistributionService {

  private static final Logger log = LoggerFactory.getLogger(PointDefaultDistributionService.class);

  private final AssigneeResolver assigneeResolver;
  private final PeriodCalculator periodCalculator;
  private final TaskInstantiationService instantiationService;
  private final ScheduleClock clock;

  public PointDefaultDistributionService(
      AssigneeResolver assigneeResolver,
      PeriodCalculator periodCalculator,
      TaskInstantiationService instantiationService,
      ScheduleClock clock) {
    this.assigneeResolver = assigneeResolver;
    this.periodCalculator = periodCalculator;
    this.instantiationService = instantiationService;
    this.clock = clock;
  }

  @Transactional
  public InstantiationResult distribute(TaskTemplate template, Instant now) {
    var localNow = clock.at(now);
    var result = InstantiationResult.empty();
    int duePoints = 0;

    for (CollectionPoint point : matchingPoints(template)) {
      if (!PointSchedule.isDue(point, localNow)) {
        continue;
      }
      duePoints++;
      var targets = assigneeResolver.resolvePointTargets(List.of(point));
      if (targets.isEmpty()) {
        log.debug("Point {} has no active allocation, skipping", point.getId());
        continue;
      }
      var cycle = PointSchedule.cycleFor(point, template.getCycle());
      var period = periodCalculator.compute(cycle, localNow);
      result =
          result.plus(
              instantiationService.instantiate(
                  InstantiationRequest.of(template, targets, period, now, null)));
    }

    if (result.count() > 0) {
      log.info(
          "Template {} issued {} point-default tasks across {} due points",
          template.getId(),
          result.count(),
          duePoints);
    }
    return result;
  }

  private List<CollectionPoint> matchingPoints(TaskTemplate template) {
    if (template.targetsPointTypes()) {
      return assigneeResolver.resolvePointsByType(template.getTargetPointTypes());
    }
    return assigneeResolver.resolveTemplatePoints(template);
  }
}
