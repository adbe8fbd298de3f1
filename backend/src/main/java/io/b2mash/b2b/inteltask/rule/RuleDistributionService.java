package io.b2mash.b2b.inteltask.rule;

import io.b2mash.b2b.inteltask.assignment.AssigneeResolver;
import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPoint;
import io.b2mash.b2b.inteltask.group.TaskGroupService;
import io.b2mash.b2b.inteltask.schedule.DispatchGate;
import io.b2mash.b2b.inteltask.schedule.PeriodCalculator;
import io.b2mash.b2b.inteltask.schedule.ScheduleClock;
import io.b2mash.b2b.inteltask.task.InstantiationRequest;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.task.TaskInstantiationService;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Issues tasks for a template through its active rule. Runs on every scheduler tick; the rule's
 * day and minute gate decides whether anything is issued, and the task idempotency index keeps
 * repeated ticks within a period from duplicating work.
 */
@Service
public class RuleDistributionService {

  private static final Logger log = LoggerFactory.getLogger(RuleDistributionService.class);

  private final AssigneeResolver assigneeResolver;
  private final PeriodCalculator periodCalculator;
  private final TaskGroupService groupService;
  private final TaskInstantiationService instantiationService;
  private final ScheduleClock clock;

  public RuleDistributionService(
      AssigneeResolver assigneeResolver,
      PeriodCalculator periodCalculator,
      TaskGroupService groupService,
      TaskInstantiationService instantiationService,
      ScheduleClock clock) {
    this.assigneeResolver = assigneeResolver;
    this.periodCalculator = periodCalculator;
    this.groupService = groupService;
    this.instantiationService = instantiationService;
    this.clock = clock;
  }

  @Transactional
  public InstantiationResult distribute(TaskTemplate template, TaskRule rule, Instant now) {
    var localNow = clock.at(now);
    if (!DispatchGate.isOpen(
        rule.getWeekdays(), rule.getMonthDays(), rule.getDispatchAtMinute(), localNow)) {
      log.debug("Rule {} not open for dispatch at {}", rule.getId(), localNow);
      return InstantiationResult.empty();
    }

    var targets = resolveTargets(template, rule);
    if (targets.isEmpty()) {
      log.info("Rule {} of template {} resolved no targets", rule.getId(), template.getId());
      return InstantiationResult.empty();
    }

    var period = periodCalculator.compute(template.getCycle(), localNow);
    UUID groupId = null;
    if (rule.isGrouped()) {
      var group = groupService.findOrCreate(template.getId(), rule.getId(), period.periodKey());
      if (!group.isOpen()) {
        // Late targets would join a group that no cascade will ever revisit
        log.debug(
            "Group {} for rule {} period {} already closed, issuing nothing",
            group.getId(),
            rule.getId(),
            period.periodKey());
        return InstantiationResult.empty();
      }
      groupId = group.getId();
    }

    var result =
        instantiationService.instantiate(
            new InstantiationRequest(template, targets, period, now, rule.getId(), groupId, null));
    if (result.count() > 0) {
      log.info(
          "Rule {} issued {} tasks for template {} period {}",
          rule.getId(),
          result.count(),
          template.getId(),
          period.periodKey());
    }
    return result;
  }

  List<AssignmentTarget> resolveTargets(TaskTemplate template, TaskRule rule) {
    if (rule.getAssigneeStrategy() == AssigneeStrategy.TEMPLATE_ASSIGNEES) {
      return assigneeResolver.resolveAssignees(template, null).stream()
          .map(AssignmentTarget::user)
          .toList();
    }
    return assigneeResolver.resolvePointTargets(scopedPoints(template, rule));
  }

  private List<CollectionPoint> scopedPoints(TaskTemplate template, TaskRule rule) {
    return switch (rule.getScopeType()) {
      case POINTS -> {
        var ids = parseIds(rule.getId(), rule.scopeValues("pointIds"));
        yield assigneeResolver.resolvePointsByIds(ids);
      }
      case POINT_TYPE -> assigneeResolver.resolvePointsByType(rule.scopeValues("pointTypes"));
      case TEMPLATE ->
          template.targetsPointTypes()
              ? assigneeResolver.resolvePointsByType(template.getTargetPointTypes())
              : assigneeResolver.resolveTemplatePoints(template);
    };
  }

  private static List<UUID> parseIds(UUID ruleId, List<String> values) {
    var ids = new ArrayList<UUID>(values.size());
    for (String value : values) {
      try {
        ids.add(UUID.fromString(value));
      } catch (IllegalArgumentException e) {
        log.warn("Rule {} scope lists invalid point id '{}', skipping", ruleId, value);
      }
    }
    return ids;
  }
}
