package io.b2mash.b2b.inteltask.schedule;

import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.rule.RuleDistributionService;
import io.b2mash.b2b.inteltask.rule.TaskRuleRepository;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.template.PointDefaultDistributionService;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.template.TaskTemplateRepository;
import io.b2mash.b2b.inteltask.template.TaskTemplateService;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Processes a single template for a scheduler tick. Each call runs in its own transaction so that
 * one template's failure rolls back only its own tasks and bookkeeping.
 */
@Service
public class TemplateRunService {

  private static final Logger log = LoggerFactory.getLogger(TemplateRunService.class);

  private final TaskTemplateRepository templateRepository;
  private final TaskRuleRepository ruleRepository;
  private final TaskTemplateService templateService;
  private final RuleDistributionService ruleDistributionService;
  private final PointDefaultDistributionService pointDefaultDistributionService;
  private final NextRunCalculator nextRunCalculator;
  private final ScheduleClock clock;

  public TemplateRunService(
      TaskTemplateRepository templateRepository,
      TaskRuleRepository ruleRepository,
      TaskTemplateService templateService,
      RuleDistributionService ruleDistributionService,
      PointDefaultDistributionService pointDefaultDistributionService,
      NextRunCalculator nextRunCalculator,
      ScheduleClock clock) {
    this.templateRepository = templateRepository;
    this.ruleRepository = ruleRepository;
    this.templateService = templateService;
    this.ruleDistributionService = ruleDistributionService;
    this.pointDefaultDistributionService = pointDefaultDistributionService;
    this.nextRunCalculator = nextRunCalculator;
    this.clock = clock;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public InstantiationResult runTemplate(UUID templateId, Instant now) {
    var template =
        templateRepository
            .findById(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("TaskTemplate", templateId));

    if (template.isPointDefaultScheduled()) {
      return pointDefaultDistributionService.distribute(template, now);
    }

    var rule = ruleRepository.findFirstByTemplateIdAndActiveTrueOrderByCreatedAtDesc(templateId);
    if (rule.isPresent()) {
      return ruleDistributionService.distribute(template, rule.get(), now);
    }

    return backfill(template, now);
  }

  /**
   * Issues every missed period up to {@code now}, bounded by the cycle's backfill limit. The next
   * run is never advanced past {@code now}; periods beyond the limit are picked up by later ticks.
   */
  InstantiationResult backfill(TaskTemplate template, Instant now) {
    var cycle = template.getCycle();
    if (cycle.isOneTime() && template.getLastRunAt() != null) {
      log.debug("One-time template {} already fired, deactivating", template.getId());
      template.deactivateAfterFiring(null);
      templateRepository.save(template);
      return InstantiationResult.empty();
    }

    Instant nextRunAt = template.getNextRunAt();
    if (nextRunAt == null) {
      nextRunAt = withinWindow(cycle.getActiveUntil(), nextRunAfter(template, now));
      template.scheduleNextRun(nextRunAt);
      templateRepository.save(template);
      if (nextRunAt == null || nextRunAt.isAfter(now)) {
        log.debug("Template {} scheduled, next run at {}", template.getId(), nextRunAt);
        return InstantiationResult.empty();
      }
    }

    int maxRuns = Math.max(1, cycle.getMaxBackfillPeriods());
    int runs = 0;
    Instant lastRunAt = null;
    var result = InstantiationResult.empty();

    while (nextRunAt != null && !nextRunAt.isAfter(now) && runs < maxRuns) {
      Instant runAt = nextRunAt;
      result = result.plus(templateService.createTasksForRun(template, runAt));
      runs++;
      lastRunAt = runAt;

      if (cycle.isOneTime()) {
        nextRunAt = null;
        break;
      }
      Instant seed = runAt.plusSeconds(1);
      nextRunAt = withinWindow(cycle.getActiveUntil(), nextRunAfter(template, seed));
    }

    if (cycle.isOneTime() && lastRunAt != null) {
      template.deactivateAfterFiring(lastRunAt);
    } else {
      if (lastRunAt != null) {
        template.recordRun(lastRunAt);
      }
      template.scheduleNextRun(nextRunAt);
    }
    templateRepository.save(template);

    if (runs > 0) {
      log.info(
          "Template {} ran {} periods, {} tasks created, next run at {}",
          template.getId(),
          runs,
          result.count(),
          nextRunAt);
    }
    return result;
  }

  private Instant nextRunAfter(TaskTemplate template, Instant from) {
    ZonedDateTime next = nextRunCalculator.nextRunAt(template.getCycle(), clock.at(from));
    return next != null ? next.toInstant() : null;
  }

  private static Instant withinWindow(Instant activeUntil, Instant candidate) {
    if (candidate == null || (activeUntil != null && candidate.isAfter(activeUntil))) {
      return null;
    }
    return candidate;
  }
}
