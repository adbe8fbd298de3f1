package io.b2mash.b2b.inteltask.template;

import io.b2mash.b2b.inteltask.assignment.AssigneeResolver;
import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPoint;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPointAllocation;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPointAllocationRepository;
import io.b2mash.b2b.inteltask.exception.InvalidStateException;
import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.member.Member;
import io.b2mash.b2b.inteltask.member.MemberRepository;
import io.b2mash.b2b.inteltask.schedule.PeriodCalculator;
import io.b2mash.b2b.inteltask.schedule.ScheduleClock;
import io.b2mash.b2b.inteltask.task.InstantiationRequest;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.task.TaskInstantiationService;
import io.b2mash.b2b.inteltask.template.DistributionPreview.AssigneePreview;
import io.b2mash.b2b.inteltask.template.DistributionPreview.PointShare;
import io.b2mash.b2b.inteltask.template.DistributionPreview.UnassignedPoint;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Manual template operations: execute now, execute by point type and preview. Manual execution
 * issues tasks for the current period only and never touches the scheduler's backfill state.
 */
@Service
public class TaskTemplateService {

  private static final Logger log = LoggerFactory.getLogger(TaskTemplateService.class);

  private final TaskTemplateRepository templateRepository;
  private final AssigneeResolver assigneeResolver;
  private final PeriodCalculator periodCalculator;
  private final TaskInstantiationService instantiationService;
  private final CollectionPointAllocationRepository allocationRepository;
  private final MemberRepository memberRepository;
  private final ScheduleClock clock;

  public TaskTemplateService(
      TaskTemplateRepository templateRepository,
      AssigneeResolver assigneeResolver,
      PeriodCalculator periodCalculator,
      TaskInstantiationService instantiationService,
      CollectionPointAllocationRepository allocationRepository,
      MemberRepository memberRepository,
      ScheduleClock clock) {
    this.templateRepository = templateRepository;
    this.assigneeResolver = assigneeResolver;
    this.periodCalculator = periodCalculator;
    this.instantiationService = instantiationService;
    this.allocationRepository = allocationRepository;
    this.memberRepository = memberRepository;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public TaskTemplate getTemplate(UUID templateId) {
    return templateRepository
        .findById(templateId)
        .orElseThrow(() -> new ResourceNotFoundException("TaskTemplate", templateId));
  }

  /**
   * Issues tasks for the current period right now. Templates that target point types are executed
   * by type; otherwise a non-empty {@code assigneeIdsOverride} replaces the template's own
   * resolution and {@code overrideDeadline} replaces the computed due time.
   */
  @Transactional
  public DistributionResult distribute(
      UUID templateId, List<UUID> assigneeIdsOverride, Instant overrideDeadline, UUID triggeredBy) {
    var template = getTemplate(templateId);
    if (template.targetsPointTypes()) {
      return executeByPointType(template, triggeredBy);
    }

    var result =
        createTasksForRun(
            template, clock.now(), assigneeIdsOverride, overrideDeadline, triggeredBy);
    log.info(
        "Template {} distributed manually by {}: {} tasks",
        templateId,
        triggeredBy,
        result.count());
    return result.pointCount() > 0
        ? DistributionResult.ofPoints(result, result.pointCount())
        : DistributionResult.ofAssignees(result);
  }

  /** Issues tasks for every active collection point of the template's target types. */
  @Transactional
  public DistributionResult executeByPointType(UUID templateId, UUID triggeredBy) {
    return executeByPointType(getTemplate(templateId), triggeredBy);
  }

  /** Unified entry point: executes by point type when configured, otherwise distributes. */
  @Transactional
  public DistributionResult executeTemplate(UUID templateId, UUID triggeredBy) {
    var template = getTemplate(templateId);
    if (template.targetsPointTypes()) {
      return executeByPointType(template, triggeredBy);
    }
    return distribute(templateId, null, null, triggeredBy);
  }

  /** Issues one period's tasks for the scheduler, anchored at the run instant. */
  @Transactional
  public InstantiationResult createTasksForRun(TaskTemplate template, Instant runAt) {
    if (template.targetsPointTypes()) {
      var points = assigneeResolver.resolvePointsByType(template.getTargetPointTypes());
      return instantiate(template, assigneeResolver.resolvePointTargets(points), runAt, null, null);
    }
    return createTasksForRun(template, runAt, null, null, null);
  }

  InstantiationResult createTasksForRun(
      TaskTemplate template,
      Instant runAt,
      List<UUID> assigneeIdsOverride,
      Instant overrideDeadline,
      UUID triggeredBy) {
    boolean overridden = assigneeIdsOverride != null && !assigneeIdsOverride.isEmpty();
    List<AssignmentTarget> targets;
    if (template.targetsListedPoints() && !overridden) {
      targets =
          assigneeResolver.resolvePointTargets(assigneeResolver.resolveTemplatePoints(template));
    } else {
      targets =
          assigneeResolver.resolveAssignees(template, assigneeIdsOverride).stream()
              .map(AssignmentTarget::user)
              .toList();
    }
    return instantiate(template, targets, runAt, overrideDeadline, triggeredBy);
  }

  @Transactional(readOnly = true)
  public DistributionPreview previewDistribution(UUID templateId) {
    var template = getTemplate(templateId);

    List<CollectionPoint> points = null;
    if (template.targetsPointTypes()) {
      points = assigneeResolver.resolvePointsByType(template.getTargetPointTypes());
    } else if (template.targetsListedPoints()) {
      points = assigneeResolver.resolveTemplatePoints(template);
    }
    if (points != null) {
      return previewPoints(points);
    }

    var assigneeIds = assigneeResolver.resolveAssignees(template, null);
    var members = membersById(assigneeIds);
    var assignees = new ArrayList<AssigneePreview>(assigneeIds.size());
    for (UUID userId : assigneeIds) {
      assignees.add(assigneePreview(userId, members.get(userId), List.of(), 1));
    }
    return new DistributionPreview(assignees.size(), assignees.size(), assignees, List.of());
  }

  // --- Private helpers ---

  private DistributionResult executeByPointType(TaskTemplate template, UUID triggeredBy) {
    if (!template.targetsPointTypes()) {
      throw new InvalidStateException(
          "Template has no target point type",
          "Template " + template.getId() + " does not target any collection point type");
    }

    var points = assigneeResolver.resolvePointsByType(template.getTargetPointTypes());
    if (points.isEmpty()) {
      return DistributionResult.nothing("No matching collection points found");
    }
    var targets = assigneeResolver.resolvePointTargets(points);
    if (targets.isEmpty()) {
      return DistributionResult.nothing("No collection point has an assignee");
    }

    var result = instantiate(template, targets, clock.now(), null, triggeredBy);
    log.info(
        "Template {} executed by point type: {} tasks across {} points",
        template.getId(),
        result.count(),
        points.size());
    return DistributionResult.ofPoints(result, points.size());
  }

  private InstantiationResult instantiate(
      TaskTemplate template,
      List<AssignmentTarget> targets,
      Instant runAt,
      Instant overrideDeadline,
      UUID triggeredBy) {
    if (targets.isEmpty()) {
      return InstantiationResult.empty();
    }
    Instant anchor = overrideDeadline != null ? overrideDeadline : runAt;
    var period =
        periodCalculator.compute(
            template.getCycle(),
            clock.at(anchor),
            overrideDeadline != null ? clock.at(overrideDeadline) : null);
    return instantiationService.instantiate(
        InstantiationRequest.of(template, targets, period, runAt, triggeredBy));
  }

  private DistributionPreview previewPoints(List<CollectionPoint> points) {
    var pointIds = points.stream().map(CollectionPoint::getId).toList();
    Map<UUID, List<CollectionPointAllocation>> allocationsByPoint =
        pointIds.isEmpty()
            ? Map.of()
            : allocationRepository.findActiveByPointIds(pointIds).stream()
                .collect(Collectors.groupingBy(CollectionPointAllocation::getCollectionPointId));

    var shares = new LinkedHashMap<UUID, List<PointShare>>();
    var unassigned = new ArrayList<UnassignedPoint>();
    for (var point : points) {
      var allocations = allocationsByPoint.getOrDefault(point.getId(), List.of());
      if (allocations.isEmpty()) {
        unassigned.add(new UnassignedPoint(point.getId(), point.getName(), point.getType()));
        continue;
      }
      for (var allocation : allocations) {
        int count =
            allocation.getCommodity() != null ? 1 : Math.max(1, point.getCommodities().size());
        shares
            .computeIfAbsent(allocation.getUserId(), id -> new ArrayList<>())
            .add(new PointShare(point.getId(), point.getName(), allocation.getCommodity(), count));
      }
    }

    var members = membersById(shares.keySet());
    var assignees = new ArrayList<AssigneePreview>(shares.size());
    int totalTasks = 0;
    for (var entry : shares.entrySet()) {
      int taskCount = entry.getValue().stream().mapToInt(PointShare::count).sum();
      totalTasks += taskCount;
      assignees.add(
          assigneePreview(
              entry.getKey(), members.get(entry.getKey()), entry.getValue(), taskCount));
    }
    return new DistributionPreview(totalTasks, assignees.size(), assignees, unassigned);
  }

  private Map<UUID, Member> membersById(Collection<UUID> ids) {
    if (ids.isEmpty()) {
      return Map.of();
    }
    return memberRepository.findByIdIn(ids).stream()
        .collect(Collectors.toMap(Member::getId, Function.identity()));
  }

  private static AssigneePreview assigneePreview(
      UUID userId, Member member, List<PointShare> shares, int taskCount) {
    return new AssigneePreview(
        userId,
        member != null ? member.getName() : null,
        member != null ? member.getOrganizationId() : null,
        member != null ? member.getDepartmentId() : null,
        shares,
        taskCount);
  }
}
