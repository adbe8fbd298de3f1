package io.b2mash.b2b.inteltask.task;

import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.member.Member;
import io.b2mash.b2b.inteltask.member.MemberRepository;
import io.b2mash.b2b.inteltask.schedule.PeriodInfo;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.template.TaskTemplateRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
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
 * Writes one batch of tasks for resolved targets. Organisation and department are copied from each
 * assignee's member record at this point and are not re-resolved afterwards.
 */
@Service
public class TaskInstantiationService {

  private static final Logger log = LoggerFactory.getLogger(TaskInstantiationService.class);

  private final TaskBulkInsertRepository bulkInsertRepository;
  private final MemberRepository memberRepository;
  private final TaskTemplateRepository templateRepository;

  public TaskInstantiationService(
      TaskBulkInsertRepository bulkInsertRepository,
      MemberRepository memberRepository,
      TaskTemplateRepository templateRepository) {
    this.bulkInsertRepository = bulkInsertRepository;
    this.memberRepository = memberRepository;
    this.templateRepository = templateRepository;
  }

  /**
   * Inserts one task per target, skipping any that already exist for the same period. On a
   * non-empty target set the template's {@code lastRunAt} advances to the run instant; an empty
   * target set writes nothing.
   */
  @Transactional
  public InstantiationResult instantiate(InstantiationRequest request) {
    var targets = request.targets();
    if (targets == null || targets.isEmpty()) {
      log.debug("No targets resolved for template {}, nothing issued", request.template().getId());
      return InstantiationResult.empty();
    }

    var template = request.template();
    var assigneeIds = new LinkedHashSet<UUID>();
    var pointIds = new LinkedHashSet<UUID>();
    for (var target : targets) {
      assigneeIds.add(target.userId());
      if (target.collectionPointId() != null) {
        pointIds.add(target.collectionPointId());
      }
    }

    Map<UUID, Member> snapshots =
        memberRepository.findByIdIn(assigneeIds).stream()
            .collect(Collectors.toMap(Member::getId, Function.identity()));

    var records = new ArrayList<NewTaskRecord>(targets.size());
    for (var target : targets) {
      records.add(buildRecord(request, target, snapshots.get(target.userId())));
    }

    int inserted = bulkInsertRepository.insertSkippingDuplicates(records);

    template.recordRun(request.runAt());
    templateRepository.save(template);

    if (inserted < records.size()) {
      log.debug(
          "Template {} period {}: {} of {} tasks already existed",
          template.getId(),
          request.period().periodKey(),
          records.size() - inserted,
          records.size());
    }
    return new InstantiationResult(inserted, List.copyOf(assigneeIds), pointIds.size());
  }

  private NewTaskRecord buildRecord(
      InstantiationRequest request, AssignmentTarget target, Member snapshot) {
    TaskTemplate template = request.template();
    PeriodInfo period = request.period();
    return new NewTaskRecord(
        taskTitle(template.getName(), period.periodKey(), target.commodity()),
        template.getDescription(),
        template.getTaskType(),
        template.getPriority(),
        period.periodStart().toInstant(),
        period.periodEnd().toInstant(),
        period.dueAt().toInstant(),
        period.dueAt().toInstant(),
        period.periodKey(),
        target.userId(),
        snapshot != null ? snapshot.getOrganizationId() : null,
        snapshot != null ? snapshot.getDepartmentId() : null,
        template.getId(),
        request.ruleId(),
        request.taskGroupId(),
        target.collectionPointId(),
        target.commodity(),
        request.triggeredBy());
  }

  static String taskTitle(String templateName, String periodKey, String commodity) {
    var title = templateName + " [" + periodKey + "]";
    return commodity == null ? title : title + " [" + commodity + "]";
  }
}
