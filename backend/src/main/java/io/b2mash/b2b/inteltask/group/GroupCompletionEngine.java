package io.b2mash.b2b.inteltask.group;

import io.b2mash.b2b.inteltask.event.TaskCompletedEvent;
import io.b2mash.b2b.inteltask.history.TaskHistoryAction;
import io.b2mash.b2b.inteltask.history.TaskHistoryRecord;
import io.b2mash.b2b.inteltask.history.TaskHistoryService;
import io.b2mash.b2b.inteltask.rule.CompletionPolicy;
import io.b2mash.b2b.inteltask.rule.QuorumPolicy;
import io.b2mash.b2b.inteltask.rule.TaskRule;
import io.b2mash.b2b.inteltask.rule.TaskRuleRepository;
import io.b2mash.b2b.inteltask.task.Task;
import io.b2mash.b2b.inteltask.task.TaskRepository;
import io.b2mash.b2b.inteltask.task.TaskStatus;
import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Cascades a task completion across its group according to the group's rule. Runs synchronously in
 * the completing transaction. Each evaluation re-reads the group and its tasks, so evaluating a
 * closed group, or one whose tasks are all complete, changes nothing.
 */
@Component
public class GroupCompletionEngine {

  private static final Logger log = LoggerFactory.getLogger(GroupCompletionEngine.class);

  private final TaskGroupRepository groupRepository;
  private final TaskRuleRepository ruleRepository;
  private final TaskRepository taskRepository;
  private final TaskHistoryService historyService;

  public GroupCompletionEngine(
      TaskGroupRepository groupRepository,
      TaskRuleRepository ruleRepository,
      TaskRepository taskRepository,
      TaskHistoryService historyService) {
    this.groupRepository = groupRepository;
    this.ruleRepository = ruleRepository;
    this.taskRepository = taskRepository;
    this.historyService = historyService;
  }

  @EventListener
  public void onTaskCompleted(TaskCompletedEvent event) {
    if (event.taskGroupId() == null) {
      return;
    }
    var now = event.occurredAt() != null ? event.occurredAt() : Instant.now();
    evaluate(event.taskGroupId(), now);
  }

  @Transactional
  public GroupCompletionDecision evaluate(UUID groupId, Instant now) {
    var group = groupRepository.findByIdForUpdate(groupId).orElse(null);
    if (group == null) {
      log.debug("Task group {} no longer exists, skipping completion check", groupId);
      return GroupCompletionDecision.NONE;
    }
    if (!group.isOpen()) {
      return GroupCompletionDecision.NONE;
    }

    Optional<TaskRule> rule =
        group.getRuleId() != null ? ruleRepository.findById(group.getRuleId()) : Optional.empty();
    CompletionPolicy policy =
        rule.map(TaskRule::getCompletionPolicy).orElse(CompletionPolicy.EACH);
    QuorumPolicy quorum = rule.map(TaskRule::quorumPolicy).orElseGet(QuorumPolicy.Default::new);

    var tasks = taskRepository.findByTaskGroupId(groupId);
    int completed =
        (int) tasks.stream().filter(task -> task.getStatus() == TaskStatus.COMPLETED).count();
    var decision = GroupCompletionDecision.decide(policy, quorum, completed, tasks.size());

    if (decision == GroupCompletionDecision.NONE) {
      return decision;
    }

    if (decision == GroupCompletionDecision.CLOSE_AND_COMPLETE_REST) {
      int forced = 0;
      for (Task task : tasks) {
        // Completion events are not re-published for forced completions
        if (task.forceComplete(now)) {
          taskRepository.save(task);
          recordAutoCompletion(task, group, policy);
          forced++;
        }
      }
      log.info(
          "Task group {} reached {} threshold: auto-completed {} of {} tasks",
          groupId,
          policy,
          forced,
          tasks.size());
    }

    group.close(now);
    groupRepository.save(group);
    log.info("Task group {} closed under policy {}", groupId, policy);
    return decision;
  }

  private void recordAutoCompletion(Task task, TaskGroup group, CompletionPolicy policy) {
    var details = new HashMap<String, Object>();
    details.put("group_id", group.getId().toString());
    details.put("policy", policy.name());
    details.put("late", task.isLate());
    historyService.record(
        new TaskHistoryRecord(task.getId(), null, TaskHistoryAction.AUTO_COMPLETE, details));
  }
}
