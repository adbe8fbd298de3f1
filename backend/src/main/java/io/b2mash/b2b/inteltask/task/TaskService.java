package io.b2mash.b2b.inteltask.task;

import io.b2mash.b2b.inteltask.event.TaskCompletedEvent;
import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.group.TaskGroupRepository;
import io.b2mash.b2b.inteltask.history.TaskHistory;
import io.b2mash.b2b.inteltask.history.TaskHistoryAction;
import io.b2mash.b2b.inteltask.history.TaskHistoryRecord;
import io.b2mash.b2b.inteltask.history.TaskHistoryService;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Review workflow for issued tasks: submit, review, direct completion and the overdue sweep. */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private static final List<TaskStatus> OPEN_STATUSES =
      List.of(TaskStatus.PENDING, TaskStatus.RETURNED, TaskStatus.OVERDUE);

  private final TaskRepository taskRepository;
  private final TaskGroupRepository groupRepository;
  private final TaskHistoryService historyService;
  private final ApplicationEventPublisher eventPublisher;

  public TaskService(
      TaskRepository taskRepository,
      TaskGroupRepository groupRepository,
      TaskHistoryService historyService,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.groupRepository = groupRepository;
    this.historyService = historyService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(readOnly = true)
  public Task getTask(UUID taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  /** Tasks still waiting on the assignee, earliest due first. */
  @Transactional(readOnly = true)
  public List<Task> listOpenTasks(UUID assigneeId) {
    return taskRepository.findByAssigneeAndStatuses(assigneeId, OPEN_STATUSES);
  }

  @Transactional(readOnly = true)
  public List<TaskHistory> getHistory(UUID taskId) {
    getTask(taskId);
    return historyService.findByTask(taskId);
  }

  @Transactional
  public Task submit(UUID taskId, UUID actorId) {
    var task = loadForTransition(taskId);
    task.submit();
    task = taskRepository.save(task);
    log.info("Task {} submitted by {}", taskId, actorId);

    historyService.record(TaskHistoryRecord.of(task.getId(), actorId, TaskHistoryAction.SUBMIT));
    return task;
  }

  /**
   * Reviews a submitted task. Approval completes it and triggers group completion; rejection
   * returns it to the assignee.
   */
  @Transactional
  public Task review(UUID taskId, boolean approved, String comment, UUID reviewerId) {
    var task = loadForTransition(taskId);
    var details = new HashMap<String, Object>();
    if (comment != null) {
      details.put("comment", comment);
    }

    if (approved && task.getStatus() == TaskStatus.COMPLETED) {
      // A sibling's completion already closed the group and completed this task
      log.debug("Task {} already completed, ignoring approval", taskId);
      return task;
    }
    if (approved) {
      task.approve(reviewerId, comment, Instant.now());
      task = taskRepository.save(task);
      log.info("Task {} approved by {}", taskId, reviewerId);
      details.put("late", task.isLate());
      historyService.record(
          new TaskHistoryRecord(task.getId(), reviewerId, TaskHistoryAction.APPROVE, details));
      publishCompleted(task, reviewerId);
    } else {
      task.returnForRevision(comment);
      task = taskRepository.save(task);
      log.info("Task {} returned by {}", taskId, reviewerId);
      historyService.record(
          new TaskHistoryRecord(task.getId(), reviewerId, TaskHistoryAction.RETURN, details));
    }
    return task;
  }

  /**
   * Completes a task directly, optionally linking the intel record it produced. Completing an
   * already COMPLETED task changes nothing and publishes nothing.
   */
  @Transactional
  public Task complete(UUID taskId, UUID actorId, UUID intelId) {
    var task = loadForTransition(taskId);
    if (!task.complete(actorId, intelId, Instant.now())) {
      log.debug("Task {} already completed, ignoring", taskId);
      return task;
    }
    task = taskRepository.save(task);
    log.info("Task {} completed by {} (late={})", taskId, actorId, task.isLate());

    Map<String, Object> details = new HashMap<>();
    details.put("late", task.isLate());
    if (intelId != null) {
      details.put("intel_id", intelId.toString());
    }
    historyService.record(
        new TaskHistoryRecord(task.getId(), actorId, TaskHistoryAction.COMPLETE, details));
    publishCompleted(task, actorId);
    return task;
  }

  /** Marks every PENDING task whose due basis lies before {@code now} as OVERDUE. */
  @Transactional
  public int markOverdue(Instant now) {
    int updated = taskRepository.markOverdue(now);
    if (updated > 0) {
      log.info("Marked {} tasks overdue", updated);
    }
    return updated;
  }

  /**
   * Loads a task for a status change. For a grouped task the group row is locked first and the task
   * is read after the lock, so it reflects any cascade committed by a concurrent sibling.
   */
  private Task loadForTransition(UUID taskId) {
    taskRepository.findTaskGroupIdById(taskId).ifPresent(groupRepository::findByIdForUpdate);
    return getTask(taskId);
  }

  private void publishCompleted(Task task, UUID actorId) {
    eventPublisher.publishEvent(
        new TaskCompletedEvent(
            task.getId(),
            task.getTaskGroupId(),
            task.getTemplateId(),
            actorId,
            task.isLate(),
            task.getCompletedAt()));
  }
}
