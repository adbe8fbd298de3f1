package io.b2mash.b2b.inteltask.task;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

  @Query("SELECT t FROM Task t WHERE t.taskGroupId = :groupId ORDER BY t.createdAt ASC")
  List<Task> findByTaskGroupId(@Param("groupId") UUID groupId);

  /** Empty when the task does not exist or belongs to no group. */
  @Query("SELECT t.taskGroupId FROM Task t WHERE t.id = :taskId")
  Optional<UUID> findTaskGroupIdById(@Param("taskId") UUID taskId);

  List<Task> findByTemplateIdAndPeriodKey(UUID templateId, String periodKey);

  /** Open work for an assignee, earliest due first. */
  @Query(
      """
      SELECT t FROM Task t
      WHERE t.assigneeId = :assigneeId
        AND t.status IN :statuses
      ORDER BY COALESCE(t.dueAt, t.deadline) ASC NULLS LAST, t.createdAt ASC
      """)
  List<Task> findByAssigneeAndStatuses(
      @Param("assigneeId") UUID assigneeId, @Param("statuses") Collection<TaskStatus> statuses);

  /**
   * Moves every PENDING task whose due time (or deadline when no due time was computed) has passed
   * to OVERDUE. Returns the number of tasks updated.
   */
  @Modifying
  @Query(
      """
      UPDATE Task t
      SET t.status = io.b2mash.b2b.inteltask.task.TaskStatus.OVERDUE, t.updatedAt = :now
      WHERE t.status = io.b2mash.b2b.inteltask.task.TaskStatus.PENDING
        AND ((t.dueAt IS NOT NULL AND t.dueAt < :now)
          OR (t.dueAt IS NULL AND t.deadline < :now))
      """)
  int markOverdue(@Param("now") Instant now);
}
