package io.b2mash.b2b.inteltask.task;

import io.b2mash.b2b.inteltask.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "intel_tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "type", nullable = false, length = 100)
  private String type;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskStatus status;

  @Column(name = "period_start")
  private Instant periodStart;

  @Column(name = "period_end")
  private Instant periodEnd;

  @Column(name = "due_at")
  private Instant dueAt;

  // Explicit or legacy deadline; used when dueAt is absent
  @Column(name = "deadline")
  private Instant deadline;

  @Column(name = "period_key", length = 20)
  private String periodKey;

  @Column(name = "assignee_id", nullable = false)
  private UUID assigneeId;

  @Column(name = "assignee_org_id")
  private UUID assigneeOrgId;

  @Column(name = "assignee_dept_id")
  private UUID assigneeDeptId;

  @Column(name = "template_id")
  private UUID templateId;

  @Column(name = "rule_id")
  private UUID ruleId;

  @Column(name = "task_group_id")
  private UUID taskGroupId;

  @Column(name = "collection_point_id")
  private UUID collectionPointId;

  @Column(name = "commodity", length = 100)
  private String commodity;

  @Column(name = "late", nullable = false)
  private boolean late;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "completed_by")
  private UUID completedBy;

  @Column(name = "intel_id")
  private UUID intelId;

  @Column(name = "review_comment", columnDefinition = "TEXT")
  private String reviewComment;

  @Column(name = "created_by")
  private UUID createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(NewTaskRecord record) {
    this.title = record.title();
    this.description = record.description();
    this.type = record.type();
    this.priority = record.priority() != null ? record.priority() : TaskPriority.MEDIUM;
    this.status = TaskStatus.PENDING;
    this.periodStart = record.periodStart();
    this.periodEnd = record.periodEnd();
    this.dueAt = record.dueAt();
    this.deadline = record.deadline();
    this.periodKey = record.periodKey();
    this.assigneeId = record.assigneeId();
    this.assigneeOrgId = record.assigneeOrgId();
    this.assigneeDeptId = record.assigneeDeptId();
    this.templateId = record.templateId();
    this.ruleId = record.ruleId();
    this.taskGroupId = record.taskGroupId();
    this.collectionPointId = record.collectionPointId();
    this.commodity = record.commodity();
    this.createdBy = record.createdBy();
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle transition methods ---

  /** Submits collected work for review. Valid from PENDING, RETURNED or OVERDUE. */
  public void submit() {
    requireTransition(TaskStatus.SUBMITTED, "submit");
    this.status = TaskStatus.SUBMITTED;
    this.reviewComment = null;
    this.updatedAt = Instant.now();
  }

  /** Approves a submitted task, completing it. */
  public void approve(UUID reviewerId, String comment, Instant now) {
    requireStatus(TaskStatus.SUBMITTED, "approve");
    this.reviewComment = comment;
    markCompleted(reviewerId, now);
  }

  /** Sends a submitted task back to the assignee. */
  public void returnForRevision(String comment) {
    requireStatus(TaskStatus.SUBMITTED, "return");
    this.status = TaskStatus.RETURNED;
    this.reviewComment = comment;
    this.updatedAt = Instant.now();
  }

  /**
   * Completes the task directly, optionally linking the intel record it produced. Returns false
   * without changing anything when the task is already COMPLETED.
   */
  public boolean complete(UUID actorId, UUID intelId, Instant now) {
    if (status == TaskStatus.COMPLETED) {
      return false;
    }
    requireTransition(TaskStatus.COMPLETED, "complete");
    if (intelId != null) {
      this.intelId = intelId;
    }
    markCompleted(actorId, now);
    return true;
  }

  /** Server-initiated completion from a group cascade. No-op when already COMPLETED. */
  public boolean forceComplete(Instant now) {
    return complete(null, null, now);
  }

  public void markOverdue() {
    requireTransition(TaskStatus.OVERDUE, "mark overdue");
    this.status = TaskStatus.OVERDUE;
    this.updatedAt = Instant.now();
  }

  /** The timestamp lateness is measured against: the computed due time, else the deadline. */
  public Instant lateBasis() {
    return dueAt != null ? dueAt : deadline;
  }

  // --- Private helpers ---

  // Lateness is stamped once here and never recomputed, even if dueAt is edited later
  private void markCompleted(UUID actorId, Instant now) {
    Instant basis = lateBasis();
    this.status = TaskStatus.COMPLETED;
    this.completedAt = now;
    this.completedBy = actorId;
    this.late = basis != null && now.isAfter(basis);
    this.updatedAt = Instant.now();
  }

  private void requireTransition(TaskStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw InvalidStateException.taskTransition(action, this.status);
    }
  }

  private void requireStatus(TaskStatus expected, String action) {
    if (this.status != expected) {
      throw InvalidStateException.taskTransition(action, this.status);
    }
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public String getType() {
    return type;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public TaskStatus getStatus() {
    return status;
  }

  public Instant getPeriodStart() {
    return periodStart;
  }

  public Instant getPeriodEnd() {
    return periodEnd;
  }

  public Instant getDueAt() {
    return dueAt;
  }

  public Instant getDeadline() {
    return deadline;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public UUID getAssigneeId() {
    return assigneeId;
  }

  public UUID getAssigneeOrgId() {
    return assigneeOrgId;
  }

  public UUID getAssigneeDeptId() {
    return assigneeDeptId;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getRuleId() {
    return ruleId;
  }

  public UUID getTaskGroupId() {
    return taskGroupId;
  }

  public UUID getCollectionPointId() {
    return collectionPointId;
  }

  public String getCommodity() {
    return commodity;
  }

  public boolean isLate() {
    return late;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public UUID getCompletedBy() {
    return completedBy;
  }

  public UUID getIntelId() {
    return intelId;
  }

  public String getReviewComment() {
    return reviewComment;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
