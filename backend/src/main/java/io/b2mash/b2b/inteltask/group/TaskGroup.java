package io.b2mash.b2b.inteltask.group;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Batch of tasks issued by one rule for one period. Created OPEN at instantiation time and closed
 * only by the group completion engine.
 */
@Entity
@Table(name = "task_groups")
public class TaskGroup {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_id")
  private UUID templateId;

  @Column(name = "rule_id")
  private UUID ruleId;

  // ruleId:periodKey
  @Column(name = "group_key", nullable = false, length = 100, unique = true)
  private String groupKey;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private TaskGroupStatus status;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskGroup() {}

  public TaskGroup(UUID templateId, UUID ruleId, String groupKey) {
    this.templateId = templateId;
    this.ruleId = ruleId;
    this.groupKey = groupKey;
    this.status = TaskGroupStatus.OPEN;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public static String groupKey(UUID ruleId, String periodKey) {
    return ruleId + ":" + periodKey;
  }

  /** Closes the group. Returns false when it was already closed. */
  public boolean close(Instant now) {
    if (status == TaskGroupStatus.COMPLETED) {
      return false;
    }
    this.status = TaskGroupStatus.COMPLETED;
    this.completedAt = now;
    this.updatedAt = Instant.now();
    return true;
  }

  public boolean isOpen() {
    return status == TaskGroupStatus.OPEN;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getRuleId() {
    return ruleId;
  }

  public String getGroupKey() {
    return groupKey;
  }

  public TaskGroupStatus getStatus() {
    return status;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
