package io.b2mash.b2b.inteltask.history;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** Append-only entry in a task's history. No {@code @Version}, no {@code updatedAt}, no setters. */
@Entity
@Table(name = "task_history")
public class TaskHistory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false)
  private UUID taskId;

  @Column(name = "operator_id")
  private UUID operatorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action", nullable = false, length = 30)
  private TaskHistoryAction action;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "details", columnDefinition = "jsonb")
  private Map<String, Object> details;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskHistory() {}

  public TaskHistory(TaskHistoryRecord record) {
    this.taskId = record.taskId();
    this.operatorId = record.operatorId();
    this.action = record.action();
    this.details = record.details();
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public UUID getOperatorId() {
    return operatorId;
  }

  public TaskHistoryAction getAction() {
    return action;
  }

  public Map<String, Object> getDetails() {
    return details;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
