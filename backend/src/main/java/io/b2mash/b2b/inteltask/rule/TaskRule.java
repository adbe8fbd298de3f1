package io.b2mash.b2b.inteltask.rule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Distribution rule attached to a template. A template with an active rule is dispatched through
 * the rule on every scheduler tick instead of following its own cycle.
 */
@Entity
@Table(name = "task_rules")
public class TaskRule {

  private static final int DEFAULT_DISPATCH_MINUTE = 540;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "scope_type", nullable = false, length = 20)
  private RuleScopeType scopeType;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "scope_query", columnDefinition = "jsonb")
  private Map<String, Object> scopeQuery = new HashMap<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "weekdays", columnDefinition = "jsonb")
  private List<Integer> weekdays = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "month_days", columnDefinition = "jsonb")
  private List<Integer> monthDays = new ArrayList<>();

  @Column(name = "dispatch_at_minute", nullable = false)
  private int dispatchAtMinute;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "due_policy", columnDefinition = "jsonb")
  private Map<String, Object> duePolicy = new HashMap<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "assignee_strategy", nullable = false, length = 30)
  private AssigneeStrategy assigneeStrategy;

  @Enumerated(EnumType.STRING)
  @Column(name = "completion_policy", nullable = false, length = 20)
  private CompletionPolicy completionPolicy;

  @Column(name = "group_tasks", nullable = false)
  private boolean grouping;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskRule() {}

  public TaskRule(
      UUID templateId,
      RuleScopeType scopeType,
      AssigneeStrategy assigneeStrategy,
      CompletionPolicy completionPolicy) {
    this.templateId = templateId;
    this.scopeType = scopeType != null ? scopeType : RuleScopeType.TEMPLATE;
    this.assigneeStrategy =
        assigneeStrategy != null ? assigneeStrategy : AssigneeStrategy.POINT_OWNER;
    this.completionPolicy = completionPolicy != null ? completionPolicy : CompletionPolicy.EACH;
    this.dispatchAtMinute = DEFAULT_DISPATCH_MINUTE;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateScopeQuery(Map<String, Object> scopeQuery) {
    this.scopeQuery = scopeQuery != null ? new HashMap<>(scopeQuery) : new HashMap<>();
    this.updatedAt = Instant.now();
  }

  public void updateDispatch(List<Integer> weekdays, List<Integer> monthDays, int minute) {
    this.weekdays = weekdays != null ? new ArrayList<>(weekdays) : new ArrayList<>();
    this.monthDays = monthDays != null ? new ArrayList<>(monthDays) : new ArrayList<>();
    this.dispatchAtMinute = minute;
    this.updatedAt = Instant.now();
  }

  public void updateDuePolicy(Map<String, Object> duePolicy) {
    this.duePolicy = duePolicy != null ? new HashMap<>(duePolicy) : new HashMap<>();
    this.updatedAt = Instant.now();
  }

  public void setGrouping(boolean grouping) {
    this.grouping = grouping;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  /** Whether tasks issued by this rule share a task group. */
  public boolean isGrouped() {
    return grouping || completionPolicy != CompletionPolicy.EACH;
  }

  public QuorumPolicy quorumPolicy() {
    return QuorumPolicy.from(duePolicy);
  }

  /** Reads a list of strings from the scope query, ignoring entries of any other shape. */
  public List<String> scopeValues(String key) {
    if (scopeQuery == null || !(scopeQuery.get(key) instanceof List<?> values)) {
      return List.of();
    }
    var result = new ArrayList<String>(values.size());
    for (Object value : values) {
      if (value != null) {
        result.add(value.toString());
      }
    }
    return result;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public RuleScopeType getScopeType() {
    return scopeType;
  }

  public Map<String, Object> getScopeQuery() {
    return scopeQuery;
  }

  public List<Integer> getWeekdays() {
    return weekdays != null ? weekdays : List.of();
  }

  public List<Integer> getMonthDays() {
    return monthDays != null ? monthDays : List.of();
  }

  public int getDispatchAtMinute() {
    return dispatchAtMinute;
  }

  public Map<String, Object> getDuePolicy() {
    return duePolicy;
  }

  public AssigneeStrategy getAssigneeStrategy() {
    return assigneeStrategy;
  }

  public CompletionPolicy getCompletionPolicy() {
    return completionPolicy;
  }

  public boolean isGrouping() {
    return grouping;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
