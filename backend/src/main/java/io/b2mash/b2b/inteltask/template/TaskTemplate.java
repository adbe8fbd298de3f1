package io.b2mash.b2b.inteltask.template;

import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.task.TaskPriority;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "task_templates")
public class TaskTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 300)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "task_type", nullable = false, length = 100)
  private String taskType;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Embedded private CycleSpec cycle;

  @Enumerated(EnumType.STRING)
  @Column(name = "assignee_mode", nullable = false, length = 30)
  private AssigneeMode assigneeMode;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "assignee_ids", columnDefinition = "jsonb")
  private List<UUID> assigneeIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "department_ids", columnDefinition = "jsonb")
  private List<UUID> departmentIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "organization_ids", columnDefinition = "jsonb")
  private List<UUID> organizationIds = new ArrayList<>();

  @Column(name = "collection_point_id")
  private UUID collectionPointId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "collection_point_ids", columnDefinition = "jsonb")
  private List<UUID> collectionPointIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "target_point_types", columnDefinition = "jsonb")
  private List<String> targetPointTypes = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(name = "schedule_mode", nullable = false, length = 30)
  private ScheduleMode scheduleMode;

  @Column(name = "last_run_at")
  private Instant lastRunAt;

  @Column(name = "next_run_at")
  private Instant nextRunAt;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_by")
  private UUID createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskTemplate() {}

  public TaskTemplate(
      String name,
      String description,
      String taskType,
      TaskPriority priority,
      CycleSpec cycle,
      AssigneeMode assigneeMode,
      UUID createdBy) {
    this.name = name;
    this.description = description;
    this.taskType = taskType;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.cycle = cycle;
    this.assigneeMode = assigneeMode != null ? assigneeMode : AssigneeMode.MANUAL;
    this.scheduleMode = ScheduleMode.TEMPLATE_OVERRIDE;
    this.active = true;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  // --- Target configuration ---

  public void assignTo(List<UUID> assigneeIds) {
    this.assigneeIds = copy(assigneeIds);
    this.updatedAt = Instant.now();
  }

  public void targetDepartments(List<UUID> departmentIds) {
    this.departmentIds = copy(departmentIds);
    this.updatedAt = Instant.now();
  }

  public void targetOrganizations(List<UUID> organizationIds) {
    this.organizationIds = copy(organizationIds);
    this.updatedAt = Instant.now();
  }

  /** Points listed here are used when the assignee mode is BY_COLLECTION_POINT. */
  public void targetCollectionPoints(UUID collectionPointId, List<UUID> collectionPointIds) {
    this.collectionPointId = collectionPointId;
    this.collectionPointIds = copy(collectionPointIds);
    this.updatedAt = Instant.now();
  }

  public void targetPointTypes(List<String> targetPointTypes) {
    this.targetPointTypes = copy(targetPointTypes);
    this.updatedAt = Instant.now();
  }

  public void changeScheduleMode(ScheduleMode scheduleMode) {
    this.scheduleMode = scheduleMode != null ? scheduleMode : ScheduleMode.TEMPLATE_OVERRIDE;
    this.updatedAt = Instant.now();
  }

  /** Replaces the cycle and clears the next run so the scheduler recomputes it. */
  public void updateCycle(CycleSpec cycle) {
    this.cycle = cycle;
    this.nextRunAt = null;
    this.updatedAt = Instant.now();
  }

  // --- Scheduler bookkeeping ---

  public void recordRun(Instant runAt) {
    this.lastRunAt = runAt;
    this.updatedAt = Instant.now();
  }

  public void scheduleNextRun(Instant nextRunAt) {
    this.nextRunAt = nextRunAt;
    this.updatedAt = Instant.now();
  }

  /** A one-time template fires once: it records the run, clears the next run and deactivates. */
  public void deactivateAfterFiring(Instant runAt) {
    if (runAt != null) {
      this.lastRunAt = runAt;
    }
    this.nextRunAt = null;
    this.active = false;
    this.updatedAt = Instant.now();
  }

  public void activate() {
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void deactivate() {
    this.active = false;
    this.updatedAt = Instant.now();
  }

  // --- Derived configuration ---

  /** True when tasks are issued per collection point allocation from explicitly listed points. */
  public boolean targetsListedPoints() {
    return assigneeMode == AssigneeMode.BY_COLLECTION_POINT && !listedPointIds().isEmpty();
  }

  /** True when tasks are issued for every active point of the configured types. */
  public boolean targetsPointTypes() {
    return targetPointTypes != null && !targetPointTypes.isEmpty();
  }

  public boolean isPointDefaultScheduled() {
    return scheduleMode == ScheduleMode.POINT_DEFAULT
        && (targetsListedPoints() || targetsPointTypes());
  }

  /** The single point id takes precedence over the list. */
  public List<UUID> listedPointIds() {
    if (collectionPointId != null) {
      return List.of(collectionPointId);
    }
    return collectionPointIds != null ? collectionPointIds : List.of();
  }

  private static <T> List<T> copy(List<T> values) {
    return values != null ? new ArrayList<>(values) : new ArrayList<>();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getTaskType() {
    return taskType;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public CycleSpec getCycle() {
    return cycle;
  }

  public AssigneeMode getAssigneeMode() {
    return assigneeMode;
  }

  public List<UUID> getAssigneeIds() {
    return assigneeIds != null ? assigneeIds : List.of();
  }

  public List<UUID> getDepartmentIds() {
    return departmentIds != null ? departmentIds : List.of();
  }

  public List<UUID> getOrganizationIds() {
    return organizationIds != null ? organizationIds : List.of();
  }

  public UUID getCollectionPointId() {
    return collectionPointId;
  }

  public List<UUID> getCollectionPointIds() {
    return collectionPointIds != null ? collectionPointIds : List.of();
  }

  public List<String> getTargetPointTypes() {
    return targetPointTypes != null ? targetPointTypes : List.of();
  }

  public ScheduleMode getScheduleMode() {
    return scheduleMode;
  }

  public Instant getLastRunAt() {
    return lastRunAt;
  }

  public Instant getNextRunAt() {
    return nextRunAt;
  }

  public boolean isActive() {
    return active;
  }

  public UUID getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
