package io.b2mash.b2b.inteltask.task;

import java.time.Instant;
import java.util.UUID;

/** Column values of one task row written by the bulk insert. */
public record NewTaskRecord(
    String title,
    String description,
    String type,
    TaskPriority priority,
    Instant periodStart,
    Instant periodEnd,
    Instant dueAt,
    Instant deadline,
    String periodKey,
    UUID assigneeId,
    UUID assigneeOrgId,
    UUID assigneeDeptId,
    UUID templateId,
    UUID ruleId,
    UUID taskGroupId,
    UUID collectionPointId,
    String commodity,
    UUID createdBy) {}
