package io.b2mash.b2b.inteltask.history;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link TaskHistoryService#record(TaskHistoryRecord)}.
 *
 * @param taskId the task the entry belongs to (not a FK; the task may be deleted later)
 * @param operatorId acting user; null for system-initiated entries
 * @param action what happened
 * @param details extra context stored as JSONB; nullable
 */
public record TaskHistoryRecord(
    UUID taskId, UUID operatorId, TaskHistoryAction action, Map<String, Object> details) {

  public static TaskHistoryRecord of(UUID taskId, UUID operatorId, TaskHistoryAction action) {
    return new TaskHistoryRecord(taskId, operatorId, action, null);
  }
}
