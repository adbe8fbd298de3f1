package io.b2mash.b2b.inteltask.testutil;

import io.b2mash.b2b.inteltask.task.NewTaskRecord;
import io.b2mash.b2b.inteltask.task.Task;
import io.b2mash.b2b.inteltask.task.TaskPriority;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/** Builds tasks in PENDING state for unit tests. */
public final class TestTasks {

  private TestTasks() {}

  public static NewTaskRecord record(UUID assigneeId, Instant dueAt, UUID taskGroupId) {
    Instant periodStart = dueAt != null ? dueAt.truncatedTo(ChronoUnit.DAYS) : null;
    return new NewTaskRecord(
        "Market prices [2024-03-01]",
        null,
        "PRICE_REPORT",
        TaskPriority.MEDIUM,
        periodStart,
        periodStart != null ? periodStart.plus(1, ChronoUnit.DAYS).minusMillis(1) : null,
        dueAt,
        dueAt,
        "2024-03-01",
        assigneeId,
        null,
        null,
        UUID.randomUUID(),
        null,
        taskGroupId,
        null,
        null,
        null);
  }

  public static Task pending(Instant dueAt) {
    return pending(dueAt, null);
  }

  public static Task pending(Instant dueAt, UUID taskGroupId) {
    return TestEntityIds.withRandomId(new Task(record(UUID.randomUUID(), dueAt, taskGroupId)));
  }
}
