package io.b2mash.b2b.inteltask.history;

import java.util.List;
import java.util.UUID;

/** Records and reads the per-task history trail. */
public interface TaskHistoryService {

  /**
   * Records a history entry within the current transaction. If the enclosing transaction rolls
   * back, the entry is rolled back too.
   */
  void record(TaskHistoryRecord record);

  List<TaskHistory> findByTask(UUID taskId);
}
