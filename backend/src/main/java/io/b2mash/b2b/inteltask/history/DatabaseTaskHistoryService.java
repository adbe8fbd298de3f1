package io.b2mash.b2b.inteltask.history;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Database-backed implementation of {@link TaskHistoryService}. */
@Service
public class DatabaseTaskHistoryService implements TaskHistoryService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseTaskHistoryService.class);

  private final TaskHistoryRepository historyRepository;

  public DatabaseTaskHistoryService(TaskHistoryRepository historyRepository) {
    this.historyRepository = historyRepository;
  }

  @Override
  @Transactional
  public void record(TaskHistoryRecord record) {
    historyRepository.save(new TaskHistory(record));
    log.debug(
        "Recorded task history: task={}, action={}, operator={}",
        record.taskId(),
        record.action(),
        record.operatorId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<TaskHistory> findByTask(UUID taskId) {
    return historyRepository.findByTaskIdOrderByCreatedAtAsc(taskId);
  }
}
