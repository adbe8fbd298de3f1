package io.b2mash.b2b.inteltask.history;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskHistoryRepository extends JpaRepository<TaskHistory, UUID> {

  List<TaskHistory> findByTaskIdOrderByCreatedAtAsc(UUID taskId);
}
