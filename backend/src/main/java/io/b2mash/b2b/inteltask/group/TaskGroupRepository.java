package io.b2mash.b2b.inteltask.group;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskGroupRepository extends JpaRepository<TaskGroup, UUID> {

  Optional<TaskGroup> findByGroupKey(String groupKey);

  /**
   * Locks the group row until the transaction ends. Every transition of a grouped task takes this
   * lock before loading the task, so sibling completions and the cascade run one at a time.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT g FROM TaskGroup g WHERE g.id = :id")
  Optional<TaskGroup> findByIdForUpdate(@Param("id") UUID id);

  /** Creates the group unless one with the same key exists. Returns the number of rows written. */
  @Modifying
  @Query(
      nativeQuery = true,
      value =
          """
          INSERT INTO task_groups (id, template_id, rule_id, group_key, status, created_at,
                                   updated_at)
          VALUES (gen_random_uuid(), :templateId, :ruleId, :groupKey, 'OPEN', now(), now())
          ON CONFLICT (group_key) DO NOTHING
          """)
  int insertIfAbsent(
      @Param("templateId") UUID templateId,
      @Param("ruleId") UUID ruleId,
      @Param("groupKey") String groupKey);
}
