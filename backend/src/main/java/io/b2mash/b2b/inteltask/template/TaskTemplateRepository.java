package io.b2mash.b2b.inteltask.template;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskTemplateRepository extends JpaRepository<TaskTemplate, UUID> {

  /**
   * Active templates whose activation window contains {@code now}, in the order the scheduler
   * processes them. Templates that have never been scheduled sort last.
   */
  @Query(
      """
      SELECT t FROM TaskTemplate t
      WHERE t.active = true
        AND (t.cycle.activeFrom IS NULL OR t.cycle.activeFrom <= :now)
        AND (t.cycle.activeUntil IS NULL OR t.cycle.activeUntil > :now)
      ORDER BY t.nextRunAt ASC NULLS LAST, t.createdAt ASC
      """)
  List<TaskTemplate> findSchedulable(@Param("now") Instant now);
}
