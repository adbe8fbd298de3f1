package io.b2mash.b2b.inteltask.task;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * Multi-row insert for generated tasks. Rows that collide with the task idempotency index (same
 * template, assignee, period start, collection point and commodity) are skipped by the database,
 * which makes repeated or concurrent runs over the same period safe.
 */
@Repository
public class TaskBulkInsertRepository {

  // Postgres caps bind parameters per statement at 65535
  static final int MAX_ROWS_PER_STATEMENT = 1000;

  private static final String INSERT_PREFIX =
      """
      INSERT INTO intel_tasks
          (id, title, description, type, priority, status, period_start, period_end, due_at,
           deadline, period_key, assignee_id, assignee_org_id, assignee_dept_id, template_id,
           rule_id, task_group_id, collection_point_id, commodity, late, created_by, version,
           created_at, updated_at)
      VALUES
      """;

  private static final String ROW_VALUES =
      "(gen_random_uuid(), ?, ?, ?, ?, 'PENDING', ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?,"
          + " false, ?, 0, now(), now())";

  private static final String ON_CONFLICT = " ON CONFLICT DO NOTHING";

  private final JdbcClient jdbc;

  public TaskBulkInsertRepository(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  /** Inserts the records, skipping duplicates. Returns the number of rows actually written. */
  public int insertSkippingDuplicates(List<NewTaskRecord> records) {
    int inserted = 0;
    for (int from = 0; from < records.size(); from += MAX_ROWS_PER_STATEMENT) {
      var chunk = records.subList(from, Math.min(records.size(), from + MAX_ROWS_PER_STATEMENT));
      inserted += insertChunk(chunk);
    }
    return inserted;
  }

  private int insertChunk(List<NewTaskRecord> chunk) {
    var sql = new StringBuilder(INSERT_PREFIX);
    var params = new ArrayList<Object>(chunk.size() * 18);
    for (int i = 0; i < chunk.size(); i++) {
      if (i > 0) {
        sql.append(",\n");
      }
      sql.append(ROW_VALUES);
      addParams(params, chunk.get(i));
    }
    sql.append(ON_CONFLICT);
    return jdbc.sql(sql.toString()).params(params).update();
  }

  private static void addParams(List<Object> params, NewTaskRecord record) {
    params.add(record.title());
    params.add(record.description());
    params.add(record.type());
    params.add(record.priority() != null ? record.priority().name() : TaskPriority.MEDIUM.name());
    params.add(toTimestamp(record.periodStart()));
    params.add(toTimestamp(record.periodEnd()));
    params.add(toTimestamp(record.dueAt()));
    params.add(toTimestamp(record.deadline()));
    params.add(record.periodKey());
    params.add(record.assigneeId());
    params.add(record.assigneeOrgId());
    params.add(record.assigneeDeptId());
    params.add(record.templateId());
    params.add(record.ruleId());
    params.add(record.taskGroupId());
    params.add(record.collectionPointId());
    params.add(record.commodity());
    params.add(record.createdBy());
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }
}
