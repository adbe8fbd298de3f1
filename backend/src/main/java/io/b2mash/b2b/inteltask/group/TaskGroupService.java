package io.b2mash.b2b.inteltask.group;

import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TaskGroupService {

  private final TaskGroupRepository groupRepository;

  public TaskGroupService(TaskGroupRepository groupRepository) {
    this.groupRepository = groupRepository;
  }

  /**
   * Returns the group for the rule and period, creating it when absent. Concurrent callers for the
   * same key end up with the same row.
   */
  @Transactional
  public TaskGroup findOrCreate(UUID templateId, UUID ruleId, String periodKey) {
    String groupKey = TaskGroup.groupKey(ruleId, periodKey);
    var existing = groupRepository.findByGroupKey(groupKey);
    if (existing.isPresent()) {
      return existing.get();
    }
    groupRepository.insertIfAbsent(templateId, ruleId, groupKey);
    return groupRepository
        .findByGroupKey(groupKey)
        .orElseThrow(() -> new IllegalStateException("Task group " + groupKey + " not created"));
  }
}
