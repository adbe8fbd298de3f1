package io.b2mash.b2b.inteltask.task;

import java.util.Map;
import java.util.Set;

/** Task review lifecycle with validated transitions. */
public enum TaskStatus {
  PENDING,
  SUBMITTED,
  RETURNED,
  COMPLETED,
  OVERDUE;

  private static final Map<TaskStatus, Set<TaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          PENDING, Set.of(SUBMITTED, COMPLETED, OVERDUE),
          SUBMITTED, Set.of(COMPLETED, RETURNED),
          RETURNED, Set.of(SUBMITTED, COMPLETED),
          OVERDUE, Set.of(SUBMITTED, COMPLETED),
          COMPLETED, Set.of());

  /** Returns the set of statuses this status can transition to. */
  public Set<TaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  /** Returns true if transitioning from this status to the target is allowed. */
  public boolean canTransitionTo(TaskStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == COMPLETED;
  }
}
