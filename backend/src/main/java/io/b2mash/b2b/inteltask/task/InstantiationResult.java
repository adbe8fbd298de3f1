package io.b2mash.b2b.inteltask.task;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of an instantiation.
 *
 * @param count tasks actually written; duplicates skipped by the idempotency index are excluded
 * @param assigneeIds distinct assignees of the batch, in target order
 * @param pointCount distinct collection points the batch covered
 */
public record InstantiationResult(int count, List<UUID> assigneeIds, int pointCount) {

  public static InstantiationResult empty() {
    return new InstantiationResult(0, List.of(), 0);
  }

  public InstantiationResult plus(InstantiationResult other) {
    var assignees = new LinkedHashSet<>(assigneeIds);
    assignees.addAll(other.assigneeIds);
    return new InstantiationResult(
        count + other.count, List.copyOf(assignees), pointCount + other.pointCount);
  }
}
