package io.b2mash.b2b.inteltask.template;

import io.b2mash.b2b.inteltask.task.InstantiationResult;
import java.util.List;
import java.util.UUID;

/** Human-readable outcome of a manual template execution. */
public record DistributionResult(
    int count, String message, List<UUID> assigneeIds, Integer pointCount) {

  static DistributionResult ofAssignees(InstantiationResult result) {
    return new DistributionResult(
        result.count(),
        "Distributed " + result.count() + " tasks",
        result.assigneeIds(),
        null);
  }

  static DistributionResult ofPoints(InstantiationResult result, int pointCount) {
    return new DistributionResult(
        result.count(),
        "Created " + result.count() + " tasks for " + pointCount + " collection points",
        result.assigneeIds(),
        pointCount);
  }

  static DistributionResult nothing(String message) {
    return new DistributionResult(0, message, List.of(), null);
  }
}
