package io.b2mash.b2b.inteltask.template;

import java.util.List;
import java.util.UUID;

/** What a template execution would issue right now, computed without writing anything. */
public record DistributionPreview(
    int totalTasks,
    int totalAssignees,
    List<AssigneePreview> assignees,
    List<UnassignedPoint> unassignedPoints) {

  public record AssigneePreview(
      UUID userId,
      String userName,
      UUID organizationId,
      UUID departmentId,
      List<PointShare> collectionPoints,
      int taskCount) {}

  /**
   * @param commodity the allocated commodity, or null when the allocation covers every commodity
   * @param count tasks this allocation produces
   */
  public record PointShare(UUID pointId, String pointName, String commodity, int count) {}

  public record UnassignedPoint(UUID pointId, String name, String type) {}
}
