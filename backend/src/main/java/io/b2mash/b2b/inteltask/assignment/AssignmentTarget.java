package io.b2mash.b2b.inteltask.assignment;

import java.util.UUID;

/**
 * One resolved recipient of a task. Point and commodity are null for user-level distribution; a
 * null commodity on a point target means the point lists no commodities.
 */
public record AssignmentTarget(UUID userId, UUID collectionPointId, String commodity) {

  public static AssignmentTarget user(UUID userId) {
    return new AssignmentTarget(userId, null, null);
  }
}
