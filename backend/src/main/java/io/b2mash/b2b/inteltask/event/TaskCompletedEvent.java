package io.b2mash.b2b.inteltask.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per task on the transition into COMPLETED, never on a repeated completion. Carries
 * ids only so it stays valid outside the publishing persistence context.
 *
 * @param taskGroupId group of the completed task; null when the task is not grouped
 * @param actorId completing user; null for server-initiated completions
 */
public record TaskCompletedEvent(
    UUID taskId,
    UUID taskGroupId,
    UUID templateId,
    UUID actorId,
    boolean late,
    Instant occurredAt) {}
