package io.b2mash.b2b.inteltask.schedule;

/**
 * Outcome of one scheduler tick.
 *
 * @param skipped true when another tick was still running and this one did no work
 */
public record TickSummary(boolean skipped, int templatesProcessed, int failures, int tasksCreated) {

  static TickSummary skippedTick() {
    return new TickSummary(true, 0, 0, 0);
  }
}
