package io.b2mash.b2b.inteltask.schedule;

/** Recurrence pattern of a task template. */
public enum CycleType {
  DAILY,
  WEEKLY,
  MONTHLY,
  ONE_TIME
}
