package io.b2mash.b2b.inteltask.schedule;

/** Lifecycle of a single scheduler tick. */
public enum SchedulerState {
  IDLE,
  RUNNING
}
