package io.b2mash.b2b.inteltask.task;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT
}
