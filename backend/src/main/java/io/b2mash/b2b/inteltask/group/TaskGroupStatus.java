package io.b2mash.b2b.inteltask.group;

public enum TaskGroupStatus {
  OPEN,
  COMPLETED
}
