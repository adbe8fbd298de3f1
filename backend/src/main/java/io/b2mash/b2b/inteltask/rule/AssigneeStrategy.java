package io.b2mash.b2b.inteltask.rule;

public enum AssigneeStrategy {
  POINT_OWNER,
  TEMPLATE_ASSIGNEES
}
