package io.b2mash.b2b.inteltask.template;

/** How a template turns its static target fields into assignees. */
public enum AssigneeMode {
  MANUAL,
  BY_DEPARTMENT,
  BY_ORGANIZATION,
  ALL_ACTIVE,
  BY_COLLECTION_POINT
}
