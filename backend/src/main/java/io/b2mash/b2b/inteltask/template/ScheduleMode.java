package io.b2mash.b2b.inteltask.template;

/**
 * Whether a point-targeting template follows its own cycle or inherits each collection point's
 * dispatch schedule.
 */
public enum ScheduleMode {
  TEMPLATE_OVERRIDE,
  POINT_DEFAULT
}
