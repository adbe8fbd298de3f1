package io.b2mash.b2b.inteltask.rule;

/** Selects the collection points a POINT_OWNER rule distributes to. */
public enum RuleScopeType {
  /** The template's own point configuration. */
  TEMPLATE,
  /** Point ids listed under {@code pointIds} in the scope query. */
  POINTS,
  /** Point types listed under {@code pointTypes} in the scope query. */
  POINT_TYPE
}
