package io.b2mash.b2b.inteltask.rule;

/** How completion of one task in a group affects its siblings. */
public enum CompletionPolicy {
  /** Every task stands alone. */
  EACH,
  /** The first completion closes the group and completes the rest. */
  ANY_ONE,
  /** Reaching the quorum closes the group and completes the rest. */
  QUORUM,
  /** The group closes once every task is completed individually. */
  ALL
}
