package io.b2mash.b2b.inteltask.group;

import io.b2mash.b2b.inteltask.rule.CompletionPolicy;
import io.b2mash.b2b.inteltask.rule.QuorumPolicy;

/** What a completion inside a task group should trigger. */
public enum GroupCompletionDecision {
  NONE,
  CLOSE,
  CLOSE_AND_COMPLETE_REST;

  /**
   * Decides from the policy and the current counts. ANY_ONE and QUORUM force-complete the
   * remaining tasks once their threshold is met; ALL only closes when nothing is left.
   */
  public static GroupCompletionDecision decide(
      CompletionPolicy policy, QuorumPolicy quorum, int completed, int total) {
    if (total <= 0 || policy == null) {
      return NONE;
    }
    return switch (policy) {
      case EACH -> NONE;
      case ALL -> completed >= total ? CLOSE : NONE;
      case ANY_ONE -> thresholdReached(1, completed, total);
      case QUORUM -> thresholdReached(quorum.resolve(total), completed, total);
    };
  }

  private static GroupCompletionDecision thresholdReached(int required, int completed, int total) {
    if (completed < required) {
      return NONE;
    }
    return completed >= total ? CLOSE : CLOSE_AND_COMPLETE_REST;
  }
}
