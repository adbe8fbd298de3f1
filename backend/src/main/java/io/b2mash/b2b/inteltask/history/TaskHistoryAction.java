package io.b2mash.b2b.inteltask.history;

public enum TaskHistoryAction {
  SUBMIT,
  APPROVE,
  RETURN,
  COMPLETE,
  AUTO_COMPLETE
}
