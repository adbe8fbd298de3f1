package io.b2mash.b2b.inteltask.task;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskStatusTest {

  @Test
  void allowedTransitions_pending() {
    assertThat(TaskStatus.PENDING.allowedTransitions())
        .containsExactlyInAnyOrder(TaskStatus.SUBMITTED, TaskStatus.COMPLETED, TaskStatus.OVERDUE);
  }

  @Test
  void allowedTransitions_submitted() {
    assertThat(TaskStatus.SUBMITTED.allowedTransitions())
        .containsExactlyInAnyOrder(TaskStatus.COMPLETED, TaskStatus.RETURNED);
  }

  @Test
  void allowedTransitions_returnedAndOverdue() {
    assertThat(TaskStatus.RETURNED.allowedTransitions())
        .containsExactlyInAnyOrder(TaskStatus.SUBMITTED, TaskStatus.COMPLETED);
    assertThat(TaskStatus.OVERDUE.allowedTransitions())
        .containsExactlyInAnyOrder(TaskStatus.SUBMITTED, TaskStatus.COMPLETED);
  }

  @Test
  void completed_isTerminal() {
    assertThat(TaskStatus.COMPLETED.allowedTransitions()).isEmpty();
    assertThat(TaskStatus.COMPLETED.isTerminal()).isTrue();
  }

  @Test
  void canTransitionTo_self_returns_false() {
    for (TaskStatus status : TaskStatus.values()) {
      assertThat(status.canTransitionTo(status))
          .as("Self-transition should be disallowed for %s", status)
          .isFalse();
    }
  }
}
