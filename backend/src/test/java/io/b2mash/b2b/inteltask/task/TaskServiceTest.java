package io.b2mash.b2b.inteltask.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.inteltask.event.TaskCompletedEvent;
import io.b2mash.b2b.inteltask.exception.ResourceNotFoundException;
import io.b2mash.b2b.inteltask.group.TaskGroupRepository;
import io.b2mash.b2b.inteltask.history.TaskHistoryAction;
import io.b2mash.b2b.inteltask.history.TaskHistoryRecord;
import io.b2mash.b2b.inteltask.history.TaskHistoryService;
import io.b2mash.b2b.inteltask.testutil.TestTasks;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

  private static final UUID ACTOR = UUID.randomUUID();
  private static final Instant FAR_FUTURE = Instant.parse("2999-01-01T00:00:00Z");

  @Mock private TaskRepository taskRepository;
  @Mock private TaskGroupRepository groupRepository;
  @Mock private TaskHistoryService historyService;
  @Mock private ApplicationEventPublisher eventPublisher;
  @InjectMocks private TaskService service;

  @Test
  void complete_publishesCompletionEventOnce() {
    var groupId = UUID.randomUUID();
    var task = TestTasks.pending(FAR_FUTURE, groupId);
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
    when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

    service.complete(task.getId(), ACTOR, null);

    var event = ArgumentCaptor.forClass(TaskCompletedEvent.class);
    verify(eventPublisher).publishEvent(event.capture());
    assertThat(event.getValue().taskId()).isEqualTo(task.getId());
    assertThat(event.getValue().taskGroupId()).isEqualTo(groupId);
    assertThat(event.getValue().late()).isFalse();

    var history = ArgumentCaptor.forClass(TaskHistoryRecord.class);
    verify(historyService).record(history.capture());
    assertThat(history.getValue().action()).isEqualTo(TaskHistoryAction.COMPLETE);
  }

  @Test
  void complete_alreadyCompletedTask_isNoOp() {
    var task = TestTasks.pending(FAR_FUTURE);
    task.complete(ACTOR, null, Instant.now());
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

    var result = service.complete(task.getId(), UUID.randomUUID(), UUID.randomUUID());

    assertThat(result.getCompletedBy()).isEqualTo(ACTOR);
    verify(taskRepository, never()).save(any());
    verifyNoInteractions(eventPublisher, historyService);
  }

  @Test
  void review_approved_completesAndPublishes() {
    var task = TestTasks.pending(FAR_FUTURE);
    task.submit();
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
    when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

    var reviewed = service.review(task.getId(), true, "ok", ACTOR);

    assertThat(reviewed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
    verify(eventPublisher).publishEvent(any(TaskCompletedEvent.class));
  }

  @Test
  void review_rejected_returnsTaskWithoutPublishing() {
    var task = TestTasks.pending(FAR_FUTURE);
    task.submit();
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
    when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

    var reviewed = service.review(task.getId(), false, "redo", ACTOR);

    assertThat(reviewed.getStatus()).isEqualTo(TaskStatus.RETURNED);
    assertThat(reviewed.getReviewComment()).isEqualTo("redo");
    verify(eventPublisher, never()).publishEvent(any(TaskCompletedEvent.class));
  }

  @Test
  void complete_groupedTask_locksGroupBeforeLoadingTask() {
    var groupId = UUID.randomUUID();
    var task = TestTasks.pending(FAR_FUTURE, groupId);
    when(taskRepository.findTaskGroupIdById(task.getId())).thenReturn(Optional.of(groupId));
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
    when(taskRepository.save(any(Task.class))).thenAnswer(invocation -> invocation.getArgument(0));

    service.complete(task.getId(), ACTOR, null);

    var order = inOrder(groupRepository, taskRepository);
    order.verify(groupRepository).findByIdForUpdate(groupId);
    order.verify(taskRepository).findById(task.getId());
  }

  @Test
  void review_approvalOfTaskCompletedByGroupCascade_isNoOp() {
    var groupId = UUID.randomUUID();
    var task = TestTasks.pending(FAR_FUTURE, groupId);
    task.submit();
    task.forceComplete(Instant.now());
    when(taskRepository.findTaskGroupIdById(task.getId())).thenReturn(Optional.of(groupId));
    when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

    var reviewed = service.review(task.getId(), true, "ok", ACTOR);

    assertThat(reviewed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
    assertThat(reviewed.getCompletedBy()).isNull();
    verify(taskRepository, never()).save(any());
    verifyNoInteractions(eventPublisher, historyService);
  }

  @Test
  void getTask_unknownId_throwsNotFound() {
    var taskId = UUID.randomUUID();
    when(taskRepository.findById(taskId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getTask(taskId))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
