package io.b2mash.b2b.inteltask.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.member.Member;
import io.b2mash.b2b.inteltask.member.MemberRepository;
import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.schedule.PeriodInfo;
import io.b2mash.b2b.inteltask.template.AssigneeMode;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.template.TaskTemplateRepository;
import io.b2mash.b2b.inteltask.testutil.TestEntityIds;
import io.b2mash.b2b.inteltask.testutil.TestTemplates;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskInstantiationServiceTest {

  private static final Instant RUN_AT = Instant.parse("2024-03-01T09:00:00Z");
  private static final PeriodInfo PERIOD =
      new PeriodInfo(
          LocalDateTime.of(2024, 3, 1, 0, 0).atZone(ZoneOffset.UTC),
          LocalDateTime.of(2024, 3, 1, 23, 59, 59, 999_000_000).atZone(ZoneOffset.UTC),
          LocalDateTime.of(2024, 3, 1, 10, 0).atZone(ZoneOffset.UTC),
          "2024-03-01",
          540);

  @Mock private TaskBulkInsertRepository bulkInsertRepository;
  @Mock private MemberRepository memberRepository;
  @Mock private TaskTemplateRepository templateRepository;
  @InjectMocks private TaskInstantiationService service;

  @Test
  void instantiate_buildsOneRecordPerTargetWithMemberSnapshot() {
    var template = TestTemplates.template(CycleSpec.daily(540, 600), AssigneeMode.MANUAL);
    var org = UUID.randomUUID();
    var dept = UUID.randomUUID();
    var member = TestEntityIds.withRandomId(new Member("Alice", org, dept));
    var pointId = UUID.randomUUID();
    var targets =
        List.of(
            new AssignmentTarget(member.getId(), pointId, "rice"),
            new AssignmentTarget(member.getId(), pointId, "maize"));
    when(memberRepository.findByIdIn(any())).thenReturn(List.of(member));
    when(bulkInsertRepository.insertSkippingDuplicates(anyList())).thenReturn(2);

    var result =
        service.instantiate(InstantiationRequest.of(template, targets, PERIOD, RUN_AT, null));

    assertThat(result.count()).isEqualTo(2);
    assertThat(result.assigneeIds()).containsExactly(member.getId());
    assertThat(result.pointCount()).isEqualTo(1);

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<NewTaskRecord>> records = ArgumentCaptor.forClass(List.class);
    verify(bulkInsertRepository).insertSkippingDuplicates(records.capture());
    assertThat(records.getValue())
        .extracting(NewTaskRecord::title)
        .containsExactly("Market prices [2024-03-01] [rice]", "Market prices [2024-03-01] [maize]");
    var first = records.getValue().get(0);
    assertThat(first.assigneeOrgId()).isEqualTo(org);
    assertThat(first.assigneeDeptId()).isEqualTo(dept);
    assertThat(first.dueAt()).isEqualTo(Instant.parse("2024-03-01T10:00:00Z"));
    assertThat(first.deadline()).isEqualTo(first.dueAt());
    assertThat(first.periodStart()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    assertThat(first.priority()).isEqualTo(TaskPriority.HIGH);
    assertThat(first.templateId()).isEqualTo(template.getId());

    assertThat(template.getLastRunAt()).isEqualTo(RUN_AT);
    verify(templateRepository).save(template);
  }

  @Test
  void instantiate_countsOnlyRowsActuallyInserted() {
    var template = TestTemplates.template(CycleSpec.daily(540, 600), AssigneeMode.MANUAL);
    var targets =
        List.of(AssignmentTarget.user(UUID.randomUUID()), AssignmentTarget.user(UUID.randomUUID()));
    when(memberRepository.findByIdIn(any())).thenReturn(List.of());
    when(bulkInsertRepository.insertSkippingDuplicates(anyList())).thenReturn(0);

    var result =
        service.instantiate(InstantiationRequest.of(template, targets, PERIOD, RUN_AT, null));

    assertThat(result.count()).isZero();
    assertThat(result.assigneeIds()).hasSize(2);
  }

  @Test
  void instantiate_withoutTargets_writesNothing() {
    TaskTemplate template = TestTemplates.template(CycleSpec.daily(540, 600), AssigneeMode.MANUAL);

    var result =
        service.instantiate(InstantiationRequest.of(template, List.of(), PERIOD, RUN_AT, null));

    assertThat(result.count()).isZero();
    assertThat(template.getLastRunAt()).isNull();
    verifyNoInteractions(bulkInsertRepository, memberRepository, templateRepository);
  }

  @Test
  void taskTitle_appendsCommodityOnlyWhenPresent() {
    assertThat(TaskInstantiationService.taskTitle("Prices", "2024-W10", null))
        .isEqualTo("Prices [2024-W10]");
    assertThat(TaskInstantiationService.taskTitle("Prices", "2024-03", "rice"))
        .isEqualTo("Prices [2024-03] [rice]");
  }
}
