package io.b2mash.b2b.inteltask.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.inteltask.assignment.AssigneeResolver;
import io.b2mash.b2b.inteltask.assignment.AssignmentTarget;
import io.b2mash.b2b.inteltask.collectionpoint.CollectionPoint;
import io.b2mash.b2b.inteltask.group.TaskGroup;
import io.b2mash.b2b.inteltask.group.TaskGroupService;
import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.schedule.PeriodCalculator;
import io.b2mash.b2b.inteltask.schedule.ScheduleClock;
import io.b2mash.b2b.inteltask.schedule.TaskSchedulerProperties;
import io.b2mash.b2b.inteltask.task.InstantiationRequest;
import io.b2mash.b2b.inteltask.task.InstantiationResult;
import io.b2mash.b2b.inteltask.task.TaskInstantiationService;
import io.b2mash.b2b.inteltask.template.AssigneeMode;
import io.b2mash.b2b.inteltask.template.TaskTemplate;
import io.b2mash.b2b.inteltask.testutil.TestEntityIds;
import io.b2mash.b2b.inteltask.testutil.TestTemplates;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RuleDistributionServiceTest {

  // Wednesday, 10:00 UTC
  private static final Instant NOW = Instant.parse("2024-03-06T10:00:00Z");

  @Mock private AssigneeResolver assigneeResolver;
  @Mock private TaskGroupService groupService;
  @Mock private TaskInstantiationService instantiationService;

  private RuleDistributionService service;
  private TaskTemplate template;

  @BeforeEach
  void setUp() {
    var clock = new ScheduleClock(new TaskSchedulerProperties(true, 300_000, "UTC", 600_000, 0));
    service =
        new RuleDistributionService(
            assigneeResolver, new PeriodCalculator(), groupService, instantiationService, clock);
    template = TestTemplates.template(CycleSpec.daily(540, 1020), AssigneeMode.MANUAL);
  }

  @Test
  void closedDispatchDay_issuesNothing() {
    var rule = rule(RuleScopeType.POINTS, CompletionPolicy.EACH);
    rule.updateDispatch(List.of(1), List.of(), 540);

    assertThat(service.distribute(template, rule, NOW).count()).isZero();
    verifyNoInteractions(assigneeResolver, instantiationService);
  }

  @Test
  void beforeDispatchMinute_issuesNothing() {
    var rule = rule(RuleScopeType.POINTS, CompletionPolicy.EACH);
    rule.updateDispatch(List.of(), List.of(), 660);

    assertThat(service.distribute(template, rule, NOW).count()).isZero();
    verifyNoInteractions(assigneeResolver, instantiationService);
  }

  @Test
  void pointScope_skipsInvalidIdsAndGroupsByPeriod() {
    var rule = rule(RuleScopeType.POINTS, CompletionPolicy.QUORUM);
    var pointId = UUID.randomUUID();
    rule.updateScopeQuery(Map.of("pointIds", List.of(pointId.toString(), "not-a-uuid")));
    var point =
        TestEntityIds.withId(new CollectionPoint("CP-1", "Market", "MARKET", null), pointId);
    var targets = List.of(new AssignmentTarget(UUID.randomUUID(), pointId, null));
    var group =
        TestEntityIds.withRandomId(
            new TaskGroup(template.getId(), rule.getId(), TaskGroup.groupKey(rule.getId(), "x")));
    when(assigneeResolver.resolvePointsByIds(List.of(pointId))).thenReturn(List.of(point));
    when(assigneeResolver.resolvePointTargets(List.of(point))).thenReturn(targets);
    when(groupService.findOrCreate(template.getId(), rule.getId(), "2024-03-06")).thenReturn(group);
    when(instantiationService.instantiate(any()))
        .thenReturn(new InstantiationResult(1, List.of(targets.get(0).userId()), 1));

    var result = service.distribute(template, rule, NOW);

    assertThat(result.count()).isEqualTo(1);
    var request = ArgumentCaptor.forClass(InstantiationRequest.class);
    verify(instantiationService).instantiate(request.capture());
    assertThat(request.getValue().ruleId()).isEqualTo(rule.getId());
    assertThat(request.getValue().taskGroupId()).isEqualTo(group.getId());
    assertThat(request.getValue().period().periodKey()).isEqualTo("2024-03-06");
    assertThat(request.getValue().runAt()).isEqualTo(NOW);
  }

  @Test
  void closedGroup_issuesNothingForLateTargets() {
    var rule = rule(RuleScopeType.POINT_TYPE, CompletionPolicy.ANY_ONE);
    rule.updateScopeQuery(Map.of("pointTypes", List.of("MARKET")));
    var point = TestEntityIds.withRandomId(new CollectionPoint("CP-2", "Depot", "MARKET", null));
    var targets = List.of(new AssignmentTarget(UUID.randomUUID(), point.getId(), null));
    var group =
        TestEntityIds.withRandomId(
            new TaskGroup(
                template.getId(), rule.getId(), TaskGroup.groupKey(rule.getId(), "2024-03-06")));
    group.close(NOW.minusSeconds(600));
    when(assigneeResolver.resolvePointsByType(List.of("MARKET"))).thenReturn(List.of(point));
    when(assigneeResolver.resolvePointTargets(List.of(point))).thenReturn(targets);
    when(groupService.findOrCreate(template.getId(), rule.getId(), "2024-03-06")).thenReturn(group);

    var result = service.distribute(template, rule, NOW);

    assertThat(result.count()).isZero();
    verifyNoInteractions(instantiationService);
  }

  @Test
  void templateAssigneeStrategy_distributesToUsersWithoutGroup() {
    var rule =
        TestEntityIds.withRandomId(
            new TaskRule(
                template.getId(),
                RuleScopeType.TEMPLATE,
                AssigneeStrategy.TEMPLATE_ASSIGNEES,
                CompletionPolicy.EACH));
    var userId = UUID.randomUUID();
    when(assigneeResolver.resolveAssignees(template, null)).thenReturn(List.of(userId));
    when(instantiationService.instantiate(any()))
        .thenReturn(new InstantiationResult(1, List.of(userId), 0));

    service.distribute(template, rule, NOW);

    var request = ArgumentCaptor.forClass(InstantiationRequest.class);
    verify(instantiationService).instantiate(request.capture());
    assertThat(request.getValue().targets()).containsExactly(AssignmentTarget.user(userId));
    assertThat(request.getValue().taskGroupId()).isNull();
    verifyNoInteractions(groupService);
  }

  @Test
  void noTargets_issuesNothing() {
    var rule = rule(RuleScopeType.POINT_TYPE, CompletionPolicy.ALL);
    rule.updateScopeQuery(Map.of("pointTypes", List.of("MARKET")));
    when(assigneeResolver.resolvePointsByType(List.of("MARKET"))).thenReturn(List.of());
    when(assigneeResolver.resolvePointTargets(List.of())).thenReturn(List.of());

    assertThat(service.distribute(template, rule, NOW).count()).isZero();
    verifyNoInteractions(instantiationService, groupService);
  }

  private TaskRule rule(RuleScopeType scope, CompletionPolicy policy) {
    return TestEntityIds.withRandomId(
        new TaskRule(template.getId(), scope, AssigneeStrategy.POINT_OWNER, policy));
  }
}
