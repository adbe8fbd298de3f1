package io.b2mash.b2b.inteltask.template;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.inteltask.TestcontainersConfiguration;
import io.b2mash.b2b.inteltask.schedule.CycleSpec;
import io.b2mash.b2b.inteltask.task.TaskPriority;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class TaskTemplateRepositoryIntegrationTest {

  private static final Instant NOW = Instant.parse("2031-02-01T09:00:00Z");

  @Autowired private TaskTemplateRepository templateRepository;

  @Test
  void findSchedulable_excludesTemplateWhoseWindowEndsNow() {
    var endsNow = save(NOW.minusSeconds(86_400), NOW);
    var endsLater = save(NOW.minusSeconds(86_400), NOW.plusSeconds(1));
    var startsNow = save(NOW, null);
    var startsLater = save(NOW.plusSeconds(1), null);

    var schedulable = templateRepository.findSchedulable(NOW).stream().map(TaskTemplate::getId);

    assertThat(schedulable)
        .contains(endsLater.getId(), startsNow.getId())
        .doesNotContain(endsNow.getId(), startsLater.getId());
  }

  private TaskTemplate save(Instant activeFrom, Instant activeUntil) {
    return templateRepository.save(
        new TaskTemplate(
            "Window " + UUID.randomUUID(),
            null,
            "PRICE_REPORT",
            TaskPriority.LOW,
            CycleSpec.daily(540, 600).withActiveWindow(activeFrom, activeUntil),
            AssigneeMode.MANUAL,
            null));
  }
}
