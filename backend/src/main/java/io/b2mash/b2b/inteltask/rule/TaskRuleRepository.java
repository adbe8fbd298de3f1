package io.b2mash.b2b.inteltask.rule;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskRuleRepository extends JpaRepository<TaskRule, UUID> {

  Optional<TaskRule> findFirstByTemplateIdAndActiveTrueOrderByCreatedAtDesc(UUID templateId);
}
