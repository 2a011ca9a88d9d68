package com.github.spud.sample.ai.tutor.infrastructure.persistence;

import com.github.spud.sample.ai.tutor.domain.capability.CourseModule;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.capability.ModuleCatalog;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.entity.LearningGoalEntity;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.repository.LearningGoalRepository;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.repository.LearningModuleRepository;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 从 tutor_module / learning_goal 表读取模块，目标按 sequence_no 给出来源顺序
 */
@Component
@RequiredArgsConstructor
public class JpaModuleCatalog implements ModuleCatalog {

  private final LearningModuleRepository moduleRepository;
  private final LearningGoalRepository goalRepository;

  @Override
  @Transactional(readOnly = true)
  public Optional<CourseModule> findModule(String moduleId) {
    return moduleRepository.findById(moduleId)
      .map(module -> {
        List<LearningGoal> goals = goalRepository.findByModuleIdOrderBySequenceNoAsc(moduleId)
          .stream()
          .map(this::toGoal)
          .toList();
        return CourseModule.builder()
          .id(module.getModuleId())
          .name(module.getName())
          .goals(goals)
          .build();
      });
  }

  private LearningGoal toGoal(LearningGoalEntity entity) {
    return LearningGoal.builder()
      .id(entity.getGoalId())
      .description(entity.getDescription())
      .masteryCriteria(entity.getMasteryCriteria())
      .order(entity.getGoalOrder() != null ? entity.getGoalOrder() : 0)
      .build();
  }
}
