package com.github.spud.sample.ai.tutor.infrastructure.persistence.repository;

import com.github.spud.sample.ai.tutor.infrastructure.persistence.entity.LearningGoalEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LearningGoalRepository extends JpaRepository<LearningGoalEntity, String> {

  List<LearningGoalEntity> findByModuleIdOrderBySequenceNoAsc(String moduleId);

}
