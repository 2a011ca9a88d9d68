package com.github.spud.sample.ai.tutor.infrastructure.persistence.repository;

import com.github.spud.sample.ai.tutor.infrastructure.persistence.entity.LearningModuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LearningModuleRepository extends JpaRepository<LearningModuleEntity, String> {

}
