package com.github.spud.sample.ai.tutor.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

@Getter
@Setter
@Entity
@Table(name = "learning_goal")
public class LearningGoalEntity {

  @Id
  @Size(max = 64)
  @Column(name = "goal_id", nullable = false, length = 64)
  private String goalId;

  @Size(max = 64)
  @NotNull
  @Column(name = "module_id", nullable = false, length = 64)
  private String moduleId;

  @NotNull
  @Column(name = "description", nullable = false, length = 2000)
  private String description;

  @Column(name = "mastery_criteria", length = 4000)
  private String masteryCriteria;

  @NotNull
  @ColumnDefault("0")
  @Column(name = "goal_order", nullable = false)
  private Integer goalOrder = 0;

  /**
   * 来源顺序，order 相同时按它排列
   */
  @NotNull
  @ColumnDefault("0")
  @Column(name = "sequence_no", nullable = false)
  private Integer sequenceNo = 0;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

}
