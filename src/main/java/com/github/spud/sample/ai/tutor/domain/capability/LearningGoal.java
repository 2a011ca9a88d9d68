package com.github.spud.sample.ai.tutor.domain.capability;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 学习目标快照，会话创建时拷贝一份，之后不再变化
 */
@Value
@Builder
@Jacksonized
public class LearningGoal {

  String id;
  String description;
  String masteryCriteria;
  int order;
}
