package com.github.spud.sample.ai.tutor.domain.capability;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * 课程模块及其有序的学习目标
 */
@Value
@Builder
public class CourseModule {

  String id;
  String name;
  List<LearningGoal> goals;
}
