package com.github.spud.sample.ai.tutor.domain.goal;

import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * 目标选择：未完成目标中 order 最小的一个，order 相同按原始顺序
 */
@Component
public class GoalSelector {

  public Optional<LearningGoal> select(TutorSession session) {
    Set<String> completed = new HashSet<>(session.getCompletedGoalIds());
    // Stream.min 在相等时保留先出现的元素
    return session.getLearningGoals().stream()
      .filter(goal -> !completed.contains(goal.getId()))
      .min(Comparator.comparingInt(LearningGoal::getOrder));
  }
}
