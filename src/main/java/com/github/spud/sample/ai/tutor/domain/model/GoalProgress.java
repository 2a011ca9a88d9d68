package com.github.spud.sample.ai.tutor.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单个学习目标的进度
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalProgress {

  private String goalId;

  private String goalDescription;

  private Instant startedAt;

  private Instant completedAt;

  private boolean completed;

  @Builder.Default
  private List<StarterQuestion> starterQuestions = new ArrayList<>();

  private int currentQuestionIndex;

  private Double initialUnderstanding;

  private Double finalUnderstanding;

  @Builder.Default
  private List<UnderstandingPoint> trajectory = new ArrayList<>();

  public boolean hasMoreQuestions() {
    return currentQuestionIndex < starterQuestions.size() - 1;
  }

  public StarterQuestion currentQuestion() {
    if (starterQuestions.isEmpty()) {
      return null;
    }
    return starterQuestions.get(currentQuestionIndex);
  }

  public int totalExchanges() {
    return starterQuestions.stream().mapToInt(StarterQuestion::getExchanges).sum();
  }

  /**
   * 目标耗时（秒），未开始或未完成时为空
   */
  public Double durationSeconds() {
    if (startedAt == null || completedAt == null) {
      return null;
    }
    return Duration.between(startedAt, completedAt).toMillis() / 1000.0;
  }
}
