package com.github.spud.sample.ai.tutor.domain.session;

import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 会话状态快照
 */
@Value
@Builder
@Jacksonized
public class SessionStateView {

  String sessionId;
  String moduleId;
  String moduleName;
  ProgressPhase phase;
  TutorPhase tutorPhase;
  int totalGoals;
  int goalsCompleted;
  int goalsRemaining;
  String currentGoalId;
  String currentGoalDescription;
  Integer currentQuestionIndex;
  String currentQuestionText;
  Double latestUnderstandingScore;
  List<GoalProgressRow> goals;
  Instant sessionStartedAt;
  double elapsedSeconds;

  @Value
  @Builder
  @Jacksonized
  public static class GoalProgressRow {

    String goalId;
    String description;
    boolean completed;
    int questionsCount;
    int currentQuestionIndex;
    Double initialUnderstanding;
    Double finalUnderstanding;
  }
}
