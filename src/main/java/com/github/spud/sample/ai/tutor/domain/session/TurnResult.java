package com.github.spud.sample.ai.tutor.domain.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TurnResult {

  String sessionId;
  TurnPhase phase;
  String currentGoalId;
  String currentGoalDescription;
  Integer currentQuestionIndex;
  String currentQuestionText;
  String tutorMessage;
  Double latestUnderstandingScore;
  int goalsCompleted;
  int goalsRemaining;
}
