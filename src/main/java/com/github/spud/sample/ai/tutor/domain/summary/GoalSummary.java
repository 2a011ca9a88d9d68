package com.github.spud.sample.ai.tutor.domain.summary;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class GoalSummary {

  String goalId;
  String description;
  boolean completed;
  int questionsCount;
  int totalExchanges;
  Double initialUnderstanding;
  Double finalUnderstanding;
  Double durationSeconds;
}
