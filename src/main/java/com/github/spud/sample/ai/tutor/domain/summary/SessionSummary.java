package com.github.spud.sample.ai.tutor.domain.summary;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 会话总结，只在 SUMMARIZING 阶段生成一次
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SessionSummary {

  String sessionId;
  String moduleName;
  int goalsCompleted;
  int totalGoals;
  int totalQuestions;
  int totalExchanges;
  double avgInitialUnderstanding;
  double avgFinalUnderstanding;
  double understandingImprovement;
  List<String> keyMisconceptions;
  List<String> keyBreakthroughs;
  List<GoalSummary> goalSummaries;
  Instant sessionStartedAt;
  Instant completedAt;
  double sessionDurationSeconds;
  String narrative;
}
