package com.github.spud.sample.ai.tutor.domain.session;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CreateSessionResult {

  String sessionId;
  String moduleId;
  String moduleName;

  /**
   * 欢迎语、目标介绍与第一个问题
   */
  String firstMessage;

  String currentGoalId;
  String currentGoalDescription;
  int totalGoals;
}
