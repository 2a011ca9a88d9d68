package com.github.spud.sample.ai.tutor.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 一次回复调用结束时对外报告的阶段
 */
public enum TurnPhase {
  IN_PROGRESS,
  GOAL_COMPLETE,
  SESSION_COMPLETE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TurnPhase fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
