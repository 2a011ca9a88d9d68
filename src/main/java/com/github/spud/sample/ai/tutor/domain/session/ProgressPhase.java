package com.github.spud.sample.ai.tutor.domain.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 会话状态查询中对外的粗粒度阶段
 */
public enum ProgressPhase {
  INITIALIZING,
  IN_PROGRESS,
  COMPLETE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ProgressPhase fromValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}
