package com.github.spud.sample.ai.tutor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 问题期望的认知深度
 */
public enum QuestionDepth {
  RECALL,
  UNDERSTAND,
  APPLY,
  ANALYZE;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * 宽松解析，无法识别的值一律视为 UNDERSTAND
   */
  @JsonCreator
  public static QuestionDepth fromText(String text) {
    if (text == null || text.isBlank()) {
      return UNDERSTAND;
    }
    try {
      return valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return UNDERSTAND;
    }
  }
}
