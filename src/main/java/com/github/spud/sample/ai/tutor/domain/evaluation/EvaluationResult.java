package com.github.spud.sample.ai.tutor.domain.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 一次理解度评估的结果
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationResult {

  /**
   * 分数达到该值即视为当前问题已解决
   */
  public static final double RESOLUTION_THRESHOLD = 0.7;

  /**
   * 评估不可用或无法解析时使用的中性分数
   */
  public static final double NEUTRAL_SCORE = 0.5;

  double score;
  String notes;
  List<String> misconceptions;
  List<String> breakthroughs;

  public boolean isResolved() {
    return score >= RESOLUTION_THRESHOLD;
  }

  public static EvaluationResult of(double rawScore, String notes, List<String> misconceptions,
    List<String> breakthroughs) {
    return EvaluationResult.builder()
      .score(clamp(rawScore))
      .notes(notes)
      .misconceptions(misconceptions == null ? List.of() : List.copyOf(misconceptions))
      .breakthroughs(breakthroughs == null ? List.of() : List.copyOf(breakthroughs))
      .build();
  }

  public static EvaluationResult neutral(String notes) {
    return of(NEUTRAL_SCORE, notes, List.of(), List.of());
  }

  static double clamp(double score) {
    if (Double.isNaN(score)) {
      return NEUTRAL_SCORE;
    }
    return Math.max(0.0, Math.min(1.0, score));
  }
}
