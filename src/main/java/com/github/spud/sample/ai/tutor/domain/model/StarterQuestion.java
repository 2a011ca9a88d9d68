package com.github.spud.sample.ai.tutor.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 引导问题，每个目标生成一组，按 index 顺序讨论
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class StarterQuestion {

  private int index;

  private String questionText;

  /**
   * 去重后的目标概念，保持出现顺序
   */
  @Builder.Default
  private List<String> targetConcepts = new ArrayList<>();

  @Builder.Default
  private QuestionDepth expectedDepth = QuestionDepth.UNDERSTAND;

  private boolean resolved;

  private int exchanges;

  public StarterQuestion copy() {
    return toBuilder().targetConcepts(new ArrayList<>(targetConcepts)).build();
  }
}
