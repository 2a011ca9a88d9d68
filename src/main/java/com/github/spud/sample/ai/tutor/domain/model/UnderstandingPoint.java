package com.github.spud.sample.ai.tutor.domain.model;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 理解度轨迹上的一个点，每次评估产生一个，写入后不再修改
 */
@Value
@Builder
@Jacksonized
public class UnderstandingPoint {

  Instant timestamp;
  String goalId;
  int questionIndex;

  /**
   * 当前问题上的第几轮交流，从 1 开始
   */
  int exchangeNumber;

  String studentMessage;
  double understandingScore;
  String evaluationNotes;
  List<String> misconceptions;
  List<String> breakthroughs;
}
