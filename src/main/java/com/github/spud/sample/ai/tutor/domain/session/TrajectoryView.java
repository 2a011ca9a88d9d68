package com.github.spud.sample.ai.tutor.domain.session;

import com.github.spud.sample.ai.tutor.domain.model.QuestionDepth;
import com.github.spud.sample.ai.tutor.domain.model.UnderstandingPoint;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 理解度轨迹：全部评估点与按目标的汇总
 */
@Value
@Builder
@Jacksonized
public class TrajectoryView {

  String sessionId;
  List<UnderstandingPoint> trajectory;
  List<GoalTrajectory> goals;

  @Value
  @Builder
  @Jacksonized
  public static class GoalTrajectory {

    String goalId;
    String description;
    boolean completed;
    Double initialUnderstanding;
    Double finalUnderstanding;
    int points;
    List<QuestionRow> questions;
  }

  @Value
  @Builder
  @Jacksonized
  public static class QuestionRow {

    int index;
    String questionText;
    QuestionDepth expectedDepth;
    boolean resolved;
    int exchanges;
  }
}
