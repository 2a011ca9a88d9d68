package com.github.spud.sample.ai.tutor.domain.model;

import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.evaluation.EvaluationResult;
import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import com.github.spud.sample.ai.tutor.domain.summary.SessionSummary;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 辅导会话，持久化的最小单元
 * <p>
 * 存储中只会出现 AWAITING_RESPONSE 与 DONE 两种阶段；其余阶段只存在于一次调用内部。 所有修改都经由
 * {@code TutorSessionService} 的状态转换完成。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TutorSession {

  private String sessionId;

  private String moduleId;

  private String moduleName;

  private TutorPhase phase;

  @Builder.Default
  private List<LearningGoal> learningGoals = new ArrayList<>();

  @Builder.Default
  private Map<String, GoalProgress> goalProgress = new LinkedHashMap<>();

  /**
   * 只追加、不重复
   */
  @Builder.Default
  private List<String> completedGoalIds = new ArrayList<>();

  private String currentGoalId;

  private StarterQuestion currentQuestion;

  private EvaluationResult latestEvaluation;

  @Builder.Default
  private Map<String, List<ContextPassage>> goalContexts = new LinkedHashMap<>();

  @Builder.Default
  private List<UnderstandingPoint> understandingTrajectory = new ArrayList<>();

  private Instant sessionStartedAt;

  private String modelOverride;

  @Builder.Default
  private List<DialogueTurn> dialogueHistory = new ArrayList<>();

  private SessionSummary summary;

  public Optional<LearningGoal> findGoal(String goalId) {
    if (goalId == null) {
      return Optional.empty();
    }
    return learningGoals.stream().filter(g -> goalId.equals(g.getId())).findFirst();
  }

  public GoalProgress progressOf(String goalId) {
    return goalProgress.get(goalId);
  }

  public List<ContextPassage> contextOf(String goalId) {
    return goalContexts.getOrDefault(goalId, List.of());
  }
}
