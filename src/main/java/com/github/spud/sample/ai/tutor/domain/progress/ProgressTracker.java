package com.github.spud.sample.ai.tutor.domain.progress;

import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.evaluation.EvaluationResult;
import com.github.spud.sample.ai.tutor.domain.model.GoalProgress;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.model.UnderstandingPoint;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 进度跟踪：会话 → 目标 → 问题 → 交流 四层进度的读写
 * <p>
 * 写方法只由 {@code TutorSessionService} 在状态转换内部调用；读方法返回副本。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressTracker {

  private final Clock clock;

  // ===== 读 =====

  public int completedCount(TutorSession session) {
    return session.getCompletedGoalIds().size();
  }

  public int remainingCount(TutorSession session) {
    Set<String> completed = new HashSet<>(session.getCompletedGoalIds());
    return (int) session.getLearningGoals().stream()
      .filter(goal -> !completed.contains(goal.getId()))
      .count();
  }

  public Optional<GoalProgress> goalProgressView(TutorSession session, String goalId) {
    return Optional.ofNullable(session.progressOf(goalId))
      .map(progress -> JsonUtils.deepCopy(progress, GoalProgress.class));
  }

  public List<UnderstandingPoint> fullTrajectory(TutorSession session) {
    return List.copyOf(session.getUnderstandingTrajectory());
  }

  // ===== 写 =====

  /**
   * 把目标设为当前目标并记录开始时间
   */
  public void startGoal(TutorSession session, LearningGoal goal) {
    GoalProgress progress = requireProgress(session, goal.getId());
    if (progress.getStartedAt() == null) {
      progress.setStartedAt(now());
    }
    session.setCurrentGoalId(goal.getId());
    session.setCurrentQuestion(null);
  }

  public void assignQuestions(TutorSession session, List<StarterQuestion> questions) {
    GoalProgress progress = requireCurrentProgress(session);
    progress.setStarterQuestions(new ArrayList<>(questions));
    progress.setCurrentQuestionIndex(0);
    syncCurrentQuestion(session, progress);
  }

  /**
   * 记录一次评估：追加轨迹点、更新首末理解度、累计交流次数
   */
  public UnderstandingPoint recordEvaluation(TutorSession session, String learnerMessage,
    EvaluationResult evaluation) {
    GoalProgress progress = requireCurrentProgress(session);
    StarterQuestion question = progress.currentQuestion();
    if (question == null) {
      throw new IllegalStateException("No current question for goal " + progress.getGoalId());
    }

    UnderstandingPoint point = UnderstandingPoint.builder()
      .timestamp(now())
      .goalId(progress.getGoalId())
      .questionIndex(progress.getCurrentQuestionIndex())
      .exchangeNumber(question.getExchanges() + 1)
      .studentMessage(learnerMessage)
      .understandingScore(evaluation.getScore())
      .evaluationNotes(evaluation.getNotes())
      .misconceptions(List.copyOf(evaluation.getMisconceptions()))
      .breakthroughs(List.copyOf(evaluation.getBreakthroughs()))
      .build();

    session.getUnderstandingTrajectory().add(point);
    progress.getTrajectory().add(point);

    if (progress.getInitialUnderstanding() == null) {
      progress.setInitialUnderstanding(evaluation.getScore());
    }
    progress.setFinalUnderstanding(evaluation.getScore());
    question.setExchanges(question.getExchanges() + 1);

    session.setLatestEvaluation(evaluation);
    syncCurrentQuestion(session, progress);

    log.debug("Recorded evaluation for session {}: goal={}, question={}, exchange={}, score={}",
      session.getSessionId(), point.getGoalId(), point.getQuestionIndex(),
      point.getExchangeNumber(), point.getUnderstandingScore());
    return point;
  }

  /**
   * 当前问题标记为已解决并前进到下一题
   */
  public void advanceQuestion(TutorSession session) {
    GoalProgress progress = requireCurrentProgress(session);
    if (!progress.hasMoreQuestions()) {
      throw new IllegalStateException("No further question for goal " + progress.getGoalId());
    }
    progress.currentQuestion().setResolved(true);
    progress.setCurrentQuestionIndex(progress.getCurrentQuestionIndex() + 1);
    syncCurrentQuestion(session, progress);
  }

  /**
   * 完成当前目标并清空当前目标/问题
   */
  public void completeGoal(TutorSession session) {
    GoalProgress progress = requireCurrentProgress(session);
    StarterQuestion question = progress.currentQuestion();
    if (question != null) {
      question.setResolved(true);
    }
    progress.setCompleted(true);
    progress.setCompletedAt(now());
    if (!session.getCompletedGoalIds().contains(progress.getGoalId())) {
      session.getCompletedGoalIds().add(progress.getGoalId());
    }
    session.setCurrentGoalId(null);
    session.setCurrentQuestion(null);
  }

  private void syncCurrentQuestion(TutorSession session, GoalProgress progress) {
    StarterQuestion current = progress.currentQuestion();
    session.setCurrentQuestion(current != null ? current.copy() : null);
  }

  private GoalProgress requireCurrentProgress(TutorSession session) {
    if (session.getCurrentGoalId() == null) {
      throw new IllegalStateException("Session " + session.getSessionId() + " has no current goal");
    }
    return requireProgress(session, session.getCurrentGoalId());
  }

  private GoalProgress requireProgress(TutorSession session, String goalId) {
    GoalProgress progress = session.progressOf(goalId);
    if (progress == null) {
      throw new IllegalStateException("Unknown goal " + goalId + " in session " + session.getSessionId());
    }
    return progress;
  }

  private Instant now() {
    return clock.instant();
  }
}
