package com.github.spud.sample.ai.tutor.domain.summary;

import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationPurpose;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationRequest;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.capability.TutorGenerator;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotCompleteException;
import com.github.spud.sample.ai.tutor.domain.model.GoalProgress;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.model.UnderstandingPoint;
import com.github.spud.sample.ai.tutor.domain.progress.ProgressTracker;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 会话总结：汇总统计数据，并用一次生成调用写出总结叙述
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SummaryGenerator {

  private final TutorGenerator generator;
  private final ProgressTracker progressTracker;
  private final TutorPrompts prompts;
  private final TutorProperties properties;

  /**
   * @throws SessionNotCompleteException 仍有未完成的目标
   */
  public SessionSummary summarize(TutorSession session, Instant completedAt) {
    int remaining = progressTracker.remainingCount(session);
    if (remaining > 0) {
      throw new SessionNotCompleteException(session.getSessionId(), remaining);
    }

    SessionSummary stats = computeStatistics(session, completedAt);
    return stats.toBuilder()
      .narrative(narrate(stats, session.getModelOverride()))
      .build();
  }

  SessionSummary computeStatistics(TutorSession session, Instant completedAt) {
    int totalQuestions = 0;
    int totalExchanges = 0;
    List<Double> initialScores = new ArrayList<>();
    List<Double> finalScores = new ArrayList<>();
    List<GoalSummary> goalSummaries = new ArrayList<>();

    for (LearningGoal goal : session.getLearningGoals()) {
      GoalProgress progress = session.progressOf(goal.getId());
      if (progress == null) {
        continue;
      }
      totalQuestions += progress.getStarterQuestions().size();
      totalExchanges += progress.totalExchanges();
      if (progress.getInitialUnderstanding() != null) {
        initialScores.add(progress.getInitialUnderstanding());
      }
      if (progress.getFinalUnderstanding() != null) {
        finalScores.add(progress.getFinalUnderstanding());
      }
      goalSummaries.add(GoalSummary.builder()
        .goalId(goal.getId())
        .description(goal.getDescription())
        .completed(progress.isCompleted())
        .questionsCount(progress.getStarterQuestions().size())
        .totalExchanges(progress.totalExchanges())
        .initialUnderstanding(progress.getInitialUnderstanding())
        .finalUnderstanding(progress.getFinalUnderstanding())
        .durationSeconds(progress.durationSeconds())
        .build());
    }

    double avgInitial = mean(initialScores);
    double avgFinal = mean(finalScores);
    Instant startedAt = session.getSessionStartedAt() != null
      ? session.getSessionStartedAt() : completedAt;
    List<UnderstandingPoint> trajectory = progressTracker.fullTrajectory(session);

    return SessionSummary.builder()
      .sessionId(session.getSessionId())
      .moduleName(session.getModuleName())
      .goalsCompleted(progressTracker.completedCount(session))
      .totalGoals(session.getLearningGoals().size())
      .totalQuestions(totalQuestions)
      .totalExchanges(totalExchanges)
      .avgInitialUnderstanding(avgInitial)
      .avgFinalUnderstanding(avgFinal)
      .understandingImprovement(avgFinal - avgInitial)
      .keyMisconceptions(topDistinct(trajectory, UnderstandingPoint::getMisconceptions))
      .keyBreakthroughs(topDistinct(trajectory, UnderstandingPoint::getBreakthroughs))
      .goalSummaries(goalSummaries)
      .sessionStartedAt(startedAt)
      .completedAt(completedAt)
      .sessionDurationSeconds(Duration.between(startedAt, completedAt).toMillis() / 1000.0)
      .build();
  }

  /**
   * 最终的 "Session Complete" 消息
   */
  public String completionMessage(SessionSummary summary) {
    return """
      ## Session Complete!

      %s

      ### Summary Statistics
      - **Goals Completed**: %d/%d
      - **Total Questions Discussed**: %d
      - **Total Exchanges**: %d
      - **Understanding Improvement**: %s
      - **Duration**: %s minutes"""
      .formatted(
        summary.getNarrative(),
        summary.getGoalsCompleted(),
        summary.getTotalGoals(),
        summary.getTotalQuestions(),
        summary.getTotalExchanges(),
        String.format(Locale.ROOT, "%+.0f%%", summary.getUnderstandingImprovement() * 100),
        String.format(Locale.ROOT, "%.1f", summary.getSessionDurationSeconds() / 60));
  }

  private String narrate(SessionSummary stats, String modelOverride) {
    try {
      String narrative = generator.generate(GenerationRequest.builder()
        .purpose(GenerationPurpose.SUMMARY)
        .prompt(prompts.summaryNarrative(stats))
        .maxOutputTokens(properties.getTokens().getSummary())
        .modelOverride(modelOverride)
        .build());
      if (narrative != null && !narrative.isBlank()) {
        return narrative.trim();
      }
      log.warn("Empty summary narrative for session {}", stats.getSessionId());
    } catch (CapabilityUnavailableException e) {
      log.warn("Summary narrative unavailable for session {}: {}", stats.getSessionId(),
        e.getMessage());
    }
    return fallbackNarrative(stats);
  }

  String fallbackNarrative(SessionSummary stats) {
    return String.format(Locale.ROOT,
      "You completed %d of %d learning goals across %d questions and %d exchanges. "
        + "Your average understanding moved from %s to %s.",
      stats.getGoalsCompleted(), stats.getTotalGoals(), stats.getTotalQuestions(),
      stats.getTotalExchanges(), TutorPrompts.percent(stats.getAvgInitialUnderstanding()),
      TutorPrompts.percent(stats.getAvgFinalUnderstanding()));
  }

  private List<String> topDistinct(List<UnderstandingPoint> trajectory,
    Function<UnderstandingPoint, List<String>> extractor) {
    Set<String> distinct = new LinkedHashSet<>();
    for (UnderstandingPoint point : trajectory) {
      List<String> values = extractor.apply(point);
      if (values == null) {
        continue;
      }
      values.stream().filter(Objects::nonNull).forEach(distinct::add);
    }
    return distinct.stream().limit(properties.getKeyInsightLimit()).toList();
  }

  private static double mean(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }
}
