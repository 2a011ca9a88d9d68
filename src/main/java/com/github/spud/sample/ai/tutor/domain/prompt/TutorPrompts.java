package com.github.spud.sample.ai.tutor.domain.prompt;

import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.evaluation.EvaluationResult;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.summary.SessionSummary;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * 辅导各环节的提示词
 */
@Component
public class TutorPrompts {

  public static final String QUESTIONS_SCHEMA = """
    {
      "questions": [
        {
          "question_text": "string",
          "target_concepts": ["string"],
          "expected_depth": "recall | understand | apply | analyze"
        }
      ]
    }
    """;

  public static final String EVALUATION_SCHEMA = """
    {
      "score": "number between 0.0 and 1.0",
      "notes": "string",
      "misconceptions": ["string"],
      "breakthroughs": ["string"]
    }
    """;

  private static final String QUESTION_GENERATION = """
    You are preparing a Socratic tutoring conversation for the module "%s".

    Learning goal: %s
    Mastery criteria: %s

    Reference material:
    %s

    Write up to %d open-ended starter questions that lead the learner towards this goal.
    Order them from foundational to advanced. Do not reveal answers in the questions.
    """;

  private static final String EVALUATION = """
    Assess how well the learner understands the learning goal, based on their latest answer.

    Learning goal: %s
    Mastery criteria: %s
    Question: %s
    Target concepts: %s

    Reference material:
    %s

    Learner answer:
    %s

    Score 0.0 for no understanding and 1.0 for full mastery of what the question targets.
    List concrete misconceptions and breakthroughs visible in the answer.
    """;

  private static final String FOLLOW_UP = """
    Continue a Socratic dialogue. The learner has not yet shown enough understanding.

    Learning goal: %s
    Current question: %s
    Learner answer:
    %s

    Assessment notes: %s
    Misconceptions: %s

    Reference material:
    %s

    Reply with one short, encouraging message that ends in a single guiding question.
    Do not give the answer away.
    """;

  private static final String SUMMARY_NARRATIVE = """
    Write a short, encouraging recap of a finished tutoring session for the module "%s".

    Goals completed: %d of %d
    Questions discussed: %d
    Total exchanges: %d
    Average initial understanding: %s
    Average final understanding: %s
    Improvement: %s
    Misconceptions worked through: %s
    Breakthroughs: %s

    Three to five sentences, addressed to the learner.
    """;

  public String questionGeneration(String moduleName, LearningGoal goal,
    List<ContextPassage> passages, int maxQuestions) {
    return QUESTION_GENERATION.formatted(
      moduleName,
      goal.getDescription(),
      orNone(goal.getMasteryCriteria()),
      formatPassages(passages),
      maxQuestions);
  }

  public String evaluation(LearningGoal goal, StarterQuestion question, String learnerMessage,
    List<ContextPassage> passages) {
    return EVALUATION.formatted(
      goal.getDescription(),
      orNone(goal.getMasteryCriteria()),
      question.getQuestionText(),
      joinOrNone(question.getTargetConcepts()),
      formatPassages(passages),
      learnerMessage);
  }

  public String followUp(LearningGoal goal, StarterQuestion question, String learnerMessage,
    EvaluationResult evaluation, List<ContextPassage> passages) {
    return FOLLOW_UP.formatted(
      goal.getDescription(),
      question.getQuestionText(),
      learnerMessage,
      orNone(evaluation.getNotes()),
      joinOrNone(evaluation.getMisconceptions()),
      formatPassages(passages));
  }

  /**
   * 只使用统计数据，不包含学习者原文
   */
  public String summaryNarrative(SessionSummary stats) {
    return SUMMARY_NARRATIVE.formatted(
      stats.getModuleName(),
      stats.getGoalsCompleted(),
      stats.getTotalGoals(),
      stats.getTotalQuestions(),
      stats.getTotalExchanges(),
      percent(stats.getAvgInitialUnderstanding()),
      percent(stats.getAvgFinalUnderstanding()),
      percent(stats.getUnderstandingImprovement()),
      joinOrNone(stats.getKeyMisconceptions()),
      joinOrNone(stats.getKeyBreakthroughs()));
  }

  String formatPassages(List<ContextPassage> passages) {
    if (passages == null || passages.isEmpty()) {
      return "(no reference material)";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < passages.size(); i++) {
      ContextPassage passage = passages.get(i);
      sb.append("--- Passage ").append(i + 1).append(" ---\n");
      if (passage.getSourceRef() != null) {
        sb.append("Source: ").append(passage.getSourceRef()).append("\n");
      }
      sb.append(passage.getText()).append("\n\n");
    }
    return sb.toString().trim();
  }

  public static String percent(double value) {
    return String.format(Locale.ROOT, "%.0f%%", value * 100);
  }

  private static String orNone(String value) {
    return value == null || value.isBlank() ? "(none)" : value;
  }

  private static String joinOrNone(List<String> values) {
    return values == null || values.isEmpty() ? "(none)" : String.join("; ", values);
  }
}
