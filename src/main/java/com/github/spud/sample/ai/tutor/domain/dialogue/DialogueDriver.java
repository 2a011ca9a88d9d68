package com.github.spud.sample.ai.tutor.domain.dialogue;

import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationPurpose;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationRequest;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.capability.TutorGenerator;
import com.github.spud.sample.ai.tutor.domain.evaluation.EvaluationResult;
import com.github.spud.sample.ai.tutor.domain.model.DialogueTurn;
import com.github.spud.sample.ai.tutor.domain.model.DialogueTurn.Role;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 对话驱动：提出问题、生成苏格拉底式追问、记录学习者回复
 * <p>
 * 只负责对话记录，不做任何计数。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DialogueDriver {

  private static final String FIRST_QUESTION_PROMPT = "\n\nPlease share your thoughts and reasoning.";

  private final TutorGenerator generator;
  private final TutorPrompts prompts;
  private final TutorProperties properties;
  private final Clock clock;

  /**
   * 提出当前问题
   *
   * @return 发给学习者的消息
   */
  public String present(TutorSession session) {
    StarterQuestion question = session.getCurrentQuestion();
    if (question == null) {
      throw new IllegalStateException("Session " + session.getSessionId() + " has no question to present");
    }
    return say(session, formatQuestion(question));
  }

  /**
   * 针对未解决的回答生成追问，生成失败时使用基于评估结果的固定追问
   */
  public String followUp(TutorSession session, LearningGoal goal, EvaluationResult evaluation,
    String learnerMessage) {
    StarterQuestion question = session.getCurrentQuestion();
    List<ContextPassage> passages = session.contextOf(goal.getId()).stream()
      .limit(properties.getContext().getFollowUp())
      .toList();

    String message;
    try {
      message = generator.generate(GenerationRequest.builder()
        .purpose(GenerationPurpose.FOLLOW_UP)
        .prompt(prompts.followUp(goal, question, learnerMessage, evaluation, passages))
        .maxOutputTokens(properties.getTokens().getFollowUp())
        .modelOverride(session.getModelOverride())
        .build());
    } catch (CapabilityUnavailableException e) {
      log.warn("Follow-up generation failed for session {}: {}", session.getSessionId(),
        e.getMessage());
      message = null;
    }

    if (message == null || message.isBlank()) {
      message = cannedFollowUp(question, evaluation);
    }
    return say(session, message.trim());
  }

  /**
   * 原样记录学习者回复
   */
  public void acceptLearnerMessage(TutorSession session, String message) {
    session.getDialogueHistory().add(DialogueTurn.builder()
      .role(Role.LEARNER)
      .content(message)
      .timestamp(clock.instant())
      .build());
  }

  /**
   * 追加一条导师消息
   */
  public String say(TutorSession session, String message) {
    session.getDialogueHistory().add(DialogueTurn.builder()
      .role(Role.TUTOR)
      .content(message)
      .timestamp(clock.instant())
      .build());
    return message;
  }

  String formatQuestion(StarterQuestion question) {
    String text = "**Question " + (question.getIndex() + 1) + ":** " + question.getQuestionText();
    if (question.getIndex() == 0) {
      text += FIRST_QUESTION_PROMPT;
    }
    return text;
  }

  String cannedFollowUp(StarterQuestion question, EvaluationResult evaluation) {
    StringBuilder sb = new StringBuilder("Let's look at this a little more closely.");
    if (!evaluation.getMisconceptions().isEmpty()) {
      sb.append(" Think again about this point: ").append(evaluation.getMisconceptions().get(0))
        .append('.');
    }
    if (question != null && !question.getTargetConcepts().isEmpty()) {
      sb.append(" How would you explain ")
        .append(String.join(", ", question.getTargetConcepts()))
        .append(" in your own words?");
    } else {
      sb.append(" Can you walk me through your reasoning step by step?");
    }
    return sb.toString();
  }
}
