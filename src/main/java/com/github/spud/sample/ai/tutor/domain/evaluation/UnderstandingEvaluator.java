package com.github.spud.sample.ai.tutor.domain.evaluation;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationPurpose;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationRequest;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.capability.TutorGenerator;
import com.github.spud.sample.ai.tutor.domain.kernel.protocol.ModelJsonExtractor;
import com.github.spud.sample.ai.tutor.domain.kernel.protocol.ModelJsonParseException;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 理解度评估
 * <p>
 * 评估失败不会中断对话：解析失败或生成失败都返回中性分数 0.5（未解决）。
 * 空回答不调用模型，直接记 0.0。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnderstandingEvaluator {

  static final String NO_RESPONSE_NOTES = "No response found";

  private final TutorGenerator generator;
  private final ModelJsonExtractor jsonExtractor;
  private final TutorPrompts prompts;
  private final TutorProperties properties;

  public EvaluationResult evaluate(LearningGoal goal, StarterQuestion question,
    String learnerMessage, List<ContextPassage> passages, String modelOverride) {
    if (learnerMessage == null || learnerMessage.isBlank()) {
      log.debug("Empty answer for goal {} question {}, scoring 0.0", goal.getId(),
        question.getIndex());
      return EvaluationResult.of(0.0, NO_RESPONSE_NOTES, List.of(), List.of());
    }

    List<ContextPassage> limited = passages.stream()
      .limit(properties.getContext().getEvaluation())
      .toList();

    String raw;
    try {
      raw = generator.generate(GenerationRequest.builder()
        .purpose(GenerationPurpose.EVALUATION)
        .prompt(prompts.evaluation(goal, question, learnerMessage, limited))
        .schemaHint(TutorPrompts.EVALUATION_SCHEMA)
        .maxOutputTokens(properties.getTokens().getEvaluation())
        .modelOverride(modelOverride)
        .build());
    } catch (CapabilityUnavailableException e) {
      log.warn("Evaluation unavailable for goal {}: {}", goal.getId(), e.getMessage());
      return EvaluationResult.neutral("Evaluation unavailable: " + e.getMessage());
    }

    try {
      EvaluationResult result = parse(raw);
      log.debug("Evaluated answer for goal {} question {}: score={}", goal.getId(),
        question.getIndex(), result.getScore());
      return result;
    } catch (ModelJsonParseException e) {
      log.warn("Evaluation output could not be parsed for goal {}: {}", goal.getId(),
        e.getReason());
      return EvaluationResult.neutral("Evaluation parsing failed: " + e.getReason());
    }
  }

  EvaluationResult parse(String raw) throws ModelJsonParseException {
    JsonNode root = jsonExtractor.extract(raw);
    if (!root.isObject()) {
      throw new ModelJsonParseException("Evaluation is not a JSON object", raw);
    }

    JsonNode scoreNode = root.path("score");
    double score;
    if (scoreNode.isNumber()) {
      score = scoreNode.asDouble();
    } else if (scoreNode.isTextual()) {
      try {
        score = Double.parseDouble(scoreNode.asText().trim());
      } catch (NumberFormatException e) {
        throw new ModelJsonParseException("Score is not numeric: " + scoreNode.asText(), raw, e);
      }
    } else {
      throw new ModelJsonParseException("Evaluation has no score", raw);
    }

    String notes = root.hasNonNull("notes") ? root.get("notes").asText()
      : root.path("evaluation_notes").asText("");

    return EvaluationResult.of(score, notes, strings(root.path("misconceptions")),
      strings(root.path("breakthroughs")));
  }

  private List<String> strings(JsonNode node) {
    List<String> values = new ArrayList<>();
    if (node.isArray()) {
      for (JsonNode item : node) {
        String value = item.asText("").trim();
        if (!value.isEmpty()) {
          values.add(value);
        }
      }
    }
    return values;
  }
}
