package com.github.spud.sample.ai.tutor.domain.question;

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
import com.github.spud.sample.ai.tutor.domain.model.QuestionDepth;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 引导问题生成
 * <p>
 * 一次生成调用，结果解析失败或没有可用问题时退化为一个基于目标描述的通用问题。 生成调用本身失败时没有安全的兜底，直接抛出
 * {@link CapabilityUnavailableException}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StarterQuestionGenerator {

  /**
   * 每个目标的问题数上限，配置只能调低
   */
  static final int QUESTION_LIMIT = 5;

  private final TutorGenerator generator;
  private final ModelJsonExtractor jsonExtractor;
  private final TutorPrompts prompts;
  private final TutorProperties properties;

  public List<StarterQuestion> generate(LearningGoal goal, List<ContextPassage> passages,
    String moduleName, String modelOverride) {
    int maxQuestions = Math.max(1, Math.min(properties.getMaxQuestionsPerGoal(), QUESTION_LIMIT));
    List<ContextPassage> limited = passages.stream()
      .limit(properties.getContext().getQuestions())
      .toList();

    String raw = generator.generate(GenerationRequest.builder()
      .purpose(GenerationPurpose.QUESTIONS)
      .prompt(prompts.questionGeneration(moduleName, goal, limited, maxQuestions))
      .schemaHint(TutorPrompts.QUESTIONS_SCHEMA)
      .maxOutputTokens(properties.getTokens().getQuestions())
      .modelOverride(modelOverride)
      .build());

    List<StarterQuestion> questions = parseQuestions(raw, maxQuestions);
    if (questions.isEmpty()) {
      log.warn("No usable starter questions for goal {}, using fallback question", goal.getId());
      return List.of(fallbackQuestion(goal));
    }
    log.info("Generated {} starter question(s) for goal {}", questions.size(), goal.getId());
    return questions;
  }

  List<StarterQuestion> parseQuestions(String raw, int maxQuestions) {
    JsonNode root;
    try {
      root = jsonExtractor.extract(raw);
    } catch (ModelJsonParseException e) {
      log.warn("Starter question output could not be parsed: {}", e.getReason());
      return List.of();
    }

    JsonNode items = root.isArray() ? root : root.path("questions");
    if (!items.isArray()) {
      return List.of();
    }

    List<StarterQuestion> questions = new ArrayList<>();
    for (JsonNode item : items) {
      if (questions.size() >= maxQuestions) {
        break;
      }
      String text = questionText(item);
      if (text == null || text.isBlank()) {
        continue;
      }
      questions.add(StarterQuestion.builder()
        .index(questions.size())
        .questionText(text.trim())
        .targetConcepts(concepts(item.path("target_concepts")))
        .expectedDepth(QuestionDepth.fromText(item.path("expected_depth").asText(null)))
        .resolved(false)
        .exchanges(0)
        .build());
    }
    return questions;
  }

  StarterQuestion fallbackQuestion(LearningGoal goal) {
    return StarterQuestion.builder()
      .index(0)
      .questionText("Can you explain what you understand about: " + goal.getDescription() + "?")
      .targetConcepts(new ArrayList<>(List.of(goal.getDescription())))
      .expectedDepth(QuestionDepth.UNDERSTAND)
      .resolved(false)
      .exchanges(0)
      .build();
  }

  private String questionText(JsonNode item) {
    if (item.isTextual()) {
      return item.asText();
    }
    if (item.hasNonNull("question_text")) {
      return item.get("question_text").asText();
    }
    if (item.hasNonNull("text")) {
      return item.get("text").asText();
    }
    return null;
  }

  private List<String> concepts(JsonNode node) {
    Set<String> concepts = new LinkedHashSet<>();
    if (node.isArray()) {
      for (JsonNode concept : node) {
        String value = concept.asText("").trim();
        if (!value.isEmpty()) {
          concepts.add(value);
        }
      }
    } else if (node.isTextual() && !node.asText().isBlank()) {
      concepts.add(node.asText().trim());
    }
    return new ArrayList<>(concepts);
  }
}
