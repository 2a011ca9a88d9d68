package com.github.spud.sample.ai.tutor.domain.evaluation;

import static com.github.spud.sample.ai.tutor.support.TutorFixtures.goal;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationPurpose;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationRequest;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.kernel.protocol.ModelJsonExtractor;
import com.github.spud.sample.ai.tutor.domain.kernel.protocol.ModelJsonParseException;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import com.github.spud.sample.ai.tutor.support.ScriptedTutorGenerator;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 理解度评估：解析、容错与中性兜底
 */
class UnderstandingEvaluatorTest {

  private final LearningGoal goal = goal("g-1", "Photosynthesis inputs", 1);
  private final StarterQuestion question = StarterQuestion.builder()
    .index(0)
    .questionText("What does a plant need to make sugar?")
    .targetConcepts(List.of("light", "carbon dioxide"))
    .build();

  private ScriptedTutorGenerator generator;
  private UnderstandingEvaluator evaluator;

  @BeforeEach
  void setUp() {
    generator = new ScriptedTutorGenerator();
    evaluator = new UnderstandingEvaluator(generator, new ModelJsonExtractor(), new TutorPrompts(),
      new TutorProperties());
  }

  @Test
  void shouldParseFullEvaluation() {
    generator.enqueue(GenerationPurpose.EVALUATION, """
      ```json
      {"score": 0.85, "notes": "Names both inputs",
       "misconceptions": ["thinks soil is food", " "], "breakthroughs": ["links light to energy"]}
      ```
      """);

    EvaluationResult result = evaluator.evaluate(goal, question, "Light and CO2", List.of(), null);

    assertThat(result.getScore()).isEqualTo(0.85);
    assertThat(result.isResolved()).isTrue();
    assertThat(result.getNotes()).isEqualTo("Names both inputs");
    assertThat(result.getMisconceptions()).containsExactly("thinks soil is food");
    assertThat(result.getBreakthroughs()).containsExactly("links light to energy");
  }

  @Test
  void shouldScoreEmptyAnswerZeroWithoutModelCall() {
    EvaluationResult empty = evaluator.evaluate(goal, question, "", List.of(), null);
    EvaluationResult blank = evaluator.evaluate(goal, question, "   \n", List.of(), null);

    assertThat(empty.getScore()).isZero();
    assertThat(empty.isResolved()).isFalse();
    assertThat(empty.getNotes()).isEqualTo("No response found");
    assertThat(blank.getScore()).isZero();
    assertThat(generator.requests(GenerationPurpose.EVALUATION)).isEmpty();
  }

  @Test
  void shouldAcceptNumericTextScoreAndLegacyNotesField() throws Exception {
    EvaluationResult result = evaluator.parse(
      "{\"score\": \"0.3\", \"evaluation_notes\": \"vague\"}");

    assertThat(result.getScore()).isEqualTo(0.3);
    assertThat(result.getNotes()).isEqualTo("vague");
    assertThat(result.getMisconceptions()).isEmpty();
  }

  @Test
  void shouldClampOutOfRangeScore() throws Exception {
    assertThat(evaluator.parse("{\"score\": 3}").getScore()).isEqualTo(1.0);
    assertThat(evaluator.parse("{\"score\": -1}").getScore()).isEqualTo(0.0);
  }

  @Test
  void shouldRejectMissingOrNonNumericScore() {
    assertThatThrownBy(() -> evaluator.parse("{\"notes\": \"no score\"}"))
      .isInstanceOf(ModelJsonParseException.class);
    assertThatThrownBy(() -> evaluator.parse("{\"score\": \"high\"}"))
      .isInstanceOf(ModelJsonParseException.class);
    assertThatThrownBy(() -> evaluator.parse("[0.9]"))
      .isInstanceOf(ModelJsonParseException.class);
  }

  @Test
  void shouldReturnNeutralOnUnparseableOutput() {
    generator.enqueue(GenerationPurpose.EVALUATION, "The learner did fine, I think.");

    EvaluationResult result = evaluator.evaluate(goal, question, "sunlight", List.of(), null);

    assertThat(result.getScore()).isEqualTo(0.5);
    assertThat(result.isResolved()).isFalse();
    assertThat(result.getNotes()).startsWith("Evaluation parsing failed");
  }

  @Test
  void shouldReturnNeutralOnGeneratorOutage() {
    generator.enqueueFailure(GenerationPurpose.EVALUATION);

    EvaluationResult result = evaluator.evaluate(goal, question, "sunlight", List.of(), null);

    assertThat(result.getScore()).isEqualTo(0.5);
    assertThat(result.getNotes()).startsWith("Evaluation unavailable");
  }

  @Test
  void shouldBuildPromptFromAnswerAndLimitedContext() {
    List<ContextPassage> passages = IntStream.rangeClosed(1, 6)
      .mapToObj(i -> ContextPassage.builder().text("passage-" + i).build())
      .toList();

    evaluator.evaluate(goal, question, "Water and sunlight", passages, "gpt-4o");

    GenerationRequest request = generator.requests(GenerationPurpose.EVALUATION).get(0);
    assertThat(request.getPrompt())
      .contains("Water and sunlight")
      .contains("light; carbon dioxide")
      .contains("passage-3")
      .doesNotContain("passage-4");
    assertThat(request.getSchemaHint()).isEqualTo(TutorPrompts.EVALUATION_SCHEMA);
    assertThat(request.getMaxOutputTokens()).isEqualTo(1000);
    assertThat(request.getModelOverride()).isEqualTo("gpt-4o");
  }
}
