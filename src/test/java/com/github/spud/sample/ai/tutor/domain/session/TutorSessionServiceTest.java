package com.github.spud.sample.ai.tutor.domain.session;

import static com.github.spud.sample.ai.tutor.support.TutorFixtures.goal;
import static com.github.spud.sample.ai.tutor.support.TutorFixtures.module;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.CourseModule;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationPurpose;
import com.github.spud.sample.ai.tutor.domain.dialogue.DialogueDriver;
import com.github.spud.sample.ai.tutor.domain.error.ModuleNotFoundException;
import com.github.spud.sample.ai.tutor.domain.error.NoGoalsException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotAwaitingResponseException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotCompleteException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotFoundException;
import com.github.spud.sample.ai.tutor.domain.error.VersionConflictException;
import com.github.spud.sample.ai.tutor.domain.evaluation.UnderstandingEvaluator;
import com.github.spud.sample.ai.tutor.domain.goal.GoalSelector;
import com.github.spud.sample.ai.tutor.domain.kernel.protocol.ModelJsonExtractor;
import com.github.spud.sample.ai.tutor.domain.model.DialogueTurn.Role;
import com.github.spud.sample.ai.tutor.domain.model.GoalProgress;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.model.UnderstandingPoint;
import com.github.spud.sample.ai.tutor.domain.progress.ProgressTracker;
import com.github.spud.sample.ai.tutor.domain.prompt.TutorPrompts;
import com.github.spud.sample.ai.tutor.domain.question.StarterQuestionGenerator;
import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import com.github.spud.sample.ai.tutor.domain.state.TutorStateMachineDriver;
import com.github.spud.sample.ai.tutor.domain.store.StoredSession;
import com.github.spud.sample.ai.tutor.domain.summary.SessionSummary;
import com.github.spud.sample.ai.tutor.domain.summary.SummaryGenerator;
import com.github.spud.sample.ai.tutor.infrastructure.store.InMemoryTutorSessionStore;
import com.github.spud.sample.ai.tutor.support.ScriptedTutorGenerator;
import com.github.spud.sample.ai.tutor.support.TestStateMachines;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Session engine flow tests against the real transition table and an in-memory store
 */
class TutorSessionServiceTest {

  private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
  private final Map<String, CourseModule> modules = new HashMap<>();
  private final ScriptedTutorGenerator generator = new ScriptedTutorGenerator();

  private InMemoryTutorSessionStore store;
  private TutorSessionService service;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    modules.put("two-goals", module("two-goals", "Photosynthesis",
      goal("g-light", "Light reactions", 1),
      goal("g-calvin", "Calvin cycle", 2)));
    modules.put("one-goal", module("one-goal", "Fractions",
      goal("g-equiv", "Equivalent fractions", 1)));
    modules.put("empty", module("empty", "Nothing yet"));

    TutorProperties properties = new TutorProperties();
    TutorPrompts prompts = new TutorPrompts();
    ModelJsonExtractor extractor = new ModelJsonExtractor();
    ProgressTracker tracker = new ProgressTracker(clock);
    store = spy(new InMemoryTutorSessionStore());

    service = new TutorSessionService(
      moduleId -> Optional.ofNullable(modules.get(moduleId)),
      (query, maxResults) -> List.of(ContextPassage.builder()
        .text("Notes about " + query)
        .sourceRef("notes.md")
        .build()),
      store,
      new TutorStateMachineDriver(TestStateMachines.factory()),
      tracker,
      new GoalSelector(),
      new StarterQuestionGenerator(generator, extractor, prompts, properties),
      new DialogueDriver(generator, prompts, properties, clock),
      new UnderstandingEvaluator(generator, extractor, prompts, properties),
      new SummaryGenerator(generator, tracker, prompts, properties),
      properties,
      clock);
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  @Test
  void createSessionRunsUntilFirstQuestionAndPersists() {
    CreateSessionResult result = service.createSession("two-goals", null);

    assertThat(result.getSessionId()).startsWith("tutor-");
    assertThat(result.getTotalGoals()).isEqualTo(2);
    assertThat(result.getCurrentGoalId()).isEqualTo("g-light");
    assertThat(result.getFirstMessage())
      .contains("Welcome")
      .contains("Let's focus on this learning goal: **Light reactions**")
      .contains("**Question 1:** What is the main idea behind this goal?")
      .contains("Please share your thoughts and reasoning.");

    StoredSession stored = stored(result.getSessionId());
    assertThat(stored.version()).isZero();
    TutorSession session = stored.session();
    assertThat(session.getPhase()).isEqualTo(TutorPhase.AWAITING_RESPONSE);
    assertThat(session.getCurrentQuestion().getIndex()).isZero();
    assertThat(session.getGoalContexts()).containsOnlyKeys("g-light", "g-calvin");
    assertThat(session.getDialogueHistory()).allMatch(turn -> turn.getRole() == Role.TUTOR);
    assertInvariants(session);
  }

  @Test
  void twoGoalsWithOneQuestionEachFinishWithSummary() {
    String sessionId = service.createSession("two-goals", null).getSessionId();
    generator.scores(0.9, 0.9);

    TurnResult first = service.respond(sessionId, "Light is absorbed by chlorophyll.");
    assertThat(first.getPhase()).isEqualTo(TurnPhase.GOAL_COMPLETE);
    assertThat(first.getGoalsCompleted()).isEqualTo(1);
    assertThat(first.getGoalsRemaining()).isEqualTo(1);
    assertThat(first.getCurrentGoalId()).isEqualTo("g-calvin");
    assertThat(first.getTutorMessage())
      .contains("Excellent! You've demonstrated understanding of: **Light reactions**")
      .contains("Let's continue to the next topic.")
      .contains("**Question 1:**");
    assertInvariants(stored(sessionId).session());

    TurnResult second = service.respond(sessionId, "Carbon is fixed into sugars.");
    assertThat(second.getPhase()).isEqualTo(TurnPhase.SESSION_COMPLETE);
    assertThat(second.getGoalsRemaining()).isZero();
    assertThat(second.getCurrentGoalId()).isNull();
    assertThat(second.getTutorMessage()).contains("## Session Complete!");

    TutorSession session = stored(sessionId).session();
    assertThat(session.getPhase()).isEqualTo(TutorPhase.DONE);
    assertThat(session.getCompletedGoalIds()).containsExactly("g-light", "g-calvin");
    assertInvariants(session);

    SessionSummary summary = service.getSummary(sessionId);
    assertThat(summary.getGoalsCompleted()).isEqualTo(2);
    assertThat(summary.getTotalQuestions()).isEqualTo(2);
    assertThat(summary.getTotalExchanges()).isEqualTo(2);
    assertThat(summary.getNarrative()).isEqualTo(ScriptedTutorGenerator.DEFAULT_NARRATIVE);
  }

  @Test
  void unresolvedAnswersStayOnTheSameQuestionUntilResolved() {
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.scores(0.4, 0.3, 0.8);

    TurnResult first = service.respond(sessionId, "Same numbers?");
    assertThat(first.getPhase()).isEqualTo(TurnPhase.IN_PROGRESS);
    assertThat(first.getCurrentQuestionIndex()).isZero();
    assertThat(first.getLatestUnderstandingScore()).isEqualTo(0.4);
    assertThat(first.getTutorMessage()).isEqualTo(ScriptedTutorGenerator.DEFAULT_FOLLOW_UP);

    TurnResult second = service.respond(sessionId, "Bigger denominators?");
    assertThat(second.getPhase()).isEqualTo(TurnPhase.IN_PROGRESS);
    assertThat(second.getCurrentQuestionIndex()).isZero();

    StarterQuestion beforeResolution = stored(sessionId).session().getCurrentQuestion();
    assertThat(beforeResolution.getExchanges()).isEqualTo(2);
    assertThat(beforeResolution.isResolved()).isFalse();

    TurnResult third = service.respond(sessionId, "Multiply top and bottom by the same number.");
    assertThat(third.getPhase()).isEqualTo(TurnPhase.SESSION_COMPLETE);

    TutorSession session = stored(sessionId).session();
    GoalProgress progress = session.getGoalProgress().get("g-equiv");
    assertThat(progress.getCurrentQuestionIndex()).isZero();
    assertThat(progress.getStarterQuestions().get(0).getExchanges()).isEqualTo(3);
    assertThat(progress.getStarterQuestions().get(0).isResolved()).isTrue();
    assertThat(progress.getInitialUnderstanding()).isEqualTo(0.4);
    assertThat(progress.getFinalUnderstanding()).isEqualTo(0.8);
    assertThat(session.getUnderstandingTrajectory())
      .extracting(UnderstandingPoint::getExchangeNumber)
      .containsExactly(1, 2, 3);
    assertThat(session.getUnderstandingTrajectory())
      .extracting(UnderstandingPoint::getUnderstandingScore)
      .containsExactly(0.4, 0.3, 0.8);
    assertThat(generator.requests(GenerationPurpose.FOLLOW_UP)).hasSize(2);
  }

  @Test
  void resolvedAnswerAdvancesToNextQuestionOfSameGoal() {
    generator.defaultResponse(GenerationPurpose.QUESTIONS,
      ScriptedTutorGenerator.questionsJson("First question?", "Second question?"));
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.scores(0.95);

    TurnResult result = service.respond(sessionId, "A solid answer.");

    assertThat(result.getPhase()).isEqualTo(TurnPhase.IN_PROGRESS);
    assertThat(result.getCurrentQuestionIndex()).isEqualTo(1);
    assertThat(result.getCurrentQuestionText()).isEqualTo("Second question?");
    assertThat(result.getTutorMessage())
      .startsWith("Great progress! Let's move on to the next question.")
      .contains("**Question 2:** Second question?")
      .doesNotContain("Please share your thoughts");

    GoalProgress progress = stored(sessionId).session().getGoalProgress().get("g-equiv");
    assertThat(progress.getStarterQuestions().get(0).isResolved()).isTrue();
    assertThat(progress.getStarterQuestions().get(1).isResolved()).isFalse();
  }

  @Test
  void scoreJustBelowThresholdDoesNotResolve() {
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.scores(0.699999, 0.7);

    assertThat(service.respond(sessionId, "close").getPhase()).isEqualTo(TurnPhase.IN_PROGRESS);
    assertThat(service.respond(sessionId, "there").getPhase())
      .isEqualTo(TurnPhase.SESSION_COMPLETE);
  }

  @Test
  void trajectoryOnlyGrows() {
    String sessionId = service.createSession("two-goals", null).getSessionId();
    generator.scores(0.2, 0.5, 0.9, 0.1);

    List<UnderstandingPoint> previous = List.of();
    for (String answer : List.of("a", "b", "c", "d")) {
      service.respond(sessionId, answer);
      List<UnderstandingPoint> current = service.getTrajectory(sessionId).getTrajectory();
      assertThat(current).hasSize(previous.size() + 1);
      assertThat(current.subList(0, previous.size())).isEqualTo(previous);
      assertInvariants(stored(sessionId).session());
      previous = current;
    }
  }

  @Test
  void readsAreIdempotentAndDoNotWrite() {
    String sessionId = service.createSession("two-goals", null).getSessionId();
    generator.scores(0.3);
    service.respond(sessionId, "not sure");
    long version = stored(sessionId).version();

    SessionStateView state = service.getState(sessionId);
    TrajectoryView trajectory = service.getTrajectory(sessionId);

    assertThat(service.getState(sessionId)).isEqualTo(state);
    assertThat(service.getTrajectory(sessionId)).isEqualTo(trajectory);
    assertThat(state.getPhase()).isEqualTo(ProgressPhase.IN_PROGRESS);
    assertThat(state.getTutorPhase()).isEqualTo(TutorPhase.AWAITING_RESPONSE);
    assertThat(state.getLatestUnderstandingScore()).isEqualTo(0.3);
    assertThat(state.getGoals()).extracting(SessionStateView.GoalProgressRow::getGoalId)
      .containsExactly("g-light", "g-calvin");
    assertThat(trajectory.getGoals()).hasSize(1);
    assertThat(trajectory.getGoals().get(0).getQuestions()).hasSize(1);
    assertThat(stored(sessionId).version()).isEqualTo(version);
  }

  @Test
  void moduleWithoutGoalsIsRejectedWithoutPersisting() {
    assertThatThrownBy(() -> service.createSession("empty", null))
      .isInstanceOf(NoGoalsException.class);

    verify(store, never()).put(any(), any());
    assertThat(generator.requests(GenerationPurpose.QUESTIONS)).isEmpty();
  }

  @Test
  void unknownModuleIsNotFound() {
    assertThatThrownBy(() -> service.createSession("missing", null))
      .isInstanceOf(ModuleNotFoundException.class);
  }

  @Test
  void unknownSessionIsNotFound() {
    assertThatThrownBy(() -> service.respond("tutor-missing", "hello"))
      .isInstanceOf(SessionNotFoundException.class);
    assertThatThrownBy(() -> service.getState("tutor-missing"))
      .isInstanceOf(SessionNotFoundException.class);
  }

  @Test
  void summaryBeforeCompletionIsRejectedWithoutMutation() {
    String sessionId = service.createSession("two-goals", null).getSessionId();
    String before = JsonUtils.toJson(stored(sessionId).session());

    assertThatThrownBy(() -> service.getSummary(sessionId))
      .isInstanceOf(SessionNotCompleteException.class);

    StoredSession after = stored(sessionId);
    assertThat(after.version()).isZero();
    assertThat(JsonUtils.toJson(after.session())).isEqualTo(before);
  }

  @Test
  void respondingToFinishedSessionIsPreconditionFailure() {
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.scores(0.9);
    service.respond(sessionId, "done");
    long version = stored(sessionId).version();

    assertThatThrownBy(() -> service.respond(sessionId, "again"))
      .isInstanceOf(SessionNotAwaitingResponseException.class);
    assertThat(stored(sessionId).version()).isEqualTo(version);
  }

  @Test
  void malformedQuestionOutputFallsBackToSingleQuestion() {
    generator.defaultResponse(GenerationPurpose.QUESTIONS, "I would rather not answer in JSON.");

    CreateSessionResult result = service.createSession("one-goal", null);

    GoalProgress progress = stored(result.getSessionId()).session().getGoalProgress().get("g-equiv");
    assertThat(progress.getStarterQuestions()).hasSize(1);
    assertThat(progress.getStarterQuestions().get(0).getIndex()).isZero();
    assertThat(progress.getStarterQuestions().get(0).getQuestionText())
      .contains("Equivalent fractions");
  }

  @Test
  void generatorOutageOnCreatePersistsNothing() {
    generator.enqueueFailure(GenerationPurpose.QUESTIONS);

    assertThatThrownBy(() -> service.createSession("one-goal", null))
      .isInstanceOf(CapabilityUnavailableException.class);
    verify(store, never()).put(any(), any());
  }

  @Test
  void generatorOutageMidTurnLeavesStoredSessionUntouched() {
    String sessionId = service.createSession("two-goals", null).getSessionId();
    StoredSession before = stored(sessionId);
    generator.scores(0.9);
    generator.enqueueFailure(GenerationPurpose.QUESTIONS);

    assertThatThrownBy(() -> service.respond(sessionId, "chlorophyll absorbs light"))
      .isInstanceOf(CapabilityUnavailableException.class);

    StoredSession after = stored(sessionId);
    assertThat(after.version()).isEqualTo(before.version());
    assertThat(after.session().getUnderstandingTrajectory()).isEmpty();
    assertThat(after.session().getCompletedGoalIds()).isEmpty();

    // retry succeeds once the generator is back
    generator.scores(0.9);
    TurnResult retried = service.respond(sessionId, "chlorophyll absorbs light");
    assertThat(retried.getPhase()).isEqualTo(TurnPhase.GOAL_COMPLETE);
  }

  @Test
  void evaluatorOutageScoresNeutrallyAndKeepsQuestion() {
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.enqueueFailure(GenerationPurpose.EVALUATION);

    TurnResult result = service.respond(sessionId, "hmm");

    assertThat(result.getPhase()).isEqualTo(TurnPhase.IN_PROGRESS);
    assertThat(result.getLatestUnderstandingScore()).isEqualTo(0.5);
    assertThat(result.getCurrentQuestionIndex()).isZero();
  }

  @Test
  void concurrentRespondsOnSameSessionConflict() throws Exception {
    String sessionId = service.createSession("one-goal", null).getSessionId();
    generator.scores(0.3, 0.3);
    CountDownLatch bothEvaluating = new CountDownLatch(2);
    generator.beforeGenerate(request -> {
      if (request.getPurpose() == GenerationPurpose.EVALUATION) {
        bothEvaluating.countDown();
        try {
          bothEvaluating.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });

    executor = Executors.newFixedThreadPool(2);
    Future<TurnResult> first = executor.submit(() -> service.respond(sessionId, "one"));
    Future<TurnResult> second = executor.submit(() -> service.respond(sessionId, "two"));

    await().atMost(Duration.ofSeconds(10)).until(() -> first.isDone() && second.isDone());

    List<Throwable> failures = new ArrayList<>();
    int succeeded = 0;
    for (Future<TurnResult> future : List.of(first, second)) {
      try {
        future.get();
        succeeded++;
      } catch (ExecutionException e) {
        failures.add(e.getCause());
      }
    }

    assertThat(succeeded).isEqualTo(1);
    assertThat(failures).singleElement().isInstanceOf(VersionConflictException.class);
    StoredSession stored = stored(sessionId);
    assertThat(stored.version()).isEqualTo(1);
    assertThat(stored.session().getUnderstandingTrajectory()).hasSize(1);
  }

  private StoredSession stored(String sessionId) {
    return store.get(sessionId).orElseThrow();
  }

  private void assertInvariants(TutorSession session) {
    Set<String> completedInProgress = session.getGoalProgress().values().stream()
      .filter(GoalProgress::isCompleted)
      .map(GoalProgress::getGoalId)
      .collect(Collectors.toSet());
    assertThat(new HashSet<>(session.getCompletedGoalIds())).isEqualTo(completedInProgress);
    assertThat(session.getCompletedGoalIds()).doesNotHaveDuplicates();

    if (session.getCurrentGoalId() != null) {
      assertThat(session.getGoalProgress()).containsKey(session.getCurrentGoalId());
      GoalProgress active = session.getGoalProgress().get(session.getCurrentGoalId());
      assertThat(active.getCurrentQuestionIndex())
        .isLessThanOrEqualTo(active.getStarterQuestions().size() - 1);
    }
  }
}
