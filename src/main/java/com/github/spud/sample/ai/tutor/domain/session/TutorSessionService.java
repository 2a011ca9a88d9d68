package com.github.spud.sample.ai.tutor.domain.session;

import com.github.spud.sample.ai.tutor.config.TutorProperties;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.ContextRetriever;
import com.github.spud.sample.ai.tutor.domain.capability.CourseModule;
import com.github.spud.sample.ai.tutor.domain.capability.LearningGoal;
import com.github.spud.sample.ai.tutor.domain.capability.ModuleCatalog;
import com.github.spud.sample.ai.tutor.domain.dialogue.DialogueDriver;
import com.github.spud.sample.ai.tutor.domain.error.ModuleNotFoundException;
import com.github.spud.sample.ai.tutor.domain.error.NoGoalsException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotAwaitingResponseException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotCompleteException;
import com.github.spud.sample.ai.tutor.domain.error.SessionNotFoundException;
import com.github.spud.sample.ai.tutor.domain.evaluation.EvaluationResult;
import com.github.spud.sample.ai.tutor.domain.evaluation.UnderstandingEvaluator;
import com.github.spud.sample.ai.tutor.domain.goal.GoalSelector;
import com.github.spud.sample.ai.tutor.domain.model.GoalProgress;
import com.github.spud.sample.ai.tutor.domain.model.StarterQuestion;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.progress.ProgressTracker;
import com.github.spud.sample.ai.tutor.domain.question.StarterQuestionGenerator;
import com.github.spud.sample.ai.tutor.domain.session.SessionStateView.GoalProgressRow;
import com.github.spud.sample.ai.tutor.domain.session.TrajectoryView.GoalTrajectory;
import com.github.spud.sample.ai.tutor.domain.session.TrajectoryView.QuestionRow;
import com.github.spud.sample.ai.tutor.domain.state.TutorEvent;
import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import com.github.spud.sample.ai.tutor.domain.state.TutorStateMachineDriver;
import com.github.spud.sample.ai.tutor.domain.store.StoredSession;
import com.github.spud.sample.ai.tutor.domain.store.TutorSessionStore;
import com.github.spud.sample.ai.tutor.domain.summary.SessionSummary;
import com.github.spud.sample.ai.tutor.domain.summary.SummaryGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import org.springframework.stereotype.Service;

/**
 * Socratic tutoring session engine.
 * <p>
 * Each call restores a state machine at the persisted phase, runs transitions on a freshly loaded
 * copy of the session until the next suspension point, and commits with a single versioned store
 * write. A call that fails before that write leaves the stored session as it was.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TutorSessionService {

  private static final String SESSION_ID_PREFIX = "tutor-";
  private static final String MESSAGE_SEPARATOR = "\n\n";

  private final ModuleCatalog moduleCatalog;
  private final ContextRetriever contextRetriever;
  private final TutorSessionStore sessionStore;
  private final TutorStateMachineDriver stateMachineDriver;
  private final ProgressTracker progressTracker;
  private final GoalSelector goalSelector;
  private final StarterQuestionGenerator questionGenerator;
  private final DialogueDriver dialogueDriver;
  private final UnderstandingEvaluator evaluator;
  private final SummaryGenerator summaryGenerator;
  private final TutorProperties properties;
  private final Clock clock;

  /**
   * Create a session and run it up to the first question
   */
  public CreateSessionResult createSession(String moduleId, String modelOverride) {
    CourseModule module = moduleCatalog.findModule(moduleId)
      .orElseThrow(() -> new ModuleNotFoundException(moduleId));
    if (module.getGoals() == null || module.getGoals().isEmpty()) {
      throw new NoGoalsException(moduleId);
    }

    String sessionId = SESSION_ID_PREFIX + UUID.randomUUID();
    TutorSession session = TutorSession.builder()
      .sessionId(sessionId)
      .moduleId(module.getId())
      .moduleName(module.getName())
      .phase(TutorPhase.INIT)
      .modelOverride(modelOverride)
      .build();

    Turn turn = new Turn(session, stateMachineDriver.restore(sessionId, TutorPhase.INIT));
    try {
      initialize(turn, module);
      advance(turn);
    } finally {
      stateMachineDriver.stop(turn.sm);
    }

    sessionStore.put(session, null);
    log.info("Created tutor session: sessionId={}, moduleId={}, goals={}", sessionId,
      module.getId(), module.getGoals().size());

    LearningGoal currentGoal = session.findGoal(session.getCurrentGoalId()).orElse(null);
    return CreateSessionResult.builder()
      .sessionId(sessionId)
      .moduleId(module.getId())
      .moduleName(module.getName())
      .firstMessage(turn.joinedMessages())
      .currentGoalId(session.getCurrentGoalId())
      .currentGoalDescription(currentGoal != null ? currentGoal.getDescription() : null)
      .totalGoals(session.getLearningGoals().size())
      .build();
  }

  /**
   * Resume a suspended session with the learner's answer
   */
  public TurnResult respond(String sessionId, String message) {
    StoredSession stored = sessionStore.get(sessionId)
      .orElseThrow(() -> new SessionNotFoundException(sessionId));
    TutorSession session = stored.session();
    if (session.getPhase() != TutorPhase.AWAITING_RESPONSE) {
      throw new SessionNotAwaitingResponseException(sessionId, session.getPhase());
    }
    log.debug("Responding to session {}: message length={}", sessionId,
      message != null ? message.length() : 0);

    Turn turn = new Turn(session, stateMachineDriver.restore(sessionId, session.getPhase()));
    try {
      dialogueDriver.acceptLearnerMessage(session, message);
      turn.fire(TutorEvent.RESPONSE_RECEIVED);
      evaluate(turn, message);
      advance(turn);
    } finally {
      stateMachineDriver.stop(turn.sm);
    }

    long version = sessionStore.put(session, stored.version());
    log.info("Session {} advanced to {} (version {})", sessionId, session.getPhase(), version);

    return toTurnResult(turn);
  }

  public SessionStateView getState(String sessionId) {
    TutorSession session = load(sessionId).session();
    LearningGoal currentGoal = session.findGoal(session.getCurrentGoalId()).orElse(null);
    StarterQuestion question = session.getCurrentQuestion();
    int completed = progressTracker.completedCount(session);
    int remaining = progressTracker.remainingCount(session);

    List<GoalProgressRow> rows = new ArrayList<>();
    for (LearningGoal goal : session.getLearningGoals()) {
      progressTracker.goalProgressView(session, goal.getId()).ifPresent(progress ->
        rows.add(GoalProgressRow.builder()
          .goalId(goal.getId())
          .description(goal.getDescription())
          .completed(progress.isCompleted())
          .questionsCount(progress.getStarterQuestions().size())
          .currentQuestionIndex(progress.getCurrentQuestionIndex())
          .initialUnderstanding(progress.getInitialUnderstanding())
          .finalUnderstanding(progress.getFinalUnderstanding())
          .build()));
    }

    return SessionStateView.builder()
      .sessionId(session.getSessionId())
      .moduleId(session.getModuleId())
      .moduleName(session.getModuleName())
      .phase(progressPhase(session, completed, remaining))
      .tutorPhase(session.getPhase())
      .totalGoals(session.getLearningGoals().size())
      .goalsCompleted(completed)
      .goalsRemaining(remaining)
      .currentGoalId(session.getCurrentGoalId())
      .currentGoalDescription(currentGoal != null ? currentGoal.getDescription() : null)
      .currentQuestionIndex(question != null ? question.getIndex() : null)
      .currentQuestionText(question != null ? question.getQuestionText() : null)
      .latestUnderstandingScore(latestScore(session))
      .goals(rows)
      .sessionStartedAt(session.getSessionStartedAt())
      .elapsedSeconds(elapsedSeconds(session))
      .build();
  }

  public TrajectoryView getTrajectory(String sessionId) {
    TutorSession session = load(sessionId).session();

    List<GoalTrajectory> goals = new ArrayList<>();
    for (LearningGoal goal : session.getLearningGoals()) {
      GoalProgress progress = progressTracker.goalProgressView(session, goal.getId()).orElse(null);
      if (progress == null || progress.getStartedAt() == null) {
        continue;
      }
      goals.add(GoalTrajectory.builder()
        .goalId(goal.getId())
        .description(goal.getDescription())
        .completed(progress.isCompleted())
        .initialUnderstanding(progress.getInitialUnderstanding())
        .finalUnderstanding(progress.getFinalUnderstanding())
        .points(progress.getTrajectory().size())
        .questions(progress.getStarterQuestions().stream()
          .map(q -> QuestionRow.builder()
            .index(q.getIndex())
            .questionText(q.getQuestionText())
            .expectedDepth(q.getExpectedDepth())
            .resolved(q.isResolved())
            .exchanges(q.getExchanges())
            .build())
          .toList())
        .build());
    }

    return TrajectoryView.builder()
      .sessionId(session.getSessionId())
      .trajectory(progressTracker.fullTrajectory(session))
      .goals(goals)
      .build();
  }

  /**
   * @throws SessionNotCompleteException goals remain
   */
  public SessionSummary getSummary(String sessionId) {
    TutorSession session = load(sessionId).session();
    int remaining = progressTracker.remainingCount(session);
    if (remaining > 0 || session.getSummary() == null) {
      throw new SessionNotCompleteException(sessionId, remaining);
    }
    return session.getSummary();
  }

  // ===== transitions =====

  /**
   * INIT: snapshot goals, prefetch context per goal
   */
  private void initialize(Turn turn, CourseModule module) {
    TutorSession session = turn.session;
    session.setSessionStartedAt(clock.instant());
    for (LearningGoal goal : module.getGoals()) {
      session.getLearningGoals().add(goal);
      session.getGoalProgress().put(goal.getId(), GoalProgress.builder()
        .goalId(goal.getId())
        .goalDescription(goal.getDescription())
        .build());
      session.getGoalContexts().put(goal.getId(), prefetchContext(goal));
    }

    turn.emit(dialogueDriver.say(session, welcomeMessage(module)));
    turn.fire(TutorEvent.INITIALIZED);
  }

  /**
   * Run non-suspending phases until the session waits for input or is done
   */
  private void advance(Turn turn) {
    while (!TutorPhase.isSuspension(turn.phase())) {
      switch (turn.phase()) {
        case SELECTING_GOAL:
          selectGoal(turn);
          break;
        case GENERATING_QUESTIONS:
          generateQuestions(turn);
          break;
        case ADVANCING_QUESTION:
          advanceQuestion(turn);
          break;
        case GOAL_COMPLETE:
          completeGoal(turn);
          break;
        case SUMMARIZING:
          summarize(turn);
          break;
        default:
          throw new IllegalStateException("Cannot advance from phase " + turn.phase());
      }
    }
  }

  private void selectGoal(Turn turn) {
    TutorSession session = turn.session;
    LearningGoal goal = goalSelector.select(session).orElse(null);
    if (goal == null) {
      turn.fire(TutorEvent.ALL_GOALS_COMPLETE);
      return;
    }
    progressTracker.startGoal(session, goal);
    turn.emit(dialogueDriver.say(session,
      "Let's focus on this learning goal: **" + goal.getDescription() + "**"));
    log.debug("Session {} selected goal {}", session.getSessionId(), goal.getId());
    turn.fire(TutorEvent.GOAL_SELECTED);
  }

  private void generateQuestions(Turn turn) {
    TutorSession session = turn.session;
    LearningGoal goal = currentGoal(session);
    List<StarterQuestion> questions = questionGenerator.generate(goal,
      session.contextOf(goal.getId()), session.getModuleName(), session.getModelOverride());
    progressTracker.assignQuestions(session, questions);
    turn.emit(dialogueDriver.present(session));
    turn.fire(TutorEvent.QUESTIONS_READY);
  }

  /**
   * EVALUATING: score the answer, record it, and route
   */
  private void evaluate(Turn turn, String message) {
    TutorSession session = turn.session;
    LearningGoal goal = currentGoal(session);
    StarterQuestion question = session.getCurrentQuestion();
    List<ContextPassage> passages = session.contextOf(goal.getId());

    EvaluationResult evaluation = evaluator.evaluate(goal, question, message, passages,
      session.getModelOverride());
    progressTracker.recordEvaluation(session, message, evaluation);

    if (!evaluation.isResolved()) {
      turn.emit(dialogueDriver.followUp(session, goal, evaluation, message));
      turn.fire(TutorEvent.NOT_RESOLVED);
    } else if (session.progressOf(goal.getId()).hasMoreQuestions()) {
      turn.fire(TutorEvent.QUESTION_RESOLVED);
    } else {
      turn.fire(TutorEvent.GOAL_RESOLVED);
    }
  }

  private void advanceQuestion(Turn turn) {
    TutorSession session = turn.session;
    progressTracker.advanceQuestion(session);
    turn.emit(dialogueDriver.say(session, "Great progress! Let's move on to the next question."));
    turn.emit(dialogueDriver.present(session));
    turn.fire(TutorEvent.QUESTION_PRESENTED);
  }

  private void completeGoal(Turn turn) {
    TutorSession session = turn.session;
    LearningGoal goal = currentGoal(session);
    progressTracker.completeGoal(session);
    turn.goalCompleted = true;
    log.info("Session {} completed goal {}", session.getSessionId(), goal.getId());

    String message = "Excellent! You've demonstrated understanding of: **" + goal.getDescription()
      + "**";
    if (progressTracker.remainingCount(session) > 0) {
      turn.emit(dialogueDriver.say(session, message + "\n\nLet's continue to the next topic."));
      turn.fire(TutorEvent.NEXT_GOAL);
    } else {
      turn.emit(dialogueDriver.say(session, message));
      turn.fire(TutorEvent.ALL_GOALS_COMPLETE);
    }
  }

  private void summarize(Turn turn) {
    TutorSession session = turn.session;
    SessionSummary summary = summaryGenerator.summarize(session, clock.instant());
    session.setSummary(summary);
    turn.emit(dialogueDriver.say(session, summaryGenerator.completionMessage(summary)));
    turn.fire(TutorEvent.SUMMARY_READY);
  }

  // ===== helpers =====

  private List<ContextPassage> prefetchContext(LearningGoal goal) {
    try {
      return new ArrayList<>(
        contextRetriever.retrieve(goal.getDescription(), properties.getContextResultsPerGoal()));
    } catch (RuntimeException e) {
      log.warn("Context prefetch failed for goal {}: {}", goal.getId(), e.getMessage());
      return new ArrayList<>();
    }
  }

  private String welcomeMessage(CourseModule module) {
    return "Welcome to your tutoring session for **" + module.getName() + "**! We'll work through "
      + module.getGoals().size() + " learning goal(s) together. I'll ask questions to help you "
      + "think things through, so take your time and explain your reasoning.";
  }

  private LearningGoal currentGoal(TutorSession session) {
    return session.findGoal(session.getCurrentGoalId())
      .orElseThrow(() -> new IllegalStateException(
        "Session " + session.getSessionId() + " has no current goal"));
  }

  private StoredSession load(String sessionId) {
    return sessionStore.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
  }

  private TurnResult toTurnResult(Turn turn) {
    TutorSession session = turn.session;
    LearningGoal goal = session.findGoal(session.getCurrentGoalId()).orElse(null);
    StarterQuestion question = session.getCurrentQuestion();

    TurnPhase phase;
    if (session.getPhase() == TutorPhase.DONE) {
      phase = TurnPhase.SESSION_COMPLETE;
    } else if (turn.goalCompleted) {
      phase = TurnPhase.GOAL_COMPLETE;
    } else {
      phase = TurnPhase.IN_PROGRESS;
    }

    return TurnResult.builder()
      .sessionId(session.getSessionId())
      .phase(phase)
      .currentGoalId(session.getCurrentGoalId())
      .currentGoalDescription(goal != null ? goal.getDescription() : null)
      .currentQuestionIndex(question != null ? question.getIndex() : null)
      .currentQuestionText(question != null ? question.getQuestionText() : null)
      .tutorMessage(turn.joinedMessages())
      .latestUnderstandingScore(latestScore(session))
      .goalsCompleted(progressTracker.completedCount(session))
      .goalsRemaining(progressTracker.remainingCount(session))
      .build();
  }

  private ProgressPhase progressPhase(TutorSession session, int completed, int remaining) {
    if (remaining == 0 && completed > 0) {
      return ProgressPhase.COMPLETE;
    }
    if (session.getCurrentGoalId() != null) {
      return ProgressPhase.IN_PROGRESS;
    }
    return ProgressPhase.INITIALIZING;
  }

  private Double latestScore(TutorSession session) {
    return session.getLatestEvaluation() != null ? session.getLatestEvaluation().getScore() : null;
  }

  private double elapsedSeconds(TutorSession session) {
    if (session.getSessionStartedAt() == null) {
      return 0.0;
    }
    Instant end = session.getSummary() != null && session.getSummary().getCompletedAt() != null
      ? session.getSummary().getCompletedAt() : clock.instant();
    return Duration.between(session.getSessionStartedAt(), end).toMillis() / 1000.0;
  }

  /**
   * Working state of one call: the session copy, its state machine and emitted tutor messages
   */
  private class Turn {

    private final TutorSession session;
    private final StateMachine<TutorPhase, TutorEvent> sm;
    private final List<String> messages = new ArrayList<>();
    private boolean goalCompleted;

    Turn(TutorSession session, StateMachine<TutorPhase, TutorEvent> sm) {
      this.session = session;
      this.sm = sm;
    }

    TutorPhase phase() {
      return stateMachineDriver.getCurrentPhase(sm);
    }

    void fire(TutorEvent event) {
      session.setPhase(stateMachineDriver.fire(sm, event));
    }

    void emit(String message) {
      messages.add(message);
    }

    String joinedMessages() {
      return String.join(MESSAGE_SEPARATOR, messages);
    }
  }
}
