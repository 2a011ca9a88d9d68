package com.github.spud.sample.ai.tutor.support;

import com.github.spud.sample.ai.tutor.domain.state.TutorEvent;
import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import com.github.spud.sample.ai.tutor.domain.state.TutorStateMachineConfig;
import java.util.UUID;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineBuilder;
import org.springframework.statemachine.config.StateMachineFactory;

/**
 * Builds tutor state machines from the production transition table without a Spring context
 */
public final class TestStateMachines {

  private TestStateMachines() {
  }

  public static StateMachine<TutorPhase, TutorEvent> build() {
    try {
      StateMachineBuilder.Builder<TutorPhase, TutorEvent> builder = StateMachineBuilder.builder();
      builder.configureConfiguration()
        .withConfiguration()
        .autoStartup(false);
      TutorStateMachineConfig.defineStates(builder.configureStates());
      TutorStateMachineConfig.defineTransitions(builder.configureTransitions());
      return builder.build();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to build tutor state machine", e);
    }
  }

  public static StateMachineFactory<TutorPhase, TutorEvent> factory() {
    return new StateMachineFactory<>() {
      @Override
      public StateMachine<TutorPhase, TutorEvent> getStateMachine() {
        return build();
      }

      @Override
      public StateMachine<TutorPhase, TutorEvent> getStateMachine(String machineId) {
        return build();
      }

      @Override
      public StateMachine<TutorPhase, TutorEvent> getStateMachine(UUID uuid) {
        return build();
      }
    };
  }
}
