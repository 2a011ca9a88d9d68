package com.github.spud.sample.ai.tutor.domain.state;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.statemachine.support.DefaultExtendedState;
import org.springframework.statemachine.support.DefaultStateMachineContext;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * 状态机驱动器 - 会话服务与 StateMachine 的适配层
 * <p>
 * 状态机实例不跨调用保存：每次调用从持久化的阶段恢复一个新实例，用完即停。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TutorStateMachineDriver {

  private final StateMachineFactory<TutorPhase, TutorEvent> stateMachineFactory;

  /**
   * 创建状态机实例并恢复到指定阶段
   */
  public StateMachine<TutorPhase, TutorEvent> restore(String sessionId, TutorPhase phase) {
    StateMachine<TutorPhase, TutorEvent> sm = stateMachineFactory.getStateMachine(sessionId);
    sm.getStateMachineAccessor().doWithAllRegions(access -> access
      .resetStateMachineReactively(
        new DefaultStateMachineContext<>(phase, null, null, new DefaultExtendedState()))
      .block());
    sm.startReactively().block();
    log.debug("Restored state machine for session {} at {}", sessionId, phase);
    return sm;
  }

  public TutorPhase getCurrentPhase(StateMachine<TutorPhase, TutorEvent> sm) {
    return sm.getState().getId();
  }

  /**
   * 发送事件并等待状态转换完成
   */
  public boolean sendEvent(StateMachine<TutorPhase, TutorEvent> sm, TutorEvent event) {
    log.debug("Sending event {} to state machine, current phase: {}", event, getCurrentPhase(sm));

    StateMachineEventResult<TutorPhase, TutorEvent> result = sm
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();

    boolean accepted = result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;

    if (accepted) {
      log.debug("Event {} accepted, new phase: {}", event, getCurrentPhase(sm));
    } else {
      log.warn("Event {} rejected in phase {}", event, getCurrentPhase(sm));
    }
    return accepted;
  }

  /**
   * 发送事件，被拒绝说明调用方的流程有误
   *
   * @return 转换后的阶段
   */
  public TutorPhase fire(StateMachine<TutorPhase, TutorEvent> sm, TutorEvent event) {
    TutorPhase before = getCurrentPhase(sm);
    if (!sendEvent(sm, event)) {
      throw new IllegalStateException("Illegal transition: " + event + " in phase " + before);
    }
    return getCurrentPhase(sm);
  }

  public void stop(StateMachine<TutorPhase, TutorEvent> sm) {
    sm.stopReactively().block();
  }
}
