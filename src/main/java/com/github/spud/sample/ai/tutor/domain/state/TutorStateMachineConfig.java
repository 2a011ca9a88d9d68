package com.github.spud.sample.ai.tutor.domain.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * 辅导会话状态机配置
 * <pre>
 * 状态流转:
 *   INIT --(INITIALIZED)--> SELECTING_GOAL
 *   SELECTING_GOAL --(GOAL_SELECTED)--> GENERATING_QUESTIONS
 *   SELECTING_GOAL --(ALL_GOALS_COMPLETE)--> SUMMARIZING
 *   GENERATING_QUESTIONS --(QUESTIONS_READY)--> AWAITING_RESPONSE
 *   AWAITING_RESPONSE --(RESPONSE_RECEIVED)--> EVALUATING
 *   EVALUATING --(NOT_RESOLVED)--> AWAITING_RESPONSE
 *   EVALUATING --(QUESTION_RESOLVED)--> ADVANCING_QUESTION
 *   EVALUATING --(GOAL_RESOLVED)--> GOAL_COMPLETE
 *   ADVANCING_QUESTION --(QUESTION_PRESENTED)--> AWAITING_RESPONSE
 *   GOAL_COMPLETE --(NEXT_GOAL)--> SELECTING_GOAL
 *   GOAL_COMPLETE --(ALL_GOALS_COMPLETE)--> SUMMARIZING
 *   SUMMARIZING --(SUMMARY_READY)--> DONE
 * </pre>
 * 转换表以静态方法暴露，单元测试可以直接用 StateMachineBuilder 构建同一张表。
 */
@Configuration
@EnableStateMachineFactory
public class TutorStateMachineConfig extends
  EnumStateMachineConfigurerAdapter<TutorPhase, TutorEvent> {

  @Override
  public void configure(StateMachineConfigurationConfigurer<TutorPhase, TutorEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<TutorPhase, TutorEvent> states)
    throws Exception {
    defineStates(states);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<TutorPhase, TutorEvent> transitions)
    throws Exception {
    defineTransitions(transitions);
  }

  public static void defineStates(StateMachineStateConfigurer<TutorPhase, TutorEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(TutorPhase.INIT)
      .states(EnumSet.allOf(TutorPhase.class))
      .end(TutorPhase.DONE);
  }

  public static void defineTransitions(
    StateMachineTransitionConfigurer<TutorPhase, TutorEvent> transitions) throws Exception {
    transitions
      .withExternal()
      .source(TutorPhase.INIT).target(TutorPhase.SELECTING_GOAL)
      .event(TutorEvent.INITIALIZED)
      .and()

      .withExternal()
      .source(TutorPhase.SELECTING_GOAL).target(TutorPhase.GENERATING_QUESTIONS)
      .event(TutorEvent.GOAL_SELECTED)
      .and()
      .withExternal()
      .source(TutorPhase.SELECTING_GOAL).target(TutorPhase.SUMMARIZING)
      .event(TutorEvent.ALL_GOALS_COMPLETE)
      .and()

      .withExternal()
      .source(TutorPhase.GENERATING_QUESTIONS).target(TutorPhase.AWAITING_RESPONSE)
      .event(TutorEvent.QUESTIONS_READY)
      .and()

      // 学习者回复后进入评估
      .withExternal()
      .source(TutorPhase.AWAITING_RESPONSE).target(TutorPhase.EVALUATING)
      .event(TutorEvent.RESPONSE_RECEIVED)
      .and()

      // 评估路由
      .withExternal()
      .source(TutorPhase.EVALUATING).target(TutorPhase.AWAITING_RESPONSE)
      .event(TutorEvent.NOT_RESOLVED)
      .and()
      .withExternal()
      .source(TutorPhase.EVALUATING).target(TutorPhase.ADVANCING_QUESTION)
      .event(TutorEvent.QUESTION_RESOLVED)
      .and()
      .withExternal()
      .source(TutorPhase.EVALUATING).target(TutorPhase.GOAL_COMPLETE)
      .event(TutorEvent.GOAL_RESOLVED)
      .and()

      .withExternal()
      .source(TutorPhase.ADVANCING_QUESTION).target(TutorPhase.AWAITING_RESPONSE)
      .event(TutorEvent.QUESTION_PRESENTED)
      .and()

      .withExternal()
      .source(TutorPhase.GOAL_COMPLETE).target(TutorPhase.SELECTING_GOAL)
      .event(TutorEvent.NEXT_GOAL)
      .and()
      .withExternal()
      .source(TutorPhase.GOAL_COMPLETE).target(TutorPhase.SUMMARIZING)
      .event(TutorEvent.ALL_GOALS_COMPLETE)
      .and()

      .withExternal()
      .source(TutorPhase.SUMMARIZING).target(TutorPhase.DONE)
      .event(TutorEvent.SUMMARY_READY);
  }
}
