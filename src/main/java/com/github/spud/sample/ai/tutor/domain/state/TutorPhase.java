package com.github.spud.sample.ai.tutor.domain.state;

/**
 * 辅导会话状态
 */
public enum TutorPhase {
  INIT,
  SELECTING_GOAL,
  GENERATING_QUESTIONS,
  AWAITING_RESPONSE,
  EVALUATING,
  ADVANCING_QUESTION,
  GOAL_COMPLETE,
  SUMMARIZING,
  DONE;

  /**
   * 可以持久化并等待外部输入的状态
   */
  public static boolean isSuspension(TutorPhase phase) {
    return phase == AWAITING_RESPONSE || phase == DONE;
  }
}
