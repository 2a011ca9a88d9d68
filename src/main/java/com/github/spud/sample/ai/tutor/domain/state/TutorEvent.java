package com.github.spud.sample.ai.tutor.domain.state;

/**
 * 辅导会话事件
 */
public enum TutorEvent {
  // 模块目标加载完毕
  INITIALIZED,
  GOAL_SELECTED,
  QUESTIONS_READY,
  RESPONSE_RECEIVED,
  // 评估路由
  NOT_RESOLVED,
  QUESTION_RESOLVED,
  GOAL_RESOLVED,
  QUESTION_PRESENTED,
  NEXT_GOAL,
  ALL_GOALS_COMPLETE,
  SUMMARY_READY
}
