package com.github.spud.sample.ai.tutor.domain.capability;

/**
 * 生成调用的用途，用于日志和路由
 */
public enum GenerationPurpose {
  QUESTIONS,
  EVALUATION,
  FOLLOW_UP,
  SUMMARY
}
