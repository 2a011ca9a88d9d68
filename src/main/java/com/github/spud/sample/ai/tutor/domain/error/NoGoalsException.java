package com.github.spud.sample.ai.tutor.domain.error;

/**
 * 模块没有任何学习目标，无法开始辅导
 */
public class NoGoalsException extends TutorException {

  public NoGoalsException(String moduleId) {
    super("Module has no learning goals: " + moduleId);
  }
}
