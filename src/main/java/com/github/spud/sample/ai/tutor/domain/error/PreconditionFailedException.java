package com.github.spud.sample.ai.tutor.domain.error;

/**
 * 操作在会话当前阶段不被允许
 */
public class PreconditionFailedException extends TutorException {

  public PreconditionFailedException(String message) {
    super(message);
  }
}
