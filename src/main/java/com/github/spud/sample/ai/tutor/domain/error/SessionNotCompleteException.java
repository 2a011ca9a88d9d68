package com.github.spud.sample.ai.tutor.domain.error;

import lombok.Getter;

@Getter
public class SessionNotCompleteException extends PreconditionFailedException {

  private final int remainingGoals;

  public SessionNotCompleteException(String sessionId, int remainingGoals) {
    super("Session " + sessionId + " is not complete, " + remainingGoals + " goal(s) remaining");
    this.remainingGoals = remainingGoals;
  }
}
