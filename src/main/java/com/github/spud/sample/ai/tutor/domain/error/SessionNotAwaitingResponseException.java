package com.github.spud.sample.ai.tutor.domain.error;

import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import lombok.Getter;

@Getter
public class SessionNotAwaitingResponseException extends PreconditionFailedException {

  private final TutorPhase phase;

  public SessionNotAwaitingResponseException(String sessionId, TutorPhase phase) {
    super("Session " + sessionId + " is not awaiting a response (phase=" + phase + ")");
    this.phase = phase;
  }
}
