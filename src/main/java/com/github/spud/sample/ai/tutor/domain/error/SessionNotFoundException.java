package com.github.spud.sample.ai.tutor.domain.error;

public class SessionNotFoundException extends TutorException {

  public SessionNotFoundException(String sessionId) {
    super("Session not found: " + sessionId);
  }
}
