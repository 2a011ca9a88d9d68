package com.github.spud.sample.ai.tutor.domain.error;

/**
 * Base type for every error the tutoring engine reports to its callers.
 */
public abstract class TutorException extends RuntimeException {

  protected TutorException(String message) {
    super(message);
  }

  protected TutorException(String message, Throwable cause) {
    super(message, cause);
  }
}
