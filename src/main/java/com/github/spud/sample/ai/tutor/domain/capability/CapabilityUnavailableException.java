package com.github.spud.sample.ai.tutor.domain.capability;

import com.github.spud.sample.ai.tutor.domain.error.TutorException;

/**
 * 外部能力（生成、检索）暂时不可用，可以重试
 */
public class CapabilityUnavailableException extends TutorException {

  public CapabilityUnavailableException(String message) {
    super(message);
  }

  public CapabilityUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
