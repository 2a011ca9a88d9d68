package com.github.spud.sample.ai.tutor.domain.error;

import lombok.Getter;

/**
 * 乐观并发冲突：会话在读取之后已被其他调用写入，调用方可以重新读取后重试
 */
@Getter
public class VersionConflictException extends TutorException {

  private final String sessionId;
  private final Long expectedVersion;

  public VersionConflictException(String sessionId, Long expectedVersion) {
    super("Version conflict for session " + sessionId + " (expected version "
      + (expectedVersion == null ? "<none>" : expectedVersion) + ")");
    this.sessionId = sessionId;
    this.expectedVersion = expectedVersion;
  }
}
