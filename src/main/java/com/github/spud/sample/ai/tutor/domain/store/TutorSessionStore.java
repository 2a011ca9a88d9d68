package com.github.spud.sample.ai.tutor.domain.store;

import com.github.spud.sample.ai.tutor.domain.error.VersionConflictException;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import java.util.Optional;

/**
 * 会话存储，按 sessionId 做乐观并发控制
 */
public interface TutorSessionStore {

  /**
   * 读取会话，每次返回一个新反序列化的副本
   */
  Optional<StoredSession> get(String sessionId);

  /**
   * 写入会话
   *
   * @param expectedVersion 读取时的版本；为空表示插入，要求会话尚不存在
   * @return 写入后的版本
   * @throws VersionConflictException 版本不匹配
   */
  long put(TutorSession session, Long expectedVersion);
}
