package com.github.spud.sample.ai.tutor.infrastructure.store;

import com.github.spud.sample.ai.tutor.domain.error.VersionConflictException;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.store.StoredSession;
import com.github.spud.sample.ai.tutor.domain.store.TutorSessionStore;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 进程内会话存储，保存序列化快照，读写互不共享对象
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.tutor.store", havingValue = "memory")
public class InMemoryTutorSessionStore implements TutorSessionStore {

  private final Map<String, Entry> entries = new ConcurrentHashMap<>();

  @Override
  public Optional<StoredSession> get(String sessionId) {
    Entry entry = entries.get(sessionId);
    if (entry == null) {
      return Optional.empty();
    }
    return Optional.of(
      new StoredSession(JsonUtils.fromJson(entry.json(), TutorSession.class), entry.version()));
  }

  @Override
  public long put(TutorSession session, Long expectedVersion) {
    String sessionId = session.getSessionId();
    String json = JsonUtils.toJson(session);

    Entry written = entries.compute(sessionId, (id, current) -> {
      if (expectedVersion == null) {
        if (current != null) {
          throw new VersionConflictException(id, null);
        }
        return new Entry(json, 0L);
      }
      if (current == null || current.version() != expectedVersion) {
        throw new VersionConflictException(id, expectedVersion);
      }
      return new Entry(json, current.version() + 1);
    });

    log.debug("Stored session {} at version {}", sessionId, written.version());
    return written.version();
  }

  private record Entry(String json, long version) {

  }
}
