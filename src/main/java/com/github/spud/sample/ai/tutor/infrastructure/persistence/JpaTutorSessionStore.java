package com.github.spud.sample.ai.tutor.infrastructure.persistence;

import com.github.spud.sample.ai.tutor.domain.error.VersionConflictException;
import com.github.spud.sample.ai.tutor.domain.model.TutorSession;
import com.github.spud.sample.ai.tutor.domain.store.StoredSession;
import com.github.spud.sample.ai.tutor.domain.store.TutorSessionStore;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.entity.TutorSessionEntity;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.repository.TutorSessionRepository;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.time.OffsetDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 基于 JPA 的会话存储，版本号比较与写入在同一条 UPDATE 中完成
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.tutor.store", havingValue = "jpa", matchIfMissing = true)
public class JpaTutorSessionStore implements TutorSessionStore {

  private final TutorSessionRepository repository;
  private final TransactionTemplate transactionTemplate;

  @Override
  public Optional<StoredSession> get(String sessionId) {
    return repository.findById(sessionId)
      .map(entity -> new StoredSession(
        JsonUtils.fromJson(entity.getStateJson(), TutorSession.class),
        entity.getVersion()));
  }

  @Override
  public long put(TutorSession session, Long expectedVersion) {
    String sessionId = session.getSessionId();
    String json = JsonUtils.toJson(session);

    Long written = transactionTemplate.execute(status -> {
      if (expectedVersion == null) {
        if (repository.existsById(sessionId)) {
          throw new VersionConflictException(sessionId, null);
        }
        TutorSessionEntity entity = new TutorSessionEntity();
        entity.setSessionId(sessionId);
        entity.setModuleId(session.getModuleId());
        entity.setPhase(session.getPhase());
        entity.setStateJson(json);
        entity.setVersion(0L);
        entity.setUpdatedAt(OffsetDateTime.now());
        repository.saveAndFlush(entity);
        return 0L;
      }

      Integer updated = repository.tryUpdateState(sessionId, json, session.getPhase(),
        expectedVersion, OffsetDateTime.now());
      if (updated == null || updated != 1) {
        log.warn("Version conflict for session {}: expected={}", sessionId, expectedVersion);
        throw new VersionConflictException(sessionId, expectedVersion);
      }
      return expectedVersion + 1;
    });

    log.debug("Stored session {} at version {}", sessionId, written);
    return written;
  }
}
