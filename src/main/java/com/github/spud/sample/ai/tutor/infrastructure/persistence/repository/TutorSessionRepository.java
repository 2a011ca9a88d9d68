package com.github.spud.sample.ai.tutor.infrastructure.persistence.repository;

import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import com.github.spud.sample.ai.tutor.infrastructure.persistence.entity.TutorSessionEntity;
import java.time.OffsetDateTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface TutorSessionRepository extends JpaRepository<TutorSessionEntity, String> {

  /**
   * 版本号匹配时写入新快照并递增版本
   *
   * @return 受影响行数，1 表示成功
   */
  @Modifying
  @Query("UPDATE TutorSessionEntity s SET s.stateJson = :stateJson, s.phase = :phase, "
    + "s.version = s.version + 1, s.updatedAt = :updatedAt "
    + "WHERE s.sessionId = :sessionId AND s.version = :expectedVersion")
  Integer tryUpdateState(String sessionId, String stateJson, TutorPhase phase,
    Long expectedVersion, OffsetDateTime updatedAt);

}
