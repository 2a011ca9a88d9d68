package com.github.spud.sample.ai.tutor.infrastructure.persistence.entity;

import com.github.spud.sample.ai.tutor.domain.state.TutorPhase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;

/**
 * 辅导会话表，会话整体以 JSON 快照保存
 */
@Getter
@Setter
@Entity
@Table(name = "tutor_session")
public class TutorSessionEntity {

  @Id
  @Size(max = 64)
  @Column(name = "session_id", nullable = false, length = 64)
  private String sessionId;

  @Size(max = 64)
  @NotNull
  @Column(name = "module_id", nullable = false, length = 64)
  private String moduleId;

  @NotNull
  @Column(name = "phase", nullable = false, length = 32)
  @Enumerated(EnumType.STRING)
  private TutorPhase phase;

  @NotNull
  @Column(name = "state_json", nullable = false, length = Integer.MAX_VALUE)
  private String stateJson;

  @NotNull
  @ColumnDefault("0")
  @Column(name = "version", nullable = false)
  private Long version;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;

  @ColumnDefault("now()")
  @Column(name = "updated_at")
  private OffsetDateTime updatedAt;

}
