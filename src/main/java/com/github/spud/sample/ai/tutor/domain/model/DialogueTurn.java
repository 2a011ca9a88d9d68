package com.github.spud.sample.ai.tutor.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DialogueTurn {

  public enum Role {
    TUTOR,
    LEARNER
  }

  Role role;
  String content;
  Instant timestamp;
}
