package com.github.spud.sample.ai.tutor.domain.capability;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ContextPassage {

  String text;
  String sourceRef;
}
