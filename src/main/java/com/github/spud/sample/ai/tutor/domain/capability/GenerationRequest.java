package com.github.spud.sample.ai.tutor.domain.capability;

import lombok.Builder;
import lombok.Value;

/**
 * 一次文本生成请求
 */
@Value
@Builder
public class GenerationRequest {

  GenerationPurpose purpose;

  String prompt;

  /**
   * 期望的 JSON 结构说明，自由文本生成时为空
   */
  String schemaHint;

  Integer maxOutputTokens;

  /**
   * 会话级模型覆盖，为空时使用默认模型
   */
  String modelOverride;
}
