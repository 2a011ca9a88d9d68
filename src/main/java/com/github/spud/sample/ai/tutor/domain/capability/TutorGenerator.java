package com.github.spud.sample.ai.tutor.domain.capability;

/**
 * 文本生成能力
 */
public interface TutorGenerator {

  /**
   * @return 模型输出文本
   * @throws CapabilityUnavailableException 底层模型不可用或调用失败
   */
  String generate(GenerationRequest request);
}
