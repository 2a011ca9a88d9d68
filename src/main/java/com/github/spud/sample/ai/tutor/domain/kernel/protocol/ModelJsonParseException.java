package com.github.spud.sample.ai.tutor.domain.kernel.protocol;

import lombok.Getter;

/**
 * 模型输出 JSON 解析异常，只在调用方内部处理，不会越过组件边界
 */
@Getter
public class ModelJsonParseException extends Exception {

  private final String originalText;
  private final String reason;

  public ModelJsonParseException(String reason, String originalText) {
    super("Failed to parse model JSON: " + reason);
    this.reason = reason;
    this.originalText = originalText;
  }

  public ModelJsonParseException(String reason, String originalText, Throwable cause) {
    super("Failed to parse model JSON: " + reason, cause);
    this.reason = reason;
    this.originalText = originalText;
  }

}
