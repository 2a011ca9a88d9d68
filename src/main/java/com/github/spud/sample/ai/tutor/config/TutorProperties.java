package com.github.spud.sample.ai.tutor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 辅导引擎配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.tutor")
public class TutorProperties {

  /**
   * 会话存储：jpa 或 memory
   */
  private String store = "jpa";

  /**
   * 每个目标最多保留的引导问题数，超过 5 按 5 处理
   */
  private int maxQuestionsPerGoal = 5;

  /**
   * 会话初始化时每个目标预取的上下文段落数
   */
  private int contextResultsPerGoal = 8;

  private ContextLimits context = new ContextLimits();

  private TokenBudgets tokens = new TokenBudgets();

  /**
   * 总结中保留的误解/突破条数
   */
  private int keyInsightLimit = 10;

  @Data
  public static class ContextLimits {

    private int questions = 5;
    private int evaluation = 3;
    private int followUp = 5;
  }

  @Data
  public static class TokenBudgets {

    private int questions = 2000;
    private int evaluation = 1000;
    private int followUp = 1500;
    private int summary = 1000;
  }
}
