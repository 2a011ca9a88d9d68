package com.github.spud.sample.ai.tutor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RAG 配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rag")
public class RagProperties {

  /**
   * 是否启用向量检索，关闭时使用空检索
   */
  private boolean enabled = true;

  /**
   * 相似度阈值，低于该值的段落被丢弃
   */
  private double similarityThreshold = 0.0;

  private CacheConfig cache = new CacheConfig();

  @Data
  public static class CacheConfig {

    private RetrievalCacheConfig retrieval = new RetrievalCacheConfig();
  }

  @Data
  public static class RetrievalCacheConfig {

    /**
     * TTL（秒）
     */
    private long ttl = 3600; // 1 hour
  }
}
