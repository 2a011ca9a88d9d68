package com.github.spud.sample.ai.tutor.infrastructure.rag;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.spud.sample.ai.tutor.config.RagProperties;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * 检索结果缓存 相同查询复用已检索的段落，缓存故障只降级为未命中
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "true")
public class RetrievalCache {

  private static final String KEY_PREFIX = "tutor:rag:";

  private final StringRedisTemplate redisTemplate;
  private final RagProperties ragProperties;

  public Optional<List<ContextPassage>> get(String query, int maxResults) {
    String key = buildKey(query, maxResults);
    try {
      String cached = redisTemplate.opsForValue().get(key);
      if (cached != null) {
        log.debug("Retrieval cache hit for key: {}", key);
        List<ContextPassage> passages = JsonUtils.fromJson(cached, new TypeReference<>() {
        });
        return Optional.of(passages);
      }
    } catch (Exception e) {
      log.warn("Failed to get retrieval from cache: {}", e.getMessage());
    }
    return Optional.empty();
  }

  public void put(String query, int maxResults, List<ContextPassage> passages) {
    String key = buildKey(query, maxResults);
    try {
      Duration ttl = Duration.ofSeconds(ragProperties.getCache().getRetrieval().getTtl());
      redisTemplate.opsForValue().set(key, JsonUtils.toJson(passages), ttl);
      log.debug("Cached retrieval for key: {}", key);
    } catch (Exception e) {
      log.warn("Failed to cache retrieval: {}", e.getMessage());
    }
  }

  private String buildKey(String query, int maxResults) {
    String raw = query + "|" + maxResults;
    String hash = DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
    return KEY_PREFIX + hash;
  }
}
