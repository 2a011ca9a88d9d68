package com.github.spud.sample.ai.tutor.infrastructure.rag;

import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.ContextRetriever;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 未启用 RAG 时的检索实现，始终没有上下文
 */
@Component
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "false", matchIfMissing = true)
public class EmptyContextRetriever implements ContextRetriever {

  @Override
  public List<ContextPassage> retrieve(String query, int maxResults) {
    return List.of();
  }
}
