package com.github.spud.sample.ai.tutor.infrastructure.rag;

import com.github.spud.sample.ai.tutor.config.RagProperties;
import com.github.spud.sample.ai.tutor.domain.capability.ContextPassage;
import com.github.spud.sample.ai.tutor.domain.capability.ContextRetriever;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 基于 VectorStore 的上下文检索
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "true")
public class VectorStoreContextRetriever implements ContextRetriever {

  private static final String SOURCE_KEY = "source";

  private final VectorStore vectorStore;
  private final RagProperties ragProperties;
  private final RetrievalCache retrievalCache;

  @Override
  public List<ContextPassage> retrieve(String query, int maxResults) {
    if (query == null || query.isBlank() || maxResults <= 0) {
      return List.of();
    }

    Optional<List<ContextPassage>> cached = retrievalCache.get(query, maxResults);
    if (cached.isPresent()) {
      return cached.get();
    }

    try {
      SearchRequest request = SearchRequest.builder()
        .query(query)
        .topK(maxResults)
        .similarityThreshold(ragProperties.getSimilarityThreshold())
        .build();

      log.debug("Context search request: {}", request);
      List<Document> results = vectorStore.similaritySearch(request);
      List<ContextPassage> passages = results == null ? List.of() : results.stream()
        .map(this::toPassage)
        .toList();

      retrievalCache.put(query, maxResults, passages);
      return passages;
    } catch (Exception e) {
      log.warn("Context retrieval failed, continuing without context: {}", e.getMessage());
      return List.of();
    }
  }

  private ContextPassage toPassage(Document doc) {
    Object source = doc.getMetadata().get(SOURCE_KEY);
    return ContextPassage.builder()
      .text(doc.getText())
      .sourceRef(source != null ? source.toString() : doc.getId())
      .build();
  }
}
