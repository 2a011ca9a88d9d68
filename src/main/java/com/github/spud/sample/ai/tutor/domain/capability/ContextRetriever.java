package com.github.spud.sample.ai.tutor.domain.capability;

import java.util.List;

/**
 * 上下文检索能力，尽力而为：任何失败都返回空列表，不向上抛出
 */
public interface ContextRetriever {

  List<ContextPassage> retrieve(String query, int maxResults);
}
