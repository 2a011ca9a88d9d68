package com.github.spud.sample.ai.tutor.domain.kernel.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.tutor.util.JsonUtils;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 模型输出 JSON 提取器
 * <p>
 * 依次尝试：markdown 代码块内的内容、整段文本、混合文本中第一个括号配平的 JSON 对象或数组。 全部失败时抛出
 * {@link ModelJsonParseException}，由调用方决定兜底策略。
 */
@Slf4j
@Component
public class ModelJsonExtractor {

  private static final Pattern CODE_BLOCK_PATTERN =
    Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```", Pattern.CASE_INSENSITIVE);

  /**
   * 从模型原始输出中提取 JSON
   *
   * @param modelText 模型原始输出
   * @return 解析后的 JSON 节点（对象或数组）
   * @throws ModelJsonParseException 找不到合法 JSON
   */
  public JsonNode extract(String modelText) throws ModelJsonParseException {
    if (modelText == null || modelText.isBlank()) {
      throw new ModelJsonParseException("Model output is empty or null", modelText);
    }

    String cleaned = modelText.trim();
    log.debug("Extracting JSON from model text (length={}): {}", cleaned.length(),
      cleaned.length() > 200 ? cleaned.substring(0, 200) + "..." : cleaned);

    // 代码块优先
    Matcher matcher = CODE_BLOCK_PATTERN.matcher(cleaned);
    if (matcher.find()) {
      JsonNode fenced = tryRead(matcher.group(1).trim());
      if (fenced != null) {
        return fenced;
      }
    }

    if (looksLikeJson(cleaned)) {
      JsonNode whole = tryRead(cleaned);
      if (whole != null) {
        return whole;
      }
    }

    JsonNode embedded = scanBalanced(cleaned);
    if (embedded != null) {
      return embedded;
    }

    throw new ModelJsonParseException("No valid JSON payload found in model output", modelText);
  }

  private boolean looksLikeJson(String text) {
    return (text.startsWith("{") && text.endsWith("}"))
      || (text.startsWith("[") && text.endsWith("]"));
  }

  /**
   * 逐个起始括号扫描，找到配平的片段后尝试解析，字符串内的括号不计数
   */
  private JsonNode scanBalanced(String text) {
    for (int start = 0; start < text.length(); start++) {
      char open = text.charAt(start);
      if (open != '{' && open != '[') {
        continue;
      }
      int end = findClosing(text, start);
      if (end < 0) {
        continue;
      }
      JsonNode node = tryRead(text.substring(start, end + 1));
      if (node != null) {
        log.debug("Extracted JSON from mixed text at offset {}, length {}", start, end - start + 1);
        return node;
      }
    }
    return null;
  }

  private int findClosing(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char c = text.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == '{' || c == '[') {
        depth++;
      } else if (c == '}' || c == ']') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private JsonNode tryRead(String candidate) {
    if (candidate.isEmpty()) {
      return null;
    }
    try {
      JsonNode node = JsonUtils.readTree(candidate);
      if (node != null && node.isContainerNode()) {
        return node;
      }
    } catch (RuntimeException e) {
      log.debug("Candidate is not valid JSON: {}", e.getMessage());
    }
    return null;
  }
}
