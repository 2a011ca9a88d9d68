package com.github.spud.sample.ai.tutor.infrastructure.ai;

import com.github.spud.sample.ai.tutor.domain.capability.CapabilityUnavailableException;
import com.github.spud.sample.ai.tutor.domain.capability.GenerationRequest;
import com.github.spud.sample.ai.tutor.domain.capability.TutorGenerator;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 基于 Spring AI ChatClient 的生成能力实现
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatClientTutorGenerator implements TutorGenerator {

  private static final Pattern THINK_BLOCK_PATTERN =
    Pattern.compile("<think>[\\s\\S]*?</think>", Pattern.CASE_INSENSITIVE);

  private static final String STRUCTURED_OUTPUT_CONSTRAINT = """
    Respond with a single JSON value and nothing else. No markdown, no commentary.
    The JSON must follow this structure:
    %s
    """;

  private final ChatClient chatClient;

  @Override
  public String generate(GenerationRequest request) {
    List<Message> messages = new ArrayList<>();
    if (StringUtils.hasText(request.getSchemaHint())) {
      messages.add(new SystemMessage(STRUCTURED_OUTPUT_CONSTRAINT.formatted(request.getSchemaHint())));
    }
    messages.add(new UserMessage(request.getPrompt()));

    OpenAiChatOptions options = OpenAiChatOptions.builder()
      .model(StringUtils.hasText(request.getModelOverride()) ? request.getModelOverride() : null)
      .maxTokens(request.getMaxOutputTokens())
      .build();

    log.debug("Calling chat client: purpose={}, prompt length={}, model override={}",
      request.getPurpose(), request.getPrompt().length(), request.getModelOverride());

    ChatResponse response;
    try {
      response = chatClient.prompt(new Prompt(messages, options)).call().chatResponse();
    } catch (RuntimeException e) {
      log.error("Chat client call failed for {}: {}", request.getPurpose(), e.getMessage(), e);
      throw new CapabilityUnavailableException(
        "Generator call failed for " + request.getPurpose() + ": " + e.getMessage(), e);
    }

    if (response == null || response.getResult() == null
      || response.getResult().getOutput() == null) {
      log.warn("No chat response received for {}", request.getPurpose());
      throw new CapabilityUnavailableException(
        "Generator returned no result for " + request.getPurpose());
    }

    String text = response.getResult().getOutput().getText();
    return stripThinking(text);
  }

  /**
   * 去掉推理模型输出的 think 块
   */
  static String stripThinking(String text) {
    if (text == null) {
      return "";
    }
    return THINK_BLOCK_PATTERN.matcher(text).replaceAll("").trim();
  }
}
