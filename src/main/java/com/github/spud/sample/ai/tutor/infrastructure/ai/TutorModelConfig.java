package com.github.spud.sample.ai.tutor.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 模型配置 辅导引擎使用的 ChatClient
 */
@Slf4j
@Configuration
public class TutorModelConfig {

  @Value("${spring.ai.openai.chat.options.model:gpt-4o-mini}")
  private String defaultModel;

  @Value("${app.tutor.system-prompt:You are a patient Socratic tutor. Guide the learner with questions instead of giving answers away.}")
  private String systemPrompt;

  @Bean
  @Primary
  public ChatClient tutorChatClient(ChatModel chatModel) {
    log.info("Using {} as default tutor model", defaultModel);
    return ChatClient.builder(chatModel)
      .defaultSystem(systemPrompt)
      .build();
  }
}
