package com.flamingo.ai.kbanalytics.config;

import com.flamingo.ai.kbanalytics.agent.DocumentUnderstandingAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agent interfaces declare prompts with @SystemMessage/@UserMessage; concrete implementations
 * are produced by AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /**
   * Document understanding agent that extracts topics, technologies and insights. Uses the JSON
   * response format chat model for structured output.
   */
  @Bean
  public DocumentUnderstandingAgent documentUnderstandingAgent(ChatModel chatModel) {
    return AiServices.builder(DocumentUnderstandingAgent.class).chatModel(chatModel).build();
  }
}
