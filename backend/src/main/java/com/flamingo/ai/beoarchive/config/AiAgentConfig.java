package com.flamingo.ai.beoarchive.config;

import com.flamingo.ai.beoarchive.agent.BeoAnalystInstructions;
import com.flamingo.ai.beoarchive.agent.BeoDocumentAnalystAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds AI agents from their LangChain4j AI Service interfaces. */
@Configuration
@Slf4j
public class AiAgentConfig {

  /**
   * BEO analyst agent. The system message comes from {@code beo.classification.instructions} when
   * set, otherwise from the built-in instructions.
   */
  @Bean
  public BeoDocumentAnalystAgent beoDocumentAnalystAgent(
      ChatModel chatModel, BeoArchiveConfig config) {
    String configured = config.getClassification().getInstructions();
    boolean overridden = configured != null && !configured.isBlank();
    String instructions = overridden ? configured : BeoAnalystInstructions.DEFAULT;
    if (overridden) {
      log.info("Using configured BEO analyst instructions ({} chars)", instructions.length());
    }
    return AiServices.builder(BeoDocumentAnalystAgent.class)
        .chatModel(chatModel)
        .systemMessageProvider(memoryId -> instructions)
        .build();
  }
}
