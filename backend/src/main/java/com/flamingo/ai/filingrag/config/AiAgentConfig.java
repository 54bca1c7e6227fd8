package com.flamingo.ai.filingrag.config;

import com.flamingo.ai.filingrag.agent.AnswerSynthesisAgent;
import com.flamingo.ai.filingrag.agent.SqlGenerationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the LangChain4j AI Services used by the query pipeline.
 *
 * <p>Agents are declared as interfaces with @SystemMessage/@UserMessage and implemented by
 * AiServices, keeping the provider out of the pipeline code.
 */
@Configuration
public class AiAgentConfig {

  /** SQL generation returns structured JSON, so it uses the JSON-mode model. */
  @Bean
  public SqlGenerationAgent sqlGenerationAgent(ChatModel chatModel) {
    return AiServices.builder(SqlGenerationAgent.class).chatModel(chatModel).build();
  }

  @Bean
  public AnswerSynthesisAgent answerSynthesisAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(AnswerSynthesisAgent.class).chatModel(textChatModel).build();
  }
}
