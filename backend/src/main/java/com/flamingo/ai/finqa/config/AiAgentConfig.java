package com.flamingo.ai.finqa.config;

import com.flamingo.ai.finqa.agent.AnswerSynthesisAgent;
import com.flamingo.ai.finqa.agent.EvidenceDraftingAgent;
import com.flamingo.ai.finqa.agent.QueryClassificationAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the language-model prompts using LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Fallback question classifier. Uses the JSON-mode model for structured output. */
  @Bean
  public QueryClassificationAgent queryClassificationAgent(
      @Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(QueryClassificationAgent.class).chatModel(chatModel).build();
  }

  /** Drafts answers from retrieved passages. Uses the plain-text model. */
  @Bean
  public EvidenceDraftingAgent evidenceDraftingAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(EvidenceDraftingAgent.class).chatModel(textChatModel).build();
  }

  @Bean
  public AnswerSynthesisAgent answerSynthesisAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(AnswerSynthesisAgent.class).chatModel(textChatModel).build();
  }
}
