package com.github.spud.sample.ai.agentic.model;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 模型路由配置 按 app.model.router.backends 顺序组装回退链，并选择主嵌入模型
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ModelRouterProperties.class)
public class ModelRoutingConfig {

  @Value("${app.model.embedding-provider:openai}")
  private String embeddingProvider;

  @Bean
  public ModelRouter modelRouter(ModelRouterProperties properties,
    ObjectProvider<OpenAiChatModel> openAiChatModel,
    ObjectProvider<OllamaChatModel> ollamaChatModel) {

    List<ModelBackend> backends = new ArrayList<>();
    for (ModelRouterProperties.Backend config : properties.getBackends()) {
      ChatModel chatModel = selectChatModel(config.getProvider(), openAiChatModel,
        ollamaChatModel);
      if (chatModel == null) {
        log.warn("No chat model available for backend {} (provider={})", config.getName(),
          config.getProvider());
      }
      backends.add(new ChatModelBackend(config.getName(), chatModel, config.getModel(),
        config.getTimeout(), config.isEnabled()));
    }
    log.info("Model fallback chain: {}",
      backends.stream().map(ModelBackend::name).toList());

    return new ModelRouter(backends, properties.getMaxAttemptsPerBackend(),
      properties.getRetryBackoff());
  }

  /**
   * 根据 provider 选择 ChatModel
   */
  ChatModel selectChatModel(String provider, ObjectProvider<OpenAiChatModel> openAiChatModel,
    ObjectProvider<OllamaChatModel> ollamaChatModel) {
    if ("ollama".equalsIgnoreCase(provider)) {
      return ollamaChatModel.getIfAvailable();
    }
    return openAiChatModel.getIfAvailable();
  }

  @Primary
  @Bean("agentEmbeddingModel")
  public EmbeddingModel agentEmbeddingModel(
    ObjectProvider<OpenAiEmbeddingModel> openAiEmbeddingModel,
    ObjectProvider<OllamaEmbeddingModel> ollamaEmbeddingModel) {
    if ("ollama".equalsIgnoreCase(embeddingProvider)) {
      log.info("Using Ollama embedding model");
      return ollamaEmbeddingModel.getObject();
    }
    log.info("Using OpenAI embedding model");
    return openAiEmbeddingModel.getObject();
  }
}
