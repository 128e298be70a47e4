package com.flamingo.ai.recall.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model.
 *
 * <p>Talks to any OpenAI-compatible embeddings endpoint. The default points at a local Ollama
 * serving {@code nomic-embed-text}.
 */
@Configuration
@RequiredArgsConstructor
public class LangChain4jConfig {

  private final RecallConfig recallConfig;

  @Bean
  public EmbeddingModel embeddingModel() {
    RecallConfig.Embedding embedding = recallConfig.getEmbedding();
    validateEndpoint(embedding);

    return OpenAiEmbeddingModel.builder()
        .baseUrl(embedding.getBaseUrl())
        .apiKey(embedding.getApiKey())
        .modelName(embedding.getModelName())
        .dimensions(
            embedding.isSendDimensions() ? recallConfig.getSemantic().getDimensions() : null)
        .timeout(embedding.getTimeout())
        .maxRetries(0)
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateEndpoint(RecallConfig.Embedding embedding) {
    if (embedding.getBaseUrl() == null || embedding.getBaseUrl().isBlank()) {
      throw new IllegalStateException(
          "Embedding endpoint is required. Set recall.embedding.base-url.");
    }
    if (embedding.getApiKey() == null || embedding.getApiKey().isBlank()) {
      throw new IllegalStateException(
          "Embedding API key is required (any value for Ollama). Set recall.embedding.api-key.");
    }
  }
}
