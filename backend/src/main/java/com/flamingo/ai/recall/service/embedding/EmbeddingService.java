package com.flamingo.ai.recall.service.embedding;

import com.flamingo.ai.recall.config.RecallConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embedding producer backed by a LangChain4j {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements EmbeddingProducer {

  private static final float[] NO_EMBEDDING = new float[0];

  private final EmbeddingModel embeddingModel;
  private final RecallConfig recallConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding", fallbackMethod = "embedFallback")
  public float[] embedQuery(String query) {
    return embed(recallConfig.getEmbedding().getQueryPrefix() + query, "query");
  }

  @Override
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "embedding")
  @Retry(name = "embedding", fallbackMethod = "embedFallback")
  public float[] embedPassage(String passage) {
    return embed(recallConfig.getEmbedding().getPassagePrefix() + passage, "passage");
  }

  @Override
  public String modelName() {
    return recallConfig.getEmbedding().getModelName();
  }

  private float[] embed(String text, String type) {
    String prepared = prepare(text, recallConfig.getEmbedding().getMaxChars());
    log.debug("Embedding {} of {} chars", type, prepared.length());

    Response<Embedding> response = embeddingModel.embed(prepared);
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vector();
  }

  /** Replaces NUL characters, which the embedding endpoint rejects, and truncates. */
  static String prepare(String text, int maxChars) {
    String cleaned = text == null ? "" : text.replace('\u0000', ' ');
    if (maxChars > 0 && cleaned.length() > maxChars) {
      log.debug("Truncating embedding input from {} to {} chars", cleaned.length(), maxChars);
      cleaned = cleaned.substring(0, maxChars);
    }
    return cleaned;
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.warn("Embedding unavailable: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return NO_EMBEDDING;
  }
}
