package com.flamingo.ai.recall.service.embedding;

/**
 * Produces embedding vectors for queries and stored messages.
 *
 * <p>Failures are reported as an empty vector, never as an exception, so callers degrade to
 * lexical-only retrieval.
 */
public interface EmbeddingProducer {

  /** Embeds search terms. Returns an empty array when no embedding is available. */
  float[] embedQuery(String query);

  /** Embeds message text. Returns an empty array when no embedding is available. */
  float[] embedPassage(String passage);

  /** Name of the model behind this producer, recorded with every stored vector. */
  String modelName();
}
