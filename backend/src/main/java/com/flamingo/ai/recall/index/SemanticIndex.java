package com.flamingo.ai.recall.index;

import java.util.List;

/** Nearest-neighbour index over message embeddings, scored by cosine similarity. */
public interface SemanticIndex extends MessageIndex {

  /**
   * Finds the messages closest to {@code queryVector}.
   *
   * @param queryVector precomputed query embedding
   * @param filter conjunctive candidate filter
   * @param limit maximum number of hits
   * @return hits ordered by similarity desc, timestamp desc, id asc; empty when the vector has
   *     the wrong dimension
   * @throws com.flamingo.ai.recall.exception.IndexUnavailableException if no generation is
   *     published or the backend fails
   */
  List<IndexHit> search(float[] queryVector, CandidateFilter filter, int limit);
}
