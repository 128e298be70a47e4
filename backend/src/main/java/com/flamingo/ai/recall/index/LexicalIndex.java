package com.flamingo.ai.recall.index;

import java.util.List;

/** Term index ranking messages by BM25 relevance. */
public interface LexicalIndex extends MessageIndex {

  /**
   * Finds messages matching any term of {@code terms}.
   *
   * @param terms free text; an empty list is returned when nothing survives normalization
   * @param filter conjunctive candidate filter
   * @param limit maximum number of hits
   * @return hits ordered by score desc, timestamp desc, id asc
   * @throws com.flamingo.ai.recall.exception.IndexUnavailableException if no generation is
   *     published or the backend fails
   */
  List<IndexHit> search(String terms, CandidateFilter filter, int limit);
}
