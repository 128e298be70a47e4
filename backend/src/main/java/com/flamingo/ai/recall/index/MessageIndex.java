package com.flamingo.ai.recall.index;

/**
 * An index over the message corpus with single-writer, many-reader semantics.
 *
 * <p>Writers publish whole generations: a query in flight sees either the generation before a
 * {@link #rebuild} or {@link #append} or the one after it, never a mix.
 */
public interface MessageIndex {

  String name();

  /** Replaces the published generation with one built from {@code snapshot}. */
  void rebuild(CorpusSnapshot snapshot);

  /**
   * Publishes a generation containing the current one plus {@code additions}.
   *
   * @throws com.flamingo.ai.recall.exception.IndexUnavailableException if nothing is built yet
   */
  void append(CorpusSnapshot additions);

  IndexStatus status();
}
