package com.flamingo.ai.recall.service.corpus;

import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.index.CandidateFilter;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Durable store of conversations and messages. Append-only. */
public interface CorpusService {

  /**
   * Appends a conversation's messages. Identical redeliveries are skipped.
   *
   * @throws com.flamingo.ai.recall.exception.DuplicateMessageException if a stored message id
   *     arrives with different text
   */
  IngestResult ingest(ConversationIngest conversation);

  /** Scans messages matching {@code filter}, newest first, ids ascending on ties. */
  List<Message> browse(CandidateFilter filter, int limit);

  /**
   * @throws com.flamingo.ai.recall.exception.MessageNotFoundException if the id is unknown
   */
  Message getMessage(String messageId);

  /** Loads the messages with the given ids that exist, keyed by id. */
  Map<String, Message> findMessages(Collection<String> messageIds);

  /**
   * @throws com.flamingo.ai.recall.exception.ConversationNotFoundException if the id is unknown
   */
  ConversationDetail getConversation(String conversationId);

  /** Summaries of the given conversations that exist, keyed by id. */
  Map<String, ConversationSummary> summarize(Collection<String> conversationIds);
}
