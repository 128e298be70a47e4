package com.flamingo.ai.recall.service.recall;

import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.search.SearchQuery;
import com.flamingo.ai.recall.service.corpus.ConversationDetail;

/** Entry point for retrieving archived messages. */
public interface RecallService {

  /**
   * Runs a search and returns at most {@code topK} hits in rank order.
   *
   * @throws com.flamingo.ai.recall.exception.QueryValidationException if the query is malformed
   */
  SearchResult search(SearchQuery query);

  /**
   * Runs a search and buckets the hits by conversation.
   *
   * @throws com.flamingo.ai.recall.exception.QueryValidationException if the query is malformed
   */
  GroupedSearchResult searchGrouped(SearchQuery query);

  Message getMessage(String messageId);

  ConversationDetail getConversation(String conversationId);
}
