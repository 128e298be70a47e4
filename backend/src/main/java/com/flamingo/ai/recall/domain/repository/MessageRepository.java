package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.Message;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Message entities. */
@Repository
public interface MessageRepository
    extends JpaRepository<Message, String>, JpaSpecificationExecutor<Message> {

  /** Finds all messages of a conversation in chronological order. */
  List<Message> findByConversationIdOrderByTimestampAscIdAsc(String conversationId);

  /** Finds all messages of the given conversations in chronological order. */
  List<Message> findByConversationIdInOrderByTimestampAscIdAsc(Collection<String> conversationIds);

  /** Finds the messages with the given ids, in no particular order. */
  List<Message> findByIdIn(Collection<String> ids);

  /**
   * Finds ids of messages that have no embedding from the given model, oldest first.
   *
   * <p>Used by the backfill to resume where a previous run stopped.
   */
  @Query(
      "SELECT m.id FROM Message m WHERE NOT EXISTS ("
          + "SELECT e.messageId FROM MessageEmbedding e "
          + "WHERE e.messageId = m.id AND e.model = :model) "
          + "ORDER BY m.timestamp ASC, m.id ASC")
  List<String> findIdsWithoutEmbedding(@Param("model") String model, Pageable pageable);

  /** Counts messages that have no embedding from the given model. */
  @Query(
      "SELECT COUNT(m) FROM Message m WHERE NOT EXISTS ("
          + "SELECT e.messageId FROM MessageEmbedding e "
          + "WHERE e.messageId = m.id AND e.model = :model)")
  long countWithoutEmbedding(@Param("model") String model);
}
