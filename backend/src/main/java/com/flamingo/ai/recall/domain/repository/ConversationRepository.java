package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.Conversation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Conversation entities. */
@Repository
public interface ConversationRepository extends JpaRepository<Conversation, String> {}
