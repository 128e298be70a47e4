package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.MessageEmbedding;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for MessageEmbedding entities. */
@Repository
public interface MessageEmbeddingRepository extends JpaRepository<MessageEmbedding, String> {

  /** Finds every embedding produced by the given model. */
  List<MessageEmbedding> findByModel(String model);

  long countByModel(String model);
}
