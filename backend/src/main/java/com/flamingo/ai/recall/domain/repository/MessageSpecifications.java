package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import jakarta.persistence.criteria.Predicate;
import java.time.Instant;
import org.springframework.data.jpa.domain.Specification;

/** Conjunctive filters for scanning the message table directly. */
public final class MessageSpecifications {

  private MessageSpecifications() {}

  /**
   * Builds a specification matching every non-null filter. A null filter matches everything.
   */
  public static Specification<Message> matching(
      String project, MessageRole role, Instant since, Instant until) {
    return (root, query, cb) -> {
      Predicate predicate = cb.conjunction();
      if (project != null) {
        predicate = cb.and(predicate, cb.equal(root.get("project"), project));
      }
      if (role != null) {
        predicate = cb.and(predicate, cb.equal(root.get("role"), role));
      }
      if (since != null) {
        predicate =
            cb.and(predicate, cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), since));
      }
      if (until != null) {
        predicate = cb.and(predicate, cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), until));
      }
      return predicate;
    };
  }
}
