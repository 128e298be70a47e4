package com.flamingo.ai.recall.domain.repository;

import com.flamingo.ai.recall.domain.entity.ActionEvent;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for the action ledger. */
@Repository
public interface ActionEventRepository extends JpaRepository<ActionEvent, Long> {

  /** Finds the most recent events, newest first. */
  List<ActionEvent> findAllByOrderByIdDesc(Pageable pageable);

  /** Finds the most recent events of one kind, newest first. */
  List<ActionEvent> findByKindOrderByIdDesc(String kind, Pageable pageable);
}
