package com.flamingo.ai.recall.api.rest;

import com.flamingo.ai.recall.api.dto.response.BackfillResponse;
import com.flamingo.ai.recall.api.dto.response.IndexStatusResponse;
import com.flamingo.ai.recall.api.dto.response.RebuildResponse;
import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.repository.MessageEmbeddingRepository;
import com.flamingo.ai.recall.domain.repository.MessageRepository;
import com.flamingo.ai.recall.service.embedding.EmbeddingBackfillService;
import com.flamingo.ai.recall.service.embedding.EmbeddingProducer;
import com.flamingo.ai.recall.service.indexing.CorpusIndexer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for index maintenance. */
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

  private final CorpusIndexer corpusIndexer;
  private final EmbeddingBackfillService embeddingBackfillService;
  private final EmbeddingProducer embeddingProducer;
  private final MessageRepository messageRepository;
  private final MessageEmbeddingRepository messageEmbeddingRepository;
  private final RecallConfig recallConfig;

  /** Rebuilds every index from the corpus store. Searches keep running during the rebuild. */
  @PostMapping("/rebuild")
  public ResponseEntity<RebuildResponse> rebuild() {
    log.info("Index rebuild requested");
    return ResponseEntity.ok(RebuildResponse.fromReport(corpusIndexer.rebuild()));
  }

  /** Gets the published generation of each index and embedding coverage. */
  @GetMapping("/status")
  public ResponseEntity<IndexStatusResponse> status() {
    String model = embeddingProducer.modelName();
    IndexStatusResponse response =
        IndexStatusResponse.builder()
            .backend(recallConfig.getIndex().getBackend())
            .messages(messageRepository.count())
            .embeddingModel(model)
            .embeddings(messageEmbeddingRepository.countByModel(model))
            .missingEmbeddings(messageRepository.countWithoutEmbedding(model))
            .indexes(corpusIndexer.status())
            .build();
    return ResponseEntity.ok(response);
  }

  /**
   * Embeds messages that have no vector for the current model.
   *
   * @param limit maximum messages to embed, 0 for all
   * @return counts of the run
   */
  @PostMapping("/embeddings/backfill")
  public ResponseEntity<BackfillResponse> backfill(
      @RequestParam(defaultValue = "0") int limit) {
    log.info("Embedding backfill requested (limit {})", limit);
    return ResponseEntity.ok(BackfillResponse.fromReport(embeddingBackfillService.backfill(limit)));
  }
}
