package com.flamingo.ai.recall.service.embedding;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.entity.MessageEmbedding;
import com.flamingo.ai.recall.domain.repository.MessageEmbeddingRepository;
import com.flamingo.ai.recall.domain.repository.MessageRepository;
import com.flamingo.ai.recall.exception.BackfillInProgressException;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.service.indexing.ContentHash;
import com.flamingo.ai.recall.service.indexing.CorpusIndexer;
import com.flamingo.ai.recall.service.ledger.ActionHandle;
import com.flamingo.ai.recall.service.ledger.ActionLedgerService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Computes and stores embeddings for messages that have none for the current model.
 *
 * <p>Runs resume where the previous one stopped: only messages without a stored vector are
 * candidates. Each batch is saved as it completes and then appended to the indexes. A message
 * whose embedding fails is skipped and picked up by the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingBackfillService {

  static final String BACKFILL_KIND = "embedding.backfill";

  private final MessageRepository messageRepository;
  private final MessageEmbeddingRepository messageEmbeddingRepository;
  private final EmbeddingProducer embeddingProducer;
  private final CorpusIndexer corpusIndexer;
  private final ActionLedgerService actionLedgerService;
  private final RecallConfig recallConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicBoolean running = new AtomicBoolean();

  /**
   * Embeds messages that lack a vector, oldest first.
   *
   * @param limit maximum messages to process, or 0 for all
   * @return the run's counts
   * @throws BackfillInProgressException if another backfill is already running
   */
  @Timed(value = "embedding.backfill", description = "Time to backfill embeddings")
  public BackfillReport backfill(int limit) {
    if (!running.compareAndSet(false, true)) {
      throw new BackfillInProgressException();
    }
    String model = embeddingProducer.modelName();
    ActionHandle handle =
        actionLedgerService.start(BACKFILL_KIND, Map.of("model", model, "limit", limit));
    try {
      Pageable page = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
      List<String> candidates = messageRepository.findIdsWithoutEmbedding(model, page);
      log.info(
          "Embedding backfill started: {} messages without a {} vector", candidates.size(), model);

      int batchSize = Math.max(1, recallConfig.getEmbedding().getBackfillBatchSize());
      int embedded = 0;
      int failed = 0;
      boolean aborted = false;
      for (int from = 0; from < candidates.size(); from += batchSize) {
        List<String> batchIds =
            candidates.subList(from, Math.min(from + batchSize, candidates.size()));
        List<IndexedMessage> batch =
            messageRepository.findByIdIn(batchIds).stream()
                .sorted(Comparator.comparing(Message::getTimestamp).thenComparing(Message::getId))
                .map(IndexedMessage::fromEntity)
                .toList();
        int stored = embedBatch(batch, model);
        embedded += stored;
        failed += batch.size() - stored;
        log.info(
            "Backfill progress: {}/{} processed, {} embedded",
            Math.min(from + batchSize, candidates.size()),
            candidates.size(),
            embedded);
        if (stored == 0 && !batch.isEmpty()) {
          log.warn("Every message in the batch failed to embed; stopping the backfill early");
          aborted = true;
          break;
        }
      }

      long remaining = messageRepository.countWithoutEmbedding(model);
      BackfillReport report =
          new BackfillReport(model, candidates.size(), embedded, failed, remaining, aborted);
      log.info(
          "Embedding backfill complete: {} embedded, {} failed, {} remaining",
          embedded,
          failed,
          remaining);

      Map<String, Object> extra = new LinkedHashMap<>();
      extra.put("candidates", report.candidates());
      extra.put("embedded", report.embedded());
      extra.put("failed", report.failed());
      extra.put("remaining", report.remaining());
      if (failed > 0) {
        actionLedgerService.warn(handle, extra, failed + " messages could not be embedded");
      } else {
        actionLedgerService.ok(handle, extra);
      }
      return report;
    } catch (RuntimeException e) {
      log.error("Embedding backfill failed: {}", e.getMessage(), e);
      actionLedgerService.fail(handle, e);
      throw e;
    } finally {
      running.set(false);
    }
  }

  /** Embeds freshly ingested messages in the background. */
  @Async("indexingExecutor")
  public void embedAsync(List<IndexedMessage> messages) {
    try {
      int stored = embedBatch(messages, embeddingProducer.modelName());
      log.debug("Embedded {}/{} ingested messages", stored, messages.size());
    } catch (Exception e) {
      log.error("Failed to embed ingested messages: {}", e.getMessage(), e);
    }
  }

  /**
   * Embeds, stores and indexes one batch.
   *
   * @return number of vectors stored
   */
  private int embedBatch(List<IndexedMessage> batch, String model) {
    int expected = recallConfig.getSemantic().getDimensions();
    List<MessageEmbedding> embeddings = new ArrayList<>();
    Map<String, float[]> vectors = new LinkedHashMap<>();
    for (IndexedMessage message : batch) {
      float[] vector;
      try {
        vector = embeddingProducer.embedPassage(message.text());
      } catch (RuntimeException e) {
        log.warn("Failed to embed message {}: {}", message.id(), e.getMessage());
        vector = new float[0];
      }
      if (vector.length == 0) {
        meterRegistry.counter("embedding.backfill.failed").increment();
        continue;
      }
      if (vector.length != expected) {
        log.warn(
            "Embedding of message {} has {} dimensions, expected {}; it is stored but not indexed",
            message.id(),
            vector.length,
            expected);
      }
      embeddings.add(
          MessageEmbedding.builder()
              .messageId(message.id())
              .model(model)
              .dimensions(vector.length)
              .vector(vector)
              .contentHash(ContentHash.of(message.text()))
              .build());
      vectors.put(message.id(), vector);
    }
    if (embeddings.isEmpty()) {
      return 0;
    }
    messageEmbeddingRepository.saveAll(embeddings);
    List<IndexedMessage> embedded =
        batch.stream().filter(message -> vectors.containsKey(message.id())).toList();
    corpusIndexer.append(new CorpusSnapshot(embedded, vectors));
    return embeddings.size();
  }
}
