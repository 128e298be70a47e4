package com.flamingo.ai.recall.service.indexing;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.entity.MessageEmbedding;
import com.flamingo.ai.recall.domain.repository.MessageEmbeddingRepository;
import com.flamingo.ai.recall.domain.repository.MessageRepository;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexStatus;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.index.MessageIndex;
import com.flamingo.ai.recall.service.embedding.EmbeddingProducer;
import com.flamingo.ai.recall.service.ledger.ActionHandle;
import com.flamingo.ai.recall.service.ledger.ActionLedgerService;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

/**
 * The single writer of every {@link MessageIndex}.
 *
 * <p>Rebuilds and appends are serialized on this bean, so an append can never interleave with a
 * rebuild of the same index. Readers are never blocked: each index publishes whole generations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusIndexer {

  static final String REBUILD_KIND = "index.rebuild";

  private static final Sort CHRONOLOGICAL =
      Sort.by(Sort.Order.asc("timestamp"), Sort.Order.asc("id"));

  private final MessageRepository messageRepository;
  private final MessageEmbeddingRepository messageEmbeddingRepository;
  private final List<MessageIndex> indexes;
  private final EmbeddingProducer embeddingProducer;
  private final RecallConfig recallConfig;
  private final ActionLedgerService actionLedgerService;

  /**
   * Rebuilds every index from the corpus store.
   *
   * <p>An index that fails to build keeps serving its previous generation; the failure is
   * reported, not thrown.
   */
  @Timed(value = "index.rebuild", description = "Time to rebuild all indexes")
  public synchronized RebuildReport rebuild() {
    ActionHandle handle =
        actionLedgerService.start(REBUILD_KIND, Map.of("indexes", indexNames()));
    long start = System.nanoTime();
    try {
      List<IndexedMessage> messages =
          messageRepository.findAll(CHRONOLOGICAL).stream()
              .map(IndexedMessage::fromEntity)
              .toList();
      Map<String, String> hashes = new HashMap<>();
      for (IndexedMessage message : messages) {
        hashes.put(message.id(), ContentHash.of(message.text()));
      }

      int dimensions = recallConfig.getSemantic().getDimensions();
      Map<String, float[]> embeddings = new HashMap<>();
      int stale = 0;
      for (MessageEmbedding embedding :
          messageEmbeddingRepository.findByModel(embeddingProducer.modelName())) {
        String hash = hashes.get(embedding.getMessageId());
        if (hash == null) {
          continue;
        }
        if (!hash.equals(embedding.getContentHash())
            || embedding.getVector().length != dimensions) {
          stale++;
          continue;
        }
        embeddings.put(embedding.getMessageId(), embedding.getVector());
      }
      if (stale > 0) {
        log.warn("Skipped {} embeddings whose text hash or dimension no longer matches", stale);
      }

      CorpusSnapshot snapshot = new CorpusSnapshot(messages, embeddings);
      log.info(
          "Rebuilding {} indexes from {} messages ({} with embeddings)",
          indexes.size(),
          messages.size(),
          embeddings.size());

      List<String> failed = new ArrayList<>();
      for (MessageIndex index : indexes) {
        try {
          index.rebuild(snapshot);
        } catch (RuntimeException e) {
          log.error("Failed to rebuild index {}: {}", index.name(), e.getMessage(), e);
          failed.add(index.name());
        }
      }

      double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
      RebuildReport report =
          new RebuildReport(
              messages.size(), embeddings.size(), stale, seconds, List.copyOf(failed), status());

      Map<String, Object> extra = new LinkedHashMap<>();
      extra.put("messages", report.messages());
      extra.put("embedded", report.embedded());
      extra.put("staleEmbeddings", report.staleEmbeddings());
      if (failed.isEmpty()) {
        actionLedgerService.ok(handle, extra);
      } else {
        actionLedgerService.warn(handle, extra, "Failed to rebuild: " + String.join(", ", failed));
      }
      return report;
    } catch (RuntimeException e) {
      actionLedgerService.fail(handle, e);
      throw e;
    }
  }

  /** Appends newly ingested messages, without embeddings, to every built index. */
  public void append(List<IndexedMessage> messages) {
    append(new CorpusSnapshot(messages, Map.of()));
  }

  /**
   * Appends messages and their embeddings to every built index.
   *
   * <p>An index that has no generation yet is skipped; its next rebuild picks the messages up.
   */
  public synchronized void append(CorpusSnapshot additions) {
    if (additions.isEmpty()) {
      return;
    }
    for (MessageIndex index : indexes) {
      if (!index.status().ready()) {
        log.debug(
            "Index {} not built yet, skipping append of {} messages",
            index.name(),
            additions.messages().size());
        continue;
      }
      try {
        index.append(additions);
      } catch (IndexUnavailableException e) {
        log.warn("Could not append to index {}: {}", index.name(), e.getMessage());
      }
    }
  }

  public List<IndexStatus> status() {
    return indexes.stream().map(MessageIndex::status).toList();
  }

  private List<String> indexNames() {
    return indexes.stream().map(MessageIndex::name).toList();
  }
}
