package com.flamingo.ai.recall.service.corpus;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.domain.entity.Conversation;
import com.flamingo.ai.recall.domain.entity.Message;
import com.flamingo.ai.recall.domain.enums.MessageRole;
import com.flamingo.ai.recall.domain.repository.ConversationRepository;
import com.flamingo.ai.recall.domain.repository.MessageRepository;
import com.flamingo.ai.recall.domain.repository.MessageSpecifications;
import com.flamingo.ai.recall.exception.ConversationNotFoundException;
import com.flamingo.ai.recall.exception.DuplicateMessageException;
import com.flamingo.ai.recall.exception.MessageNotFoundException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.service.embedding.EmbeddingBackfillService;
import com.flamingo.ai.recall.service.indexing.CorpusIndexer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/** Implementation of CorpusService on the JPA repositories. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusServiceImpl implements CorpusService {

  private static final Sort NEWEST_FIRST =
      Sort.by(Sort.Order.desc("timestamp"), Sort.Order.asc("id"));

  private final ConversationRepository conversationRepository;
  private final MessageRepository messageRepository;
  private final ProjectTagger projectTagger;
  private final CorpusIndexer corpusIndexer;
  private final EmbeddingBackfillService embeddingBackfillService;
  private final RecallConfig recallConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public IngestResult ingest(ConversationIngest ingest) {
    List<ConversationIngest.MessageIngest> delivered =
        ingest.messages() == null ? List.of() : ingest.messages();

    Map<String, Message> stored =
        messageRepository
            .findByIdIn(delivered.stream().map(ConversationIngest.MessageIngest::id).toList())
            .stream()
            .collect(Collectors.toMap(Message::getId, Function.identity()));

    List<Message> fresh = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    Map<String, String> seenInBatch = new HashMap<>();

    for (ConversationIngest.MessageIngest incoming : delivered) {
      Message existing = stored.get(incoming.id());
      String previousText =
          existing != null ? existing.getText() : seenInBatch.get(incoming.id());
      if (previousText != null) {
        if (!previousText.equals(incoming.text())) {
          throw new DuplicateMessageException(incoming.id());
        }
        skipped.add(incoming.id());
        continue;
      }
      seenInBatch.put(incoming.id(), incoming.text());
      fresh.add(toMessage(ingest.id(), incoming));
    }

    if (!conversationRepository.existsById(ingest.id())) {
      Instant createdAt = ingest.createdAt();
      if (createdAt == null) {
        createdAt =
            fresh.stream()
                .map(Message::getTimestamp)
                .min(Comparator.naturalOrder())
                .orElseGet(Instant::now);
      }
      conversationRepository.save(
          Conversation.builder()
              .id(ingest.id())
              .title(ingest.title())
              .source(ingest.source())
              .createdAt(createdAt.truncatedTo(ChronoUnit.SECONDS))
              .build());
    }

    messageRepository.saveAll(fresh);
    meterRegistry.counter("corpus.messages.ingested").increment(fresh.size());
    log.info(
        "Ingested conversation {}: {} new messages, {} redeliveries skipped",
        ingest.id(),
        fresh.size(),
        skipped.size());

    if (!fresh.isEmpty()) {
      List<IndexedMessage> indexed = fresh.stream().map(IndexedMessage::fromEntity).toList();
      afterCommit(() -> publish(indexed));
    }
    return new IngestResult(
        ingest.id(), fresh.stream().map(Message::getId).toList(), List.copyOf(skipped));
  }

  private Message toMessage(String conversationId, ConversationIngest.MessageIngest incoming) {
    String project =
        incoming.project() == null || incoming.project().isBlank()
            ? projectTagger.tag(incoming.text()).orElse(null)
            : incoming.project().trim();
    return Message.builder()
        .id(incoming.id())
        .conversationId(conversationId)
        .role(MessageRole.fromProvider(incoming.role()))
        .project(project)
        .timestamp(incoming.timestamp().truncatedTo(ChronoUnit.SECONDS))
        .text(incoming.text())
        .build();
  }

  /** Makes newly committed messages searchable and queues their embeddings. */
  private void publish(List<IndexedMessage> messages) {
    try {
      corpusIndexer.append(messages);
    } catch (RuntimeException e) {
      log.error(
          "Failed to append {} messages to the indexes: {}", messages.size(), e.getMessage(), e);
    }
    if (recallConfig.getEmbedding().isEmbedOnIngest()) {
      embeddingBackfillService.embedAsync(messages);
    }
  }

  private static void afterCommit(Runnable action) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              action.run();
            }
          });
    } else {
      action.run();
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<Message> browse(CandidateFilter filter, int limit) {
    return messageRepository
        .findAll(
            MessageSpecifications.matching(
                filter.project(), filter.role(), filter.since(), filter.until()),
            PageRequest.of(0, Math.max(1, limit), NEWEST_FIRST))
        .getContent();
  }

  @Override
  @Transactional(readOnly = true)
  public Message getMessage(String messageId) {
    return messageRepository
        .findById(messageId)
        .orElseThrow(() -> new MessageNotFoundException(messageId));
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, Message> findMessages(Collection<String> messageIds) {
    if (messageIds.isEmpty()) {
      return Map.of();
    }
    return messageRepository.findByIdIn(messageIds).stream()
        .collect(Collectors.toMap(Message::getId, Function.identity()));
  }

  @Override
  @Transactional(readOnly = true)
  public ConversationDetail getConversation(String conversationId) {
    Conversation conversation = conversationRepository.findById(conversationId).orElse(null);
    List<Message> messages =
        messageRepository.findByConversationIdOrderByTimestampAscIdAsc(conversationId);
    if (conversation == null && messages.isEmpty()) {
      throw new ConversationNotFoundException(conversationId);
    }
    return new ConversationDetail(summarize(conversationId, conversation, messages), messages);
  }

  @Override
  @Transactional(readOnly = true)
  public Map<String, ConversationSummary> summarize(Collection<String> conversationIds) {
    if (conversationIds.isEmpty()) {
      return Map.of();
    }
    Map<String, Conversation> conversations =
        conversationRepository.findAllById(conversationIds).stream()
            .collect(Collectors.toMap(Conversation::getId, Function.identity()));
    Map<String, List<Message>> messages =
        messageRepository.findByConversationIdInOrderByTimestampAscIdAsc(conversationIds).stream()
            .collect(
                Collectors.groupingBy(
                    Message::getConversationId, LinkedHashMap::new, Collectors.toList()));

    Map<String, ConversationSummary> summaries = new LinkedHashMap<>();
    for (String id : conversationIds) {
      Conversation conversation = conversations.get(id);
      List<Message> own = messages.getOrDefault(id, List.of());
      if (conversation != null || !own.isEmpty()) {
        summaries.put(id, summarize(id, conversation, own));
      }
    }
    return summaries;
  }

  /**
   * Derives a summary.
   *
   * @param messages the conversation's messages in chronological order
   */
  static ConversationSummary summarize(
      String id, Conversation conversation, List<Message> messages) {
    Instant spanStart = messages.isEmpty() ? null : messages.get(0).getTimestamp();
    Instant spanEnd = messages.isEmpty() ? null : messages.get(messages.size() - 1).getTimestamp();
    return new ConversationSummary(
        id,
        conversation == null ? null : conversation.getTitle(),
        conversation == null ? null : conversation.getSource(),
        conversation == null ? spanStart : conversation.getCreatedAt(),
        spanStart,
        spanEnd,
        messages.size(),
        majorityProject(messages));
  }

  /** Most frequent project; on a tie, the one seen first in chronological order. */
  static String majorityProject(List<Message> messages) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (Message message : messages) {
      if (message.getProject() != null) {
        counts.merge(message.getProject(), 1, Integer::sum);
      }
    }
    String best = null;
    int bestCount = 0;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > bestCount) {
        best = entry.getKey();
        bestCount = entry.getValue();
      }
    }
    return best;
  }
}
