package com.flamingo.ai.recall.index.memory;

import com.flamingo.ai.recall.config.RecallConfig;
import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.index.SemanticIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.core.KeywordAnalyzer;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Nearest-neighbour index over message embeddings on an in-heap Lucene directory.
 *
 * <p>Only messages whose embedding has the configured dimension, is not all zeros, and whose text
 * meets the minimum length are admitted. Scores are cosine similarities in [-1, 1]; Lucene
 * reports {@code (1 + cos) / 2}, which is mapped back.
 */
@Component
@ConditionalOnProperty(name = "recall.index.backend", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemorySemanticIndex extends LuceneMessageIndex implements SemanticIndex {

  static final String NAME = "semantic";
  static final String EMBEDDING = "embedding";

  private final RecallConfig recallConfig;

  public InMemorySemanticIndex(RecallConfig recallConfig, MeterRegistry meterRegistry) {
    super(new KeywordAnalyzer(), IndexSearcher.getDefaultSimilarity(), meterRegistry);
    this.recallConfig = recallConfig;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected List<Document> documents(CorpusSnapshot snapshot, Set<String> known) {
    int dimensions = recallConfig.getSemantic().getDimensions();
    if (dimensions > KnnVectorsFormat.DEFAULT_MAX_DIMENSIONS) {
      throw new IndexUnavailableException(
          NAME,
          "Configured dimensions "
              + dimensions
              + " exceed the supported maximum of "
              + KnnVectorsFormat.DEFAULT_MAX_DIMENSIONS);
    }
    int minTextLength = recallConfig.getSemantic().getMinTextLength();
    int wrongDimension = 0;
    int tooShort = 0;
    int zero = 0;

    List<Document> documents = new ArrayList<>();
    for (IndexedMessage message : snapshot.messages()) {
      float[] vector = snapshot.embeddings().get(message.id());
      if (vector == null) {
        continue;
      }
      if (vector.length != dimensions) {
        wrongDimension++;
        continue;
      }
      if (minTextLength > 0
          && (message.text() == null || message.text().length() < minTextLength)) {
        tooShort++;
        continue;
      }
      if (isZero(vector)) {
        zero++;
        continue;
      }
      Document doc = baseDocument(message);
      doc.add(new KnnFloatVectorField(EMBEDDING, vector, VectorSimilarityFunction.COSINE));
      documents.add(doc);
    }

    if (wrongDimension > 0 || tooShort > 0 || zero > 0) {
      log.debug(
          "Excluded from semantic candidacy: {} wrong dimension, {} too short, {} zero vectors",
          wrongDimension,
          tooShort,
          zero);
    }
    return documents;
  }

  @Override
  public List<IndexHit> search(float[] queryVector, CandidateFilter filter, int limit) {
    int dimensions = recallConfig.getSemantic().getDimensions();
    return search(
        searcher -> {
          if (queryVector == null || queryVector.length != dimensions) {
            log.warn(
                "Query vector has {} dimensions, index expects {}; "
                    + "returning no semantic candidates",
                queryVector == null ? 0 : queryVector.length,
                dimensions);
            return List.of();
          }
          if (limit <= 0 || isZero(queryVector)) {
            return List.of();
          }
          KnnFloatVectorQuery query =
              new KnnFloatVectorQuery(EMBEDDING, queryVector, limit, filterQuery(filter));
          return collect(
              searcher, searcher.search(query, limit, RANKING_SORT, true), s -> 2 * s - 1);
        });
  }

  static boolean isZero(float[] vector) {
    for (float v : vector) {
      if (v != 0f) {
        return false;
      }
    }
    return true;
  }
}
