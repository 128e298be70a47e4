package com.flamingo.ai.recall.index.memory;

import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.index.LexicalIndex;
import com.flamingo.ai.recall.index.TextAnalyzer;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.TextField;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.util.QueryBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * BM25 term index on an in-heap Lucene directory.
 *
 * <p>Query text goes through the same {@link TextAnalyzer} as message text; any remaining term
 * may match. Appends skip ids the published generation already holds.
 */
@Component
@ConditionalOnProperty(name = "recall.index.backend", havingValue = "memory", matchIfMissing = true)
public class InMemoryLexicalIndex extends LuceneMessageIndex implements LexicalIndex {

  static final String NAME = "lexical";
  static final String TEXT = "text";
  static final float K1 = 1.2f;
  static final float B = 0.75f;

  private final QueryBuilder queryBuilder;

  public InMemoryLexicalIndex(TextAnalyzer analyzer, MeterRegistry meterRegistry) {
    super(analyzer, new BM25Similarity(K1, B), meterRegistry);
    this.queryBuilder = new QueryBuilder(analyzer);
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected List<Document> documents(CorpusSnapshot snapshot, Set<String> known) {
    List<Document> documents = new ArrayList<>();
    for (IndexedMessage message : snapshot.messages()) {
      if (known.contains(message.id())) {
        continue;
      }
      Document doc = baseDocument(message);
      doc.add(new TextField(TEXT, Objects.requireNonNullElse(message.text(), ""), Field.Store.NO));
      documents.add(doc);
    }
    return documents;
  }

  @Override
  public List<IndexHit> search(String terms, CandidateFilter filter, int limit) {
    return search(
        searcher -> {
          if (terms == null || terms.isBlank() || limit <= 0) {
            return List.of();
          }
          // Null once analysis leaves no terms, e.g. only stop words.
          Query textQuery =
              queryBuilder.createBooleanQuery(TEXT, terms, BooleanClause.Occur.SHOULD);
          if (textQuery == null) {
            return List.of();
          }
          BooleanQuery.Builder query =
              new BooleanQuery.Builder().add(textQuery, BooleanClause.Occur.MUST);
          addFilters(query, filter);
          return collect(
              searcher, searcher.search(query.build(), limit, RANKING_SORT, true), s -> s);
        });
  }
}
