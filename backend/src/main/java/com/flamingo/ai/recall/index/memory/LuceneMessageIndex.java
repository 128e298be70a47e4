package com.flamingo.ai.recall.index.memory;

import com.flamingo.ai.recall.exception.IndexUnavailableException;
import com.flamingo.ai.recall.index.CandidateFilter;
import com.flamingo.ai.recall.index.CorpusSnapshot;
import com.flamingo.ai.recall.index.IndexHit;
import com.flamingo.ai.recall.index.IndexStatus;
import com.flamingo.ai.recall.index.IndexedMessage;
import com.flamingo.ai.recall.index.MessageIndex;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.Similarity;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.IOUtils;

/**
 * Lucene index over messages held in heap memory.
 *
 * <p>A rebuild writes a fresh {@link ByteBuffersDirectory}, publishes it, then closes the one it
 * replaces; searchers acquired from the old store stay readable until released. An append writes
 * into the published store and becomes visible all at once on the blocking refresh that ends it.
 */
@Slf4j
public abstract class LuceneMessageIndex implements MessageIndex {

  static final String ID = "id";
  static final String CONVERSATION_ID = "conversation_id";
  static final String PROJECT = "project";
  static final String ROLE = "role";
  static final String TIMESTAMP = "timestamp";

  /** Score descending, newest first, then message id; the same order as {@link IndexHit}. */
  static final Sort RANKING_SORT =
      new Sort(
          SortField.FIELD_SCORE,
          new SortField(TIMESTAMP, SortField.Type.LONG, true),
          new SortField(ID, SortField.Type.STRING));

  private final Analyzer analyzer;
  private final Similarity similarity;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<Generation> current = new AtomicReference<>();

  private record Generation(long number, Store store, int documents, Instant publishedAt) {}

  /** Work done against one acquired searcher. */
  @FunctionalInterface
  protected interface SearchCall<T> {
    T apply(IndexSearcher searcher) throws IOException;
  }

  protected LuceneMessageIndex(
      Analyzer analyzer, Similarity similarity, MeterRegistry meterRegistry) {
    this.analyzer = analyzer;
    this.similarity = similarity;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Builds the documents to write for {@code snapshot}.
   *
   * @param known ids already in the published store; empty on a rebuild
   */
  protected abstract List<Document> documents(CorpusSnapshot snapshot, Set<String> known);

  @Override
  public synchronized void rebuild(CorpusSnapshot snapshot) {
    Generation previous = current.get();
    long number = previous == null ? 1 : previous.number() + 1;
    Store store = null;
    try {
      store = new Store(analyzer, similarity);
      store.write(documents(snapshot, Set.of()));
      publish(new Generation(number, store, store.documents(), Instant.now()));
    } catch (IOException | RuntimeException e) {
      closeQuietly(store);
      if (e instanceof IndexUnavailableException unavailable) {
        throw unavailable;
      }
      log.error("Failed to build {} generation {}: {}", name(), number, e.getMessage(), e);
      throw new IndexUnavailableException(name(), "Failed to build index generation", e);
    }
    if (previous != null) {
      closeQuietly(previous.store());
    }
  }

  @Override
  public synchronized void append(CorpusSnapshot additions) {
    Generation previous = current.get();
    if (previous == null) {
      throw new IndexUnavailableException(name(), "Cannot append before the first build");
    }
    List<Document> documents = documents(additions, previous.store().ids());
    if (documents.isEmpty()) {
      return;
    }
    try {
      previous.store().write(documents);
      publish(
          new Generation(
              previous.number() + 1,
              previous.store(),
              previous.store().documents(),
              Instant.now()));
    } catch (IOException e) {
      log.error("Failed to append to {}: {}", name(), e.getMessage(), e);
      throw new IndexUnavailableException(name(), "Failed to append documents", e);
    }
  }

  @Override
  public IndexStatus status() {
    Generation generation = current.get();
    if (generation == null) {
      return IndexStatus.notBuilt(name());
    }
    return new IndexStatus(
        name(), true, generation.number(), generation.documents(), generation.publishedAt());
  }

  /**
   * Runs {@code call} against a searcher of the published generation, retrying once the store it
   * read has been swapped out by a concurrent rebuild.
   */
  protected final <T> T search(SearchCall<T> call) {
    while (true) {
      Generation generation = current.get();
      if (generation == null) {
        throw new IndexUnavailableException(name(), "Index " + name() + " has not been built");
      }
      try {
        return generation.store().search(call);
      } catch (AlreadyClosedException e) {
        if (current.get() == generation) {
          throw new IndexUnavailableException(name(), "Index was closed", e);
        }
      } catch (IOException e) {
        throw new IndexUnavailableException(name(), "Search failed", e);
      }
    }
  }

  /** The fields every message document carries: identity, filter attributes and sort keys. */
  protected static Document baseDocument(IndexedMessage message) {
    Document doc = new Document();
    doc.add(new StringField(ID, message.id(), Field.Store.YES));
    doc.add(new SortedDocValuesField(ID, new BytesRef(message.id())));
    if (message.conversationId() != null) {
      doc.add(new StoredField(CONVERSATION_ID, message.conversationId()));
    }
    if (message.project() != null) {
      doc.add(new StringField(PROJECT, message.project(), Field.Store.NO));
    }
    doc.add(new StringField(ROLE, message.role().wireName(), Field.Store.NO));
    long seconds = message.timestamp().getEpochSecond();
    doc.add(new LongPoint(TIMESTAMP, seconds));
    doc.add(new NumericDocValuesField(TIMESTAMP, seconds));
    doc.add(new StoredField(TIMESTAMP, seconds));
    return doc;
  }

  /** Adds {@code filter} as non-scoring clauses. Timestamps are indexed in whole seconds. */
  protected static void addFilters(BooleanQuery.Builder builder, CandidateFilter filter) {
    if (filter.project() != null) {
      builder.add(
          new TermQuery(new Term(PROJECT, filter.project())), BooleanClause.Occur.FILTER);
    }
    if (filter.role() != null) {
      builder.add(
          new TermQuery(new Term(ROLE, filter.role().wireName())), BooleanClause.Occur.FILTER);
    }
    if (filter.since() != null || filter.until() != null) {
      long lower = Long.MIN_VALUE;
      if (filter.since() != null) {
        lower = filter.since().getEpochSecond() + (filter.since().getNano() > 0 ? 1 : 0);
      }
      long upper = filter.until() == null ? Long.MAX_VALUE : filter.until().getEpochSecond();
      builder.add(LongPoint.newRangeQuery(TIMESTAMP, lower, upper), BooleanClause.Occur.FILTER);
    }
  }

  /** Returns {@code filter} as a query, or null when it filters nothing. */
  protected static Query filterQuery(CandidateFilter filter) {
    if (filter.isEmpty()) {
      return null;
    }
    BooleanQuery.Builder builder = new BooleanQuery.Builder();
    addFilters(builder, filter);
    return builder.build();
  }

  /** Reads hits back from stored fields, mapping each Lucene score through {@code score}. */
  protected static List<IndexHit> collect(
      IndexSearcher searcher, TopDocs topDocs, DoubleUnaryOperator score) throws IOException {
    StoredFields storedFields = searcher.storedFields();
    List<IndexHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
    for (ScoreDoc scoreDoc : topDocs.scoreDocs) {
      Document doc = storedFields.document(scoreDoc.doc);
      hits.add(
          new IndexHit(
              doc.get(ID),
              doc.get(CONVERSATION_ID),
              Instant.ofEpochSecond(doc.getField(TIMESTAMP).numericValue().longValue()),
              score.applyAsDouble(scoreDoc.score)));
    }
    return hits.stream().sorted(IndexHit.RANKING).toList();
  }

  private void publish(Generation generation) {
    current.set(generation);
    meterRegistry.counter("index.generation.published", "index", name()).increment();
    log.info(
        "Published {} generation {} with {} documents",
        name(),
        generation.number(),
        generation.documents());
  }

  private void closeQuietly(Store store) {
    if (store == null) {
      return;
    }
    try {
      store.close();
    } catch (IOException e) {
      log.warn("Could not close a retired {} store: {}", name(), e.getMessage());
    }
  }

  /** An in-heap directory with its writer and near-real-time searcher manager. */
  private static final class Store implements Closeable {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final Set<String> ids = new HashSet<>();

    Store(Analyzer analyzer, Similarity similarity) throws IOException {
      IndexWriterConfig config =
          new IndexWriterConfig(analyzer)
              .setSimilarity(similarity)
              .setOpenMode(IndexWriterConfig.OpenMode.CREATE);
      writer = new IndexWriter(new ByteBuffersDirectory(), config);
      try {
        searcherManager =
            new SearcherManager(
                writer,
                new SearcherFactory() {
                  @Override
                  public IndexSearcher newSearcher(IndexReader reader, IndexReader previous) {
                    IndexSearcher searcher = new IndexSearcher(reader);
                    searcher.setSimilarity(similarity);
                    return searcher;
                  }
                });
      } catch (IOException | RuntimeException e) {
        writer.close();
        throw e;
      }
    }

    Set<String> ids() {
      return ids;
    }

    /** Writes {@code documents}, replacing any with the same id, and refreshes searchers. */
    void write(List<Document> documents) throws IOException {
      for (Document doc : documents) {
        String id = doc.get(ID);
        writer.updateDocument(new Term(ID, id), doc);
        ids.add(id);
      }
      searcherManager.maybeRefreshBlocking();
    }

    int documents() throws IOException {
      return search(searcher -> searcher.getIndexReader().numDocs());
    }

    <T> T search(SearchCall<T> call) throws IOException {
      IndexSearcher searcher = searcherManager.acquire();
      try {
        return call.apply(searcher);
      } finally {
        searcherManager.release(searcher);
      }
    }

    // The directory stays open: searchers acquired before close may still read it.
    @Override
    public void close() throws IOException {
      IOUtils.close(searcherManager, writer);
    }
  }
}
