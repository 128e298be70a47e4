package com.flamingo.ai.recall.config;

import com.flamingo.ai.recall.service.indexing.CorpusIndexer;
import com.flamingo.ai.recall.service.indexing.RebuildReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that builds the lexical and semantic indexes from the corpus store.
 *
 * <p>Until it finishes, hybrid searches report the indexes as unavailable. Controlled by {@code
 * recall.index.build-on-startup}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusIndexStartupBean implements CommandLineRunner {

  private final CorpusIndexer corpusIndexer;
  private final RecallConfig recallConfig;

  @Override
  public void run(String... args) {
    if (!recallConfig.getIndex().isBuildOnStartup()) {
      log.info("Index build on startup disabled");
      return;
    }
    try {
      log.info("Building indexes from the corpus store...");
      RebuildReport report = corpusIndexer.rebuild();
      log.info(
          "Startup index build complete: {} messages, {} with embeddings, {} failed indexes",
          report.messages(),
          report.embedded(),
          report.failedIndexes().size());
    } catch (Exception e) {
      log.error("Startup index build failed: {}", e.getMessage(), e);
      // Searches report the indexes as unavailable until a rebuild succeeds
    }
  }
}
