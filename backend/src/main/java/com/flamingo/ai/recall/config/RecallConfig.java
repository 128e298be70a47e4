package com.flamingo.ai.recall.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the recall engine. */
@Configuration
@ConfigurationProperties(prefix = "recall")
@Getter
@Setter
public class RecallConfig {

  private Search search = new Search();
  private Fusion fusion = new Fusion();
  private Semantic semantic = new Semantic();
  private Embedding embedding = new Embedding();
  private Index index = new Index();
  private Projects projects = new Projects();

  @Getter
  @Setter
  public static class Search {
    private int defaultTopK = 15;

    /** Hard cap on top_k; larger requests are clamped, not rejected. */
    private int maxTopK = 200;

    /** Lower bound on candidates requested from each sub-index. */
    private int minFanOut = 25;

    private int overFetchMultiplier = 4;
    private int maxFanOut = 1000;

    private int defaultConvos = 10;
    private int maxConvos = 50;
    private int defaultPerConvo = 5;
    private int maxPerConvo = 20;

    private Duration lexicalTimeout = Duration.ofSeconds(2);

    /** Covers both the query embedding call and the nearest-neighbour scan. */
    private Duration semanticTimeout = Duration.ofSeconds(5);

    private int previewChars = 700;
  }

  @Getter
  @Setter
  public static class Fusion {
    private double lexicalWeight = 0.5;
    private double semanticWeight = 0.5;
  }

  @Getter
  @Setter
  public static class Semantic {
    /** Dimensionality every indexed vector must have (768 for nomic-embed-text). */
    private int dimensions = 768;

    /** Messages shorter than this are kept out of semantic candidacy. 0 disables the check. */
    private int minTextLength = 0;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** OpenAI-compatible endpoint; Ollama serves one under /v1. */
    private String baseUrl = "http://127.0.0.1:11434/v1";

    private String apiKey = "ollama";
    private String modelName = "nomic-embed-text";

    /** Whether to send the configured dimensions with each request. */
    private boolean sendDimensions = false;

    /** Prepended to query text before embedding; some models expect e.g. "search_query: ". */
    private String queryPrefix = "";

    private String passagePrefix = "";

    private int maxChars = 2000;
    private Duration timeout = Duration.ofSeconds(60);
    private boolean embedOnIngest = true;
    private int backfillBatchSize = 100;
  }

  @Getter
  @Setter
  public static class Index {
    /** Index backend: "memory" (default) or "elasticsearch". */
    private String backend = "memory";

    private boolean buildOnStartup = true;
    private Elasticsearch elasticsearch = new Elasticsearch();

    @Getter
    @Setter
    public static class Elasticsearch {
      private String host = "localhost";
      private int port = 9200;
      private String scheme = "http";

      /** Alias readers query; each generation is a concrete index behind it. */
      private String alias = "recall-messages";
    }
  }

  @Getter
  @Setter
  public static class Projects {
    private List<ProjectRule> rules = new ArrayList<>();
  }

  /** Tags a message with {@code tag} when any pattern occurs in its text. */
  @Getter
  @Setter
  public static class ProjectRule {
    private String tag;
    private List<String> patterns = new ArrayList<>();
  }
}
