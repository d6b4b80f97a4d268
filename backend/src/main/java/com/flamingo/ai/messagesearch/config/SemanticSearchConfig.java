package com.flamingo.ai.messagesearch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for embedding generation, search and indexing. */
@Configuration
@ConfigurationProperties(prefix = "semantic-search")
@Getter
@Setter
public class SemanticSearchConfig {

  private Embedding embedding = new Embedding();
  private Search search = new Search();
  private Indexing indexing = new Indexing();

  @Getter
  @Setter
  public static class Embedding {
    /** Number of hash buckets in every generated vector. */
    private int dimension = 384;

    private int minTokenLength = 3;

    /** Tag stored next to each vector; rows carrying another version are re-embedded. */
    private int version = 1;
  }

  @Getter
  @Setter
  public static class Search {
    /** Candidates fetched per read while scanning stored vectors. */
    private int batchSize = 50;

    /** Characters of the message body kept in a result snippet. */
    private int snippetLength = 200;

    /** Result count and character budget for the assembled context block. */
    private int contextMaxResults = 3;

    private int contextMaxLength = 1000;
  }

  @Getter
  @Setter
  public static class Indexing {
    /** Messages embedded and persisted between two cancellation checks. */
    private int batchSize = 100;

    /** Progress is published at least every this many processed messages. */
    private int progressInterval = 10;

    private boolean runOnStartup = true;
    private boolean scheduleEnabled = false;
    private long scheduleIntervalMs = 900_000L; // 15 minutes
  }
}
