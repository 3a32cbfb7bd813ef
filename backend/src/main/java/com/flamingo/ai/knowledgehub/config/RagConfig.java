package com.flamingo.ai.knowledgehub.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Corpora corpora = new Corpora();
  private Citation citation = new Citation();
  private Confidence confidence = new Confidence();

  @Getter
  @Setter
  public static class Embedding {
    /** Upstream character ceiling; longer input is cut before embedding. */
    private int maxChars = 8000;

    /** Number of embedding calls allowed in flight for one batch. */
    private int batchConcurrency = 4;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 5;
    private double similarityThreshold = 0.7;

    /** Context budget in approximate tokens (characters / 4). */
    private int maxContextTokens = 4000;

    /** Upper bound on waiting for a single corpus query before it is dropped. */
    private long corpusTimeoutMs = 10000;
  }

  /** Toggles for the corpora queried during retrieval. */
  @Getter
  @Setter
  public static class Corpora {
    private boolean documents = true;
    private boolean meetings = true;
    private boolean tabular = true;
  }

  @Getter
  @Setter
  public static class Citation {
    private int excerptLength = 200;
  }

  @Getter
  @Setter
  public static class Confidence {
    /** Relevance at or above which a citation counts as strong support. */
    private double highThreshold = 0.85;

    /** Relevance at or above which a citation counts as supporting the answer at all. */
    private double supportThreshold = 0.7;

    /** Number of supporting citations required for a high confidence answer. */
    private int minSupportingForHigh = 2;
  }
}
